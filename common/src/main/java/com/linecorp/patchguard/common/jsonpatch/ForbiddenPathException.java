/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.patchguard.common.jsonpatch;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A {@link JsonPatchException} raised when a {@link PatchSet} contains one or more {@code test} operations
 * whose path is listed in the {@link ForbiddenPaths}. All violations found in the patch are reported
 * at once, in ascending index order.
 */
public final class ForbiddenPathException extends JsonPatchException {

    private static final long serialVersionUID = 6160386322271946095L;

    private final List<ForbiddenPathViolation> violations;

    /**
     * Creates a new instance.
     *
     * @param violations the violations, which must not be empty
     */
    public ForbiddenPathException(Iterable<ForbiddenPathViolation> violations) {
        this(ImmutableList.copyOf(violations));
    }

    private ForbiddenPathException(ImmutableList<ForbiddenPathViolation> violations) {
        super(format(violations));
        this.violations = violations;
    }

    /**
     * Returns the violations that caused this exception.
     */
    public List<ForbiddenPathViolation> violations() {
        return violations;
    }

    private static String format(List<ForbiddenPathViolation> violations) {
        checkArgument(!violations.isEmpty(), "violations is empty.");
        if (violations.size() == 1) {
            return violations.get(0).toString();
        }
        // List.toString() renders as "[a, b, ...]".
        return violations.toString();
    }
}
