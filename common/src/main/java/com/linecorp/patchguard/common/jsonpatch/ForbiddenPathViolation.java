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
import static java.util.Objects.requireNonNull;

/**
 * A {@code test} operation found at a forbidden path while validating a {@link PatchSet}.
 */
public final class ForbiddenPathViolation {

    private final int index;
    private final String path;

    ForbiddenPathViolation(int index, String path) {
        checkArgument(index >= 0, "index: %s (expected: >= 0)", index);
        this.index = index;
        this.path = requireNonNull(path, "path");
    }

    /**
     * Returns the zero-based position of the offending operation in the patch.
     */
    public int index() {
        return index;
    }

    /**
     * Returns the forbidden JSON Pointer targeted by the operation.
     */
    public String path() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ForbiddenPathViolation)) {
            return false;
        }
        final ForbiddenPathViolation that = (ForbiddenPathViolation) o;
        return index == that.index && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return index * 31 + path.hashCode();
    }

    @Override
    public String toString() {
        return "test operation at index: " + index + " contains forbidden path: \"" + path + '"';
    }
}
