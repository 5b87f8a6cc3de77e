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

import static java.util.Objects.requireNonNull;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import com.linecorp.patchguard.internal.Jackson;

/**
 * Validates a {@link PatchSet} against {@link ForbiddenPaths} and encodes it as an
 * <a href="https://datatracker.ietf.org/doc/html/rfc6902">RFC 6902</a> document.
 *
 * <p>An empty {@link PatchSet} is encoded as the JSON literal {@code null}. Otherwise, the operations are
 * encoded as a compact JSON array in the order they were appended.</p>
 *
 * <p>This class is immutable and may be shared between threads.</p>
 */
public final class PatchSetSerializer {

    private static final Logger logger = LoggerFactory.getLogger(PatchSetSerializer.class);

    private static final byte[] NULL_BYTES = { 'n', 'u', 'l', 'l' };

    private static final PatchSetSerializer DEFAULT = new PatchSetSerializer(ForbiddenPaths.ofDefault());

    /**
     * Returns the {@link PatchSetSerializer} that uses {@link ForbiddenPaths#ofDefault()}.
     */
    public static PatchSetSerializer ofDefault() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link PatchSetSerializer} that rejects {@code test} operations at
     * the specified {@link ForbiddenPaths}.
     */
    public static PatchSetSerializer of(ForbiddenPaths forbiddenPaths) {
        return new PatchSetSerializer(forbiddenPaths);
    }

    private final ForbiddenPaths forbiddenPaths;

    private PatchSetSerializer(ForbiddenPaths forbiddenPaths) {
        this.forbiddenPaths = requireNonNull(forbiddenPaths, "forbiddenPaths");
    }

    /**
     * Returns the {@link ForbiddenPaths} used by this serializer.
     */
    public ForbiddenPaths forbiddenPaths() {
        return forbiddenPaths;
    }

    /**
     * Returns every {@code test} operation in the specified {@link PatchSet} that targets a forbidden path,
     * in ascending index order. An empty list is returned if the patch is valid.
     */
    public List<ForbiddenPathViolation> validate(PatchSet patchSet) {
        requireNonNull(patchSet, "patchSet");
        return validate(patchSet.operations());
    }

    private List<ForbiddenPathViolation> validate(List<JsonPatchOperation> operations) {
        if (forbiddenPaths.isEmpty()) {
            return ImmutableList.of();
        }

        final ImmutableList.Builder<ForbiddenPathViolation> builder = ImmutableList.builder();
        for (int i = 0; i < operations.size(); i++) {
            final JsonPatchOperation op = operations.get(i);
            if (!(op instanceof TestOperation)) {
                continue;
            }
            final String path = op.path();
            if (forbiddenPaths.contains(path)) {
                builder.add(new ForbiddenPathViolation(i, path));
            }
        }
        return builder.build();
    }

    /**
     * Validates and encodes the specified {@link PatchSet}.
     *
     * @return the UTF-8 encoded JSON Patch document, which is the JSON literal {@code null}
     *         for an empty patch
     * @throws ForbiddenPathException if one or more {@code test} operations target a forbidden path
     */
    public byte[] serialize(PatchSet patchSet) {
        requireNonNull(patchSet, "patchSet");
        final List<JsonPatchOperation> operations = patchSet.operations();
        final List<ForbiddenPathViolation> violations = validate(operations);
        if (!violations.isEmpty()) {
            logger.debug("Rejecting a JSON patch with {} forbidden test operation(s): {}",
                         violations.size(), violations);
            throw new ForbiddenPathException(violations);
        }

        if (operations.isEmpty()) {
            return NULL_BYTES.clone();
        }

        final byte[] bytes;
        try {
            bytes = Jackson.writeValueAsBytes(operations);
        } catch (JsonProcessingException e) {
            // Should never reach here because every operation holds a JSON tree.
            throw new IllegalStateException(e);
        }
        logger.trace("Serialized a JSON patch with {} operation(s)", operations.size());
        return bytes;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("forbiddenPaths", forbiddenPaths.paths())
                          .toString();
    }
}
