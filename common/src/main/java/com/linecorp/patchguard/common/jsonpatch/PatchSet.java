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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import com.linecorp.patchguard.internal.Jackson;

/**
 * Builds a <a href="https://datatracker.ietf.org/doc/html/rfc6902">JSON Patch</a> document one operation at
 * a time.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * final byte[] patch =
 *         PatchSet.of()
 *                 .withTest("/status/phase", "Running")
 *                 .withRemove("/status/foo", PatchSet.testCondition("/status/condition", "bar"))
 *                 .marshal();
 * }</pre>
 *
 * <p>Operations are emitted in the order they were appended. Nothing is validated while appending,
 * and paths are written exactly as given. {@code test} operations on {@link ForbiddenPaths} are
 * rejected by {@link #marshal()}.</p>
 *
 * <p>This class is not thread-safe.</p>
 */
public final class PatchSet {

    /**
     * Returns a new empty {@link PatchSet}.
     */
    public static PatchSet of() {
        return new PatchSet();
    }

    /**
     * Returns a {@code test} operation which is not attached to any {@link PatchSet}, to be used as
     * the guard of {@link #withRemove(String, TestOperation)}.
     *
     * @param path the JSON Pointer to test
     * @param value the expected value, converted with Jackson
     */
    public static TestOperation testCondition(String path, @Nullable Object value) {
        return JsonPatchOperation.test(path, Jackson.valueToTree(value));
    }

    /**
     * Returns a new {@link PatchSet} holding the operations of the specified {@link PatchSet}s, in order.
     * Empty {@link PatchSet}s contribute nothing. The specified {@link PatchSet}s are not modified.
     */
    public static PatchSet merge(@Nullable PatchSet... patchSets) {
        if (patchSets == null) {
            return new PatchSet();
        }
        return merge(Arrays.asList(patchSets));
    }

    /**
     * Returns a new {@link PatchSet} holding the operations of the specified {@link PatchSet}s, in order.
     * Empty {@link PatchSet}s contribute nothing. The specified {@link PatchSet}s are not modified.
     */
    public static PatchSet merge(Iterable<PatchSet> patchSets) {
        requireNonNull(patchSets, "patchSets");
        final PatchSet merged = new PatchSet();
        for (PatchSet patchSet : patchSets) {
            requireNonNull(patchSet, "patchSets contains null.");
            merged.operations.addAll(patchSet.operations);
        }
        return merged;
    }

    private final List<JsonPatchOperation> operations = new ArrayList<>();

    /**
     * Creates a new empty instance.
     */
    public PatchSet() {}

    /**
     * Appends a {@code test} operation.
     *
     * @param path the JSON Pointer to test
     * @param value the expected value, converted with Jackson
     */
    public PatchSet withTest(String path, @Nullable Object value) {
        return with(testCondition(path, value));
    }

    /**
     * Appends a {@code remove} operation.
     */
    public PatchSet withRemove(String path) {
        return withRemove(path, null);
    }

    /**
     * Appends a {@code remove} operation preceded by the specified {@code condition}, if any.
     * The condition may test a path other than the one being removed.
     *
     * @param path the JSON Pointer to remove
     * @param condition the {@code test} operation that guards the removal
     * @see #testCondition(String, Object)
     */
    public PatchSet withRemove(String path, @Nullable TestOperation condition) {
        final RemoveOperation remove = JsonPatchOperation.remove(path);
        if (condition != null) {
            operations.add(condition);
        }
        operations.add(remove);
        return this;
    }

    /**
     * Appends the specified operation, which may be of a kind defined outside this package.
     */
    public PatchSet with(JsonPatchOperation operation) {
        operations.add(requireNonNull(operation, "operation"));
        return this;
    }

    /**
     * Returns whether this patch has no operations.
     */
    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /**
     * Returns the number of operations.
     */
    public int size() {
        return operations.size();
    }

    /**
     * Returns the operations appended so far, in order.
     */
    public List<JsonPatchOperation> operations() {
        return ImmutableList.copyOf(operations);
    }

    /**
     * Serializes this patch with {@link PatchSetSerializer#ofDefault()}.
     *
     * @return the UTF-8 encoded JSON Patch document, which is the JSON literal {@code null}
     *         for an empty patch
     * @throws ForbiddenPathException if a {@code test} operation targets {@link ForbiddenPaths#ofDefault()}
     */
    public byte[] marshal() {
        return PatchSetSerializer.ofDefault().serialize(this);
    }

    /**
     * Serializes this patch with {@link PatchSetSerializer#ofDefault()} into a {@link String}.
     *
     * @throws ForbiddenPathException if a {@code test} operation targets {@link ForbiddenPaths#ofDefault()}
     */
    public String marshalAsString() {
        return new String(marshal(), StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("operations", operations)
                          .toString();
    }
}
