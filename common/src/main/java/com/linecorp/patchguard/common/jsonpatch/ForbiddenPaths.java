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
import java.util.Set;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonPointer;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * The set of JSON Pointers that a {@code test} operation must never target.
 *
 * <p>A {@code test} against a concurrency-control field, such as a resource's version token, can defeat
 * the optimistic-concurrency check performed by the server that applies the patch. Such fields are
 * listed here and every {@link PatchSet} is checked against them when it is serialized.</p>
 *
 * <p>An instance can also be read from JSON:</p>
 * <pre>{@code
 * { "paths": [ "/metadata/resourceVersion", "/metadata/generation" ] }
 * }</pre>
 */
public final class ForbiddenPaths {

    /**
     * The JSON Pointer of a resource's version token.
     */
    public static final String RESOURCE_VERSION = "/metadata/resourceVersion";

    private static final ForbiddenPaths DEFAULT = new ForbiddenPaths(ImmutableSet.of(RESOURCE_VERSION));

    private static final ForbiddenPaths EMPTY = new ForbiddenPaths(ImmutableSet.of());

    /**
     * Returns the default {@link ForbiddenPaths}, which contains only {@value #RESOURCE_VERSION}.
     */
    public static ForbiddenPaths ofDefault() {
        return DEFAULT;
    }

    /**
     * Returns an empty {@link ForbiddenPaths} which accepts a {@code test} at any path.
     */
    public static ForbiddenPaths of() {
        return EMPTY;
    }

    /**
     * Returns a new {@link ForbiddenPaths} which contains the specified JSON Pointers.
     */
    public static ForbiddenPaths of(String... paths) {
        requireNonNull(paths, "paths");
        return of(ImmutableList.copyOf(paths));
    }

    /**
     * Returns a new {@link ForbiddenPaths} which contains the specified JSON Pointers.
     */
    public static ForbiddenPaths of(Iterable<String> paths) {
        requireNonNull(paths, "paths");
        final ImmutableSet<String> set = ImmutableSet.copyOf(paths);
        if (set.isEmpty()) {
            return EMPTY;
        }
        return new ForbiddenPaths(set);
    }

    @JsonCreator
    static ForbiddenPaths ofJson(@JsonProperty("paths") @Nullable List<String> paths) {
        return paths != null ? of(paths) : EMPTY;
    }

    private final Set<String> paths;

    private ForbiddenPaths(ImmutableSet<String> paths) {
        paths.forEach(ForbiddenPaths::validatePointer);
        this.paths = paths;
    }

    private static void validatePointer(String path) {
        try {
            JsonPointer.compile(path);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("path: " + path + " (expected: a JSON Pointer)", e);
        }
    }

    /**
     * Returns the JSON Pointers in this set.
     */
    @JsonProperty
    public Set<String> paths() {
        return paths;
    }

    /**
     * Returns whether the specified JSON Pointer is forbidden.
     */
    public boolean contains(String path) {
        requireNonNull(path, "path");
        return paths.contains(path);
    }

    /**
     * Returns whether this set has no JSON Pointers.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return paths.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ForbiddenPaths)) {
            return false;
        }
        return paths.equals(((ForbiddenPaths) o).paths);
    }

    @Override
    public int hashCode() {
        return paths.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("paths", paths)
                          .toString();
    }
}
