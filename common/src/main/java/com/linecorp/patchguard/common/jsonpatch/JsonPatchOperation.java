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

import static com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import static com.fasterxml.jackson.annotation.JsonTypeInfo.Id;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializable;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.jsontype.TypeSerializer;
import com.google.common.base.MoreObjects;
import com.google.common.base.MoreObjects.ToStringHelper;

/**
 * Base abstract class for one <a href="https://datatracker.ietf.org/doc/html/rfc6902">JSON Patch</a>
 * operation. Operations are immutable and compared structurally.
 *
 * <p>Operations are usually appended to a {@link PatchSet} rather than created directly:</p>
 *
 * <pre>{@code
 * final PatchSet patch =
 *         PatchSet.of()
 *                 .withRemove("/status/foo", PatchSet.testCondition("/status/condition", "bar"));
 * }</pre>
 *
 * <p>The {@code path} is kept exactly as given and is not parsed as a JSON Pointer. Supplying a well-formed
 * pointer is the caller's responsibility.</p>
 *
 * <h2>Defining a new operation kind</h2>
 *
 * <p>Extend this class, or {@link PathValueOperation} for a kind carrying a {@code value}, and append
 * instances with {@link PatchSet#with(JsonPatchOperation)}. A kind with more members than
 * {@code op} and {@code path} writes them in {@link #serializeMembers(JsonGenerator)} and
 * overrides {@link #equals(Object)} and {@link #hashCode()}.</p>
 */
@JsonTypeInfo(use = Id.NAME, property = "op")
@JsonSubTypes({
        @Type(name = "add", value = AddOperation.class),
        @Type(name = "remove", value = RemoveOperation.class),
        @Type(name = "replace", value = ReplaceOperation.class),
        @Type(name = "test", value = TestOperation.class)
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class JsonPatchOperation implements JsonSerializable {

    /**
     * Creates a new JSON Patch {@code add} operation.
     *
     * @param path the JSON Pointer for this operation
     * @param value the value to add
     */
    public static AddOperation add(String path, JsonNode value) {
        return new AddOperation(path, value);
    }

    /**
     * Creates a new JSON Patch {@code remove} operation.
     *
     * @param path the JSON Pointer to remove
     */
    public static RemoveOperation remove(String path) {
        return new RemoveOperation(path);
    }

    /**
     * Creates a new JSON Patch {@code replace} operation.
     *
     * @param path the JSON Pointer for this operation
     * @param value the new value to replace the existing value
     */
    public static ReplaceOperation replace(String path, JsonNode value) {
        return new ReplaceOperation(path, value);
    }

    /**
     * Creates a new JSON Patch {@code test} operation.
     *
     * <p>A processor aborts the whole patch if the value at the path does not match the expected value.
     * Note that a {@code test} on a path listed in {@link ForbiddenPaths} is rejected when the
     * {@link PatchSet} is serialized.
     *
     * @param path the JSON Pointer for this operation
     * @param value the value to test
     */
    public static TestOperation test(String path, JsonNode value) {
        return new TestOperation(path, value);
    }

    private final String op;
    private final String path;

    /**
     * Creates a new instance.
     *
     * @param op the operation name
     * @param path the JSON Pointer for this operation, written as is
     */
    protected JsonPatchOperation(final String op, final String path) {
        this.op = requireNonNull(op, "op");
        this.path = requireNonNull(path, "path");
    }

    /**
     * Returns the operation name.
     */
    public final String op() {
        return op;
    }

    /**
     * Returns the JSON Pointer for this operation.
     */
    public final String path() {
        return path;
    }

    /**
     * Writes {@code op}, {@code path} and then the members of {@link #serializeMembers(JsonGenerator)},
     * in that order.
     */
    @Override
    public final void serialize(final JsonGenerator gen,
                                final SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("op", op);
        gen.writeStringField("path", path);
        serializeMembers(gen);
        gen.writeEndObject();
    }

    /**
     * The {@code op} member already carries the type name, so no type information is added.
     */
    @Override
    public final void serializeWithType(final JsonGenerator gen,
                                        final SerializerProvider provider, final TypeSerializer typeSer)
            throws IOException {
        serialize(gen, provider);
    }

    /**
     * Writes the members that follow {@code op} and {@code path}. Writes nothing by default.
     */
    protected void serializeMembers(JsonGenerator gen) throws IOException {}

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final JsonPatchOperation that = (JsonPatchOperation) o;
        return op.equals(that.op) && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, path);
    }

    /**
     * Returns the {@link ToStringHelper} used by {@link #toString()}. Override to add more members.
     */
    protected ToStringHelper toStringHelper() {
        return MoreObjects.toStringHelper(this)
                          .add("op", op)
                          .add("path", path);
    }

    @Override
    public final String toString() {
        return toStringHelper().toString();
    }
}
