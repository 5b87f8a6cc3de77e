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

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects.ToStringHelper;

/**
 * Base class for patch operations taking a {@code value} in addition to a {@code path}, such as
 * {@code test}, {@code add} and {@code replace}.
 */
public abstract class PathValueOperation extends JsonPatchOperation {

    private final JsonNode value;

    /**
     * Creates a new instance. The {@code value} is copied.
     */
    protected PathValueOperation(final String op, final String path, final JsonNode value) {
        super(op, path);
        this.value = requireNonNull(value, "value").deepCopy();
    }

    /**
     * Returns a copy of the JSON value of this operation.
     */
    public final JsonNode value() {
        return value.deepCopy();
    }

    @Override
    protected final void serializeMembers(JsonGenerator gen) throws IOException {
        gen.writeFieldName("value");
        gen.writeTree(value);
    }

    @Override
    public final boolean equals(Object o) {
        return super.equals(o) && value.equals(((PathValueOperation) o).value);
    }

    @Override
    public final int hashCode() {
        return super.hashCode() * 31 + value.hashCode();
    }

    @Override
    protected final ToStringHelper toStringHelper() {
        return super.toStringHelper().add("value", value);
    }
}
