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
package com.linecorp.patchguard.internal;

import java.io.IOError;
import java.io.IOException;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;

public final class Jackson {

    private static final ObjectMapper compactMapper = new ObjectMapper();

    static {
        compactMapper.disable(SerializationFeature.INDENT_OUTPUT);
        // Sort the attributes so that the same value always produces the same patch.
        compactMapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public static final NullNode nullNode = NullNode.instance;

    public static <T> T readValue(String data, Class<T> type) throws JsonParseException, JsonMappingException {
        try {
            return compactMapper.readValue(data, type);
        } catch (JsonParseException | JsonMappingException e) {
            throw e;
        } catch (IOException e) {
            throw new IOError(e);
        }
    }

    public static byte[] writeValueAsBytes(Object value) throws JsonProcessingException {
        return compactMapper.writeValueAsBytes(value);
    }

    public static String writeValueAsString(Object value) throws JsonProcessingException {
        return compactMapper.writeValueAsString(value);
    }

    /**
     * Converts the specified {@code value} into a {@link JsonNode}. A {@code null} value becomes
     * {@link #nullNode} and an existing {@link JsonNode} is returned as a deep copy.
     *
     * @throws IllegalArgumentException if the value cannot be represented as JSON
     */
    public static JsonNode valueToTree(@Nullable Object value) {
        if (value == null) {
            return nullNode;
        }
        if (value instanceof JsonNode) {
            return ((JsonNode) value).deepCopy();
        }
        return compactMapper.valueToTree(value);
    }

    private Jackson() {}
}
