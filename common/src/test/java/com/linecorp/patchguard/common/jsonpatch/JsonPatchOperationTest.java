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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import com.linecorp.patchguard.internal.Jackson;

class JsonPatchOperationTest {

    private static final String PATH = "/status/condition";

    @Test
    void structuralEquality() {
        assertThat(JsonPatchOperation.test(PATH, TextNode.valueOf("foo")))
                .isEqualTo(PatchSet.testCondition("/status/condition", "foo"))
                .hasSameHashCodeAs(PatchSet.testCondition("/status/condition", "foo"));
        assertThat(JsonPatchOperation.test(PATH, TextNode.valueOf("foo")))
                .isNotEqualTo(JsonPatchOperation.test(PATH, TextNode.valueOf("bar")))
                .isNotEqualTo(JsonPatchOperation.add(PATH, TextNode.valueOf("foo")))
                .isNotEqualTo(JsonPatchOperation.remove(PATH));
        assertThat(JsonPatchOperation.remove(PATH)).isEqualTo(JsonPatchOperation.remove(PATH));
    }

    @Test
    void valueIsCopied() {
        final ObjectNode value = JsonNodeFactory.instance.objectNode().put("a", 1);
        final TestOperation op = JsonPatchOperation.test(PATH, value);
        value.put("b", 2);
        ((ObjectNode) op.value()).put("c", 3);

        assertThat(op.value()).isEqualTo(JsonNodeFactory.instance.objectNode().put("a", 1));
    }

    @Test
    void nullArgumentsAreRejected() {
        assertThatNullPointerException().isThrownBy(() -> JsonPatchOperation.remove(null));
        assertThatNullPointerException().isThrownBy(() -> JsonPatchOperation.test(PATH, null));
    }

    @Test
    void deserialize() throws Exception {
        assertThat(Jackson.readValue("{\"op\":\"test\",\"path\":\"/status/condition\",\"value\":\"foo\"}",
                                     JsonPatchOperation.class))
                .isInstanceOf(TestOperation.class)
                .isEqualTo(JsonPatchOperation.test(PATH, TextNode.valueOf("foo")));
        assertThat(Jackson.readValue("{\"op\":\"remove\",\"path\":\"/status/condition\"}",
                                     JsonPatchOperation.class))
                .isInstanceOf(RemoveOperation.class)
                .isEqualTo(JsonPatchOperation.remove(PATH));
        assertThat(Jackson.readValue("{\"op\":\"replace\",\"path\":\"/status/condition\",\"value\":1}",
                                     JsonPatchOperation.class))
                .isEqualTo(JsonPatchOperation.replace(PATH, IntNode.valueOf(1)));
    }

    @Test
    void serializedPatchCanBeReadBack() throws Exception {
        final PatchSet patch = PatchSet.of()
                                       .withTest("/status/secondCondition", "foo")
                                       .withRemove("/status/foo",
                                                   PatchSet.testCondition("/status/condition", "bar"));
        final JsonPatchOperation[] operations =
                Jackson.readValue(patch.marshalAsString(), JsonPatchOperation[].class);
        assertThat(operations).containsExactlyElementsOf(patch.operations());
    }

    @Test
    void stringRepresentation() {
        assertThat(JsonPatchOperation.test(PATH, TextNode.valueOf("foo")))
                .hasToString("TestOperation{op=test, path=/status/condition, value=\"foo\"}");
        assertThat(JsonPatchOperation.remove(PATH))
                .hasToString("RemoveOperation{op=remove, path=/status/condition}");
    }
}
