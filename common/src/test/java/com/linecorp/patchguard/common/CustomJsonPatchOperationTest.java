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
package com.linecorp.patchguard.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.Objects;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.node.IntNode;
import com.google.common.base.MoreObjects.ToStringHelper;

import com.linecorp.patchguard.common.jsonpatch.ForbiddenPaths;
import com.linecorp.patchguard.common.jsonpatch.JsonPatchOperation;
import com.linecorp.patchguard.common.jsonpatch.PatchSet;
import com.linecorp.patchguard.common.jsonpatch.PatchSetSerializer;
import com.linecorp.patchguard.common.jsonpatch.PathValueOperation;

class CustomJsonPatchOperationTest {

    @Test
    void appendCopyOperation() {
        final PatchSet patch = PatchSet.of()
                                       .withTest("/spec/replicas", 3)
                                       .with(new CopyOperation("/spec/replicas", "/status/replicas"));

        assertThat(patch.marshalAsString()).isEqualTo(
                "[{\"op\":\"test\",\"path\":\"/spec/replicas\",\"value\":3}," +
                "{\"op\":\"copy\",\"path\":\"/status/replicas\",\"from\":\"/spec/replicas\"}]");
    }

    @Test
    void appendPathValueOperation() {
        final PatchSet patch = PatchSet.of().with(new IncrementOperation("/status/restarts", 1));

        assertThat(patch.marshalAsString())
                .isEqualTo("[{\"op\":\"increment\",\"path\":\"/status/restarts\",\"value\":1}]");
        assertThat(patch.operations().get(0))
                .isEqualTo(new IncrementOperation("/status/restarts", 1))
                .isNotEqualTo(new IncrementOperation("/status/restarts", 2))
                .hasToString("IncrementOperation{op=increment, path=/status/restarts, value=1}");
    }

    @Test
    void customKindsAtForbiddenPathsAreAccepted() {
        final PatchSet patch = PatchSet.of()
                                       .with(new CopyOperation("/metadata/name",
                                                               ForbiddenPaths.RESOURCE_VERSION))
                                       .with(new IncrementOperation(ForbiddenPaths.RESOURCE_VERSION, 1));
        assertThat(PatchSetSerializer.ofDefault().validate(patch)).isEmpty();
    }

    @Test
    void structuralEquality() {
        assertThat(new CopyOperation("/a", "/b"))
                .isEqualTo(new CopyOperation("/a", "/b"))
                .hasSameHashCodeAs(new CopyOperation("/a", "/b"))
                .isNotEqualTo(new CopyOperation("/c", "/b"))
                .hasToString("CopyOperation{op=copy, path=/b, from=/a}");
    }

    private static final class CopyOperation extends JsonPatchOperation {

        private final String from;

        CopyOperation(String from, String path) {
            super("copy", path);
            this.from = from;
        }

        @Override
        protected void serializeMembers(JsonGenerator gen) throws IOException {
            gen.writeStringField("from", from);
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && from.equals(((CopyOperation) o).from);
        }

        @Override
        public int hashCode() {
            return Objects.hash(super.hashCode(), from);
        }

        @Override
        protected ToStringHelper toStringHelper() {
            return super.toStringHelper().add("from", from);
        }
    }

    private static final class IncrementOperation extends PathValueOperation {

        IncrementOperation(String path, int delta) {
            super("increment", path, IntNode.valueOf(delta));
        }
    }
}
