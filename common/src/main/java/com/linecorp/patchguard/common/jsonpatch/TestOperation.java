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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON Patch {@code test} operation.
 *
 * <p>For this operation, {@code path} is the pointer where the value should be
 * tested, and {@code value} is the value to test equality against.</p>
 *
 * <p>A {@code test} operation is typically used as a guard placed right before the operation it protects.
 * See {@link PatchSet#withRemove(String, TestOperation)}.</p>
 */
public final class TestOperation extends PathValueOperation {

    @JsonCreator
    TestOperation(@JsonProperty("path") final String path,
                  @JsonProperty("value") final JsonNode value) {
        super("test", path, value);
    }
}
