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

/**
 * An exception raised when a JSON Patch cannot be built or serialized.
 */
public class JsonPatchException extends RuntimeException {

    private static final long serialVersionUID = -2870470381429713437L;

    /**
     * Creates a new instance.
     */
    public JsonPatchException(String message) {
        super(message);
    }
}
