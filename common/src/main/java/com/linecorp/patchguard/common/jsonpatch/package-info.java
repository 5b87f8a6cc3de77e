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
/**
 * Builds <a href="https://datatracker.ietf.org/doc/html/rfc6902">JSON Patch</a> documents which never
 * {@code test} a forbidden path, such as a resource's version token.
 *
 * <p>The main class is {@link com.linecorp.patchguard.common.jsonpatch.PatchSet}.</p>
 */
@NonNullByDefault
package com.linecorp.patchguard.common.jsonpatch;

import com.linecorp.patchguard.common.util.NonNullByDefault;
