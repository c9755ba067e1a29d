/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.termfix.core.assistant;

import java.util.concurrent.CompletableFuture;

/**
 * Boundary to the external free-text completion service.
 * <p>
 * Implementations complete the returned future exceptionally with
 * {@link com.phonepe.termfix.core.errors.UpstreamError} on network or status failures and with
 * {@link com.phonepe.termfix.core.errors.FormatError} if the response does not carry a reply. Implementations must
 * not block the calling thread.
 */
@FunctionalInterface
public interface AssistantClient {
    CompletableFuture<AssistantResponse> complete(AssistantRequest request);
}
