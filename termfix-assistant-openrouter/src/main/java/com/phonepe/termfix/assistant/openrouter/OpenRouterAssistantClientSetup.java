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

package com.phonepe.termfix.assistant.openrouter;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * Endpoint configuration for {@link OpenRouterAssistantClient}
 */
@Value
@Builder
@With
public class OpenRouterAssistantClientSetup {
    public static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";

    public static final OpenRouterAssistantClientSetup DEFAULT = OpenRouterAssistantClientSetup.builder().build();

    /**
     * Base url of an OpenAI compatible api. The chat completion path is appended to this.
     */
    @Builder.Default
    String baseUrl = DEFAULT_BASE_URL;

    /**
     * Extra headers sent with every call. OpenRouter uses HTTP-Referer and X-Title for attribution.
     */
    @Builder.Default
    Map<String, String> headers = Map.of();
}
