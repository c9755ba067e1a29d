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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Body of a chat completion call
 */
@Value
@Builder
class ChatCompletionRequest {
    @Value
    static class Message {
        String role;
        String content;

        static Message user(String content) {
            return new Message("user", content);
        }
    }

    String model;

    @Singular
    List<Message> messages;

    @JsonProperty("max_tokens")
    int maxTokens;

    double temperature;
}
