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

package com.phonepe.termfix.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Failure categories of the suggestion pipeline
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    INPUT_ERROR("Invalid input: %s", false),
    CONFIG_ERROR("Missing configuration: %s", false),
    UPSTREAM_ERROR("Assistant call failed: %s", true),
    FORMAT_ERROR("Unexpected assistant response: %s", true),
    ;

    private final String message;
    private final boolean retryable;
}
