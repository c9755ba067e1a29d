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

package com.phonepe.termfix.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Suggestions returned for one failure. Order reflects the ranking of the assistant and is never changed.
 * An empty batch is a valid outcome.
 */
@Value
@Builder
@Jacksonized
public class SuggestionBatch {
    private static final SuggestionBatch EMPTY = new SuggestionBatch(List.of());

    @Singular
    List<Suggestion> suggestions;

    public static SuggestionBatch empty() {
        return EMPTY;
    }

    public static SuggestionBatch of(List<Suggestion> suggestions) {
        return new SuggestionBatch(List.copyOf(suggestions));
    }

    public static SuggestionBatch of(Suggestion... suggestions) {
        return new SuggestionBatch(List.of(suggestions));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return suggestions.isEmpty();
    }

    @JsonIgnore
    public int size() {
        return suggestions.size();
    }
}
