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

import com.phonepe.termfix.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link SuggestionBatch}
 */
class SuggestionBatchTest {

    @Test
    @SneakyThrows
    void testJsonShape() {
        final var mapper = JsonUtils.createMapper();
        final var batch = SuggestionBatch.of(Suggestion.of("git status", "Show the working tree status"));
        final var json = mapper.readTree(mapper.writeValueAsString(batch));
        assertEquals("git status", json.at("/suggestions/0/command").asText());
        assertEquals("Show the working tree status", json.at("/suggestions/0/description").asText());
        assertFalse(json.has("empty"));

        final var parsed = mapper.readValue("""
                                                    {
                                                      "suggestions": [
                                                        { "command": "ls -la", "description": "List", "rank": 1 }
                                                      ]
                                                    }
                                                    """, SuggestionBatch.class);
        assertEquals(Suggestion.of("ls -la", "List"), parsed.getSuggestions().get(0));
    }

    @Test
    void testEmpty() {
        assertTrue(SuggestionBatch.empty().isEmpty());
        assertTrue(JsonUtils.empty(JsonUtils.createMapper().createObjectNode()));
        assertEquals(0, SuggestionBatch.builder().build().size());
    }
}
