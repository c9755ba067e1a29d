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

package com.phonepe.termfix.core.parser;

import com.google.common.base.Strings;
import com.phonepe.termfix.core.model.Suggestion;
import com.phonepe.termfix.core.model.SuggestionBatch;
import com.phonepe.termfix.core.utils.TermFixUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns the free-text reply of the assistant into an ordered batch of suggestions. Never fails: a reply that cannot
 * be understood yields an empty batch.
 */
@Slf4j
public class SuggestionParser {
    public static final String NO_CORRECTIONS_NEEDED = "Command is valid. No suggestions needed.";

    /**
     * Substituted by callers when a reply yields nothing
     */
    public static final Suggestion PARSE_MISS = Suggestion.of("echo 'Unable to parse suggestions'",
                                                              "Try a different command or check API response format");

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private final List<LineMatcher> matchers;

    public SuggestionParser() {
        this(Arrays.asList(LineFormat.values()));
    }

    public SuggestionParser(List<? extends LineMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    public SuggestionBatch parse(final String reply) {
        if (Strings.isNullOrEmpty(reply) || reply.isBlank()) {
            return SuggestionBatch.empty();
        }
        if (reply.contains(NO_CORRECTIONS_NEEDED)) {
            log.debug("Assistant reports the command as valid");
            return SuggestionBatch.of(Suggestion.of(NO_CORRECTIONS_NEEDED, ""));
        }
        final var lines = LINE_BREAK.split(reply);
        final var suggestions = new ArrayList<Suggestion>();
        for (final var line : lines) {
            if (line.isBlank()) {
                continue;
            }
            final var suggestion = matchLine(line);
            if (suggestion.isPresent()) {
                suggestions.add(suggestion.get());
            }
            else {
                log.debug("Line did not match any suggestion format: {}", TermFixUtils.snippet(line));
            }
        }
        if (suggestions.isEmpty()) {
            log.debug("No structured suggestions found. Looking for lines starting with known commands.");
            for (final var line : lines) {
                LineFormat.splitKnownCommand(line).ifPresent(suggestions::add);
            }
        }
        if (suggestions.isEmpty()) {
            log.warn("No suggestions could be parsed from reply: {}", TermFixUtils.snippet(reply));
        }
        return SuggestionBatch.of(suggestions);
    }

    private Optional<Suggestion> matchLine(String line) {
        for (final var matcher : matchers) {
            final var suggestion = matcher.match(line);
            if (suggestion.isPresent()) {
                return suggestion;
            }
        }
        return Optional.empty();
    }
}
