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

import com.phonepe.termfix.core.model.Suggestion;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Clean-up of command and description text picked out of a reply line
 */
@UtilityClass
public class SuggestionText {
    public static final String PLACEHOLDER_DESCRIPTION = "Suggested command";

    private static final String QUOTES = "`'\"";
    private static final Pattern LABEL_PREFIX = Pattern.compile("^[A-Za-z][\\w-]*:\\s+");
    private static final Pattern NUMBERING = Pattern.compile("^\\s*\\d+\\.\\s+");

    /**
     * Strips label artifacts such as {@code Command: } and quotes/backticks wrapping the whole command. Quotes that
     * belong to the command itself are kept.
     */
    public static String command(final String raw) {
        var text = unwrapQuotes(StringUtils.trimToEmpty(raw));
        text = LABEL_PREFIX.matcher(text).replaceFirst("");
        return unwrapQuotes(text);
    }

    public static String description(final String raw) {
        return StringUtils.strip(StringUtils.trimToEmpty(raw), QUOTES).trim();
    }

    public static String withoutNumbering(final String line) {
        return NUMBERING.matcher(line).replaceFirst("");
    }

    public static boolean isNumbered(final String line) {
        return NUMBERING.matcher(line).find();
    }

    /**
     * Builds a suggestion from raw parts. Empty if nothing is left of the command after clean-up.
     */
    public static Optional<Suggestion> suggestion(final String rawCommand, final String rawDescription) {
        final var command = command(rawCommand);
        if (command.isEmpty()) {
            return Optional.empty();
        }
        final var description = description(rawDescription);
        return Optional.of(Suggestion.of(command, description.isEmpty() ? PLACEHOLDER_DESCRIPTION : description));
    }

    private static String unwrapQuotes(final String text) {
        var current = text.trim();
        while (current.length() >= 2
                && QUOTES.indexOf(current.charAt(0)) >= 0
                && current.charAt(current.length() - 1) == current.charAt(0)) {
            current = current.substring(1, current.length() - 1).trim();
        }
        return current;
    }
}
