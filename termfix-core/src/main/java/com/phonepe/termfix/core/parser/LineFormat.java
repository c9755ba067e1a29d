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

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reply line conventions, in the order they are tried. The first one that matches a line wins.
 */
public enum LineFormat implements LineMatcher {
    /**
     * {@code 1. node -v → Show Node.js version}. Split at the first {@code →}. ASCII arrows ({@code ->}, {@code =>})
     * are only separators on lines without one, since commands may contain them.
     */
    NUMBERED_ARROW {
        private final Pattern arrow = Pattern.compile("^\\s*\\d+\\.\\s+([^→]+?)\\s*→\\s*(.+)$");
        private final Pattern asciiArrow = Pattern.compile("^\\s*\\d+\\.\\s+(.+?)\\s*(?:->|=>)\\s*(.+)$");

        @Override
        public Optional<Suggestion> match(String line) {
            return fromGroups(line.contains("→")
                              ? arrow.matcher(line)
                              : asciiArrow.matcher(line));
        }
    },
    /**
     * {@code 1. node -v: Show Node.js version}
     */
    NUMBERED_COLON {
        private final Pattern pattern = Pattern.compile("^\\s*\\d+\\.\\s+([^:]+):\\s*(.+)$");

        @Override
        public Optional<Suggestion> match(String line) {
            return fromGroups(pattern.matcher(line));
        }
    },
    /**
     * {@code 1. node -v - Show Node.js version}
     */
    NUMBERED_HYPHEN {
        private final Pattern pattern = Pattern.compile("^\\s*\\d+\\.\\s+(.+?) - (.+)$");

        @Override
        public Optional<Suggestion> match(String line) {
            return fromGroups(pattern.matcher(line));
        }
    },
    /**
     * {@code 1. `node -v` -- Show Node.js version}
     */
    NUMBERED_QUOTED {
        private final Pattern pattern = Pattern.compile("^\\s*\\d+\\.\\s+[`'\"](.*?)[`'\"]\\s+(?:-+|—|–)\\s+(.+)$");

        @Override
        public Optional<Suggestion> match(String line) {
            return fromGroups(pattern.matcher(line));
        }
    },
    /**
     * {@code mkdir ~ Create directory}. Numbering is optional.
     */
    TILDE {
        private final Pattern pattern = Pattern.compile("^\\s*(?:\\d+\\.\\s+)?(.+?)\\s+~\\s+(.+)$");

        @Override
        public Optional<Suggestion> match(String line) {
            return fromGroups(pattern.matcher(line));
        }
    },
    /**
     * A separator ({@code →} first, then {@code ~}) anywhere in the line. Splits at its first occurrence.
     */
    SEPARATOR_ANYWHERE {
        @Override
        public Optional<Suggestion> match(String line) {
            final var text = SuggestionText.withoutNumbering(line);
            for (final var separator : SEPARATORS) {
                final var index = text.indexOf(separator);
                if (index > 0) {
                    return SuggestionText.suggestion(text.substring(0, index),
                                                     text.substring(index + separator.length()));
                }
            }
            return Optional.empty();
        }
    },
    /**
     * Numbered line without any recognised separator. If it starts with a well known program name the line is
     * split at the first whitespace, otherwise the whole text becomes the command.
     */
    NUMBERED_COMMAND {
        @Override
        public Optional<Suggestion> match(String line) {
            if (!SuggestionText.isNumbered(line)) {
                return Optional.empty();
            }
            final var text = SuggestionText.withoutNumbering(line).trim();
            return splitKnownCommand(text)
                    .or(() -> SuggestionText.suggestion(text, SuggestionText.PLACEHOLDER_DESCRIPTION));
        }
    },
    ;

    private static final String[] SEPARATORS = {"→", "~"};
    private static final Pattern FIRST_WHITESPACE = Pattern.compile("\\s+");

    /**
     * Program names recognised at the start of a line without separators
     */
    public static final Set<String> KNOWN_COMMANDS = Set.of(
            "git", "node", "npm", "npx", "yarn", "python", "python3", "pip", "pip3", "cd", "ls", "mkdir", "touch",
            "rm", "cp", "mv", "echo", "cat", "grep", "ssh", "curl", "wget", "docker", "kubectl", "brew", "apt",
            "java", "mvn");

    /**
     * Splits a line that starts with a known program name at its first whitespace. Numbering is ignored, so this
     * also applies to bare lines.
     */
    public static Optional<Suggestion> splitKnownCommand(final String line) {
        final var text = SuggestionText.withoutNumbering(line).trim();
        final var parts = FIRST_WHITESPACE.split(text, 2);
        final var token = SuggestionText.command(parts[0]);
        if (!KNOWN_COMMANDS.contains(token.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return SuggestionText.suggestion(token, parts.length > 1 ? parts[1] : "");
    }

    private static Optional<Suggestion> fromGroups(Matcher matcher) {
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return SuggestionText.suggestion(matcher.group(1), matcher.group(2));
    }
}
