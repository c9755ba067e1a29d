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

package com.phonepe.termfix.core.fetcher;

import com.google.common.base.Strings;
import com.phonepe.termfix.core.parser.SuggestionParser;
import lombok.NonNull;

import java.util.Objects;

/**
 * Builds the instruction sent to the assistant for a failed command
 */
public class PromptBuilder {
    private final PromptStyle style;

    public PromptBuilder() {
        this(PromptStyle.NUMBERED_ARROW);
    }

    public PromptBuilder(PromptStyle style) {
        this.style = Objects.requireNonNullElse(style, PromptStyle.NUMBERED_ARROW);
    }

    /**
     * Prompt for a command and the error line it produced, in the configured style
     */
    public String build(@NonNull String command, @NonNull String errorLine) {
        return switch (style) {
            case NUMBERED_ARROW -> numberedArrow(command, errorLine);
            case TILDE -> tilde(command, errorLine, null);
        };
    }

    /**
     * Prompt for a command whose exit code is known. Always uses {@link PromptStyle#TILDE}.
     */
    public String buildForExit(@NonNull String command, int exitCode, String stderr) {
        return tilde(command, Strings.nullToEmpty(stderr).trim(), exitCode);
    }

    private static String numberedArrow(String command, String errorLine) {
        return """
                You are an AI assistant that helps users correct invalid shell commands.
                Given the user's original command and the shell error message, suggest valid alternative shell commands.

                User command: %s
                Error message: %s
                %s
                Respond with multiple corrected shell command suggestions, each followed by a short description. Use this format exactly:
                1. <command> → <description>
                2. <command> → <description>

                Only use the arrow (→) as the separator between command and description. Do not use any other formats.
                Do not add any explanation or markdown."""
                .formatted(command, errorLine, relatedHint(command));
    }

    private static String tilde(String command, String errorLine, Integer exitCode) {
        final var exitContext = exitCode == null
                                ? ""
                                : """
                                  Exit code: %d
                                  Remember that a non-zero exit code (%d) indicates failure, even if there's no clear error message.
                                  """.formatted(exitCode, exitCode);
        final var error = errorLine.isEmpty() && exitCode != null
                          ? "Command failed with exit code %d".formatted(exitCode)
                          : errorLine;
        return """
                You are an AI assistant that helps users correct invalid or failed commands across terminal environments (e.g., shell, Python, Node.js, CLI tools).
                Given the user's original command and the error message, suggest valid alternative commands.

                User command: %s
                Error message: %s
                %s%s
                Respond with multiple corrected commands in this format:
                <corrected command> ~ <short description>

                If the command is valid, respond with:
                %s

                Do not add any explanation or markdown."""
                .formatted(command, error, exitContext, relatedHint(command), SuggestionParser.NO_CORRECTIONS_NEEDED);
    }

    private static String relatedHint(String command) {
        final var related = CommandHints.related(command);
        return related.equals(command)
               ? ""
               : "Possible related command: %s\n".formatted(related);
    }
}
