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

package com.phonepe.termfix.core.session;

import com.phonepe.termfix.core.classifier.FailureEvidence;
import com.phonepe.termfix.core.classifier.FailureSignal;
import com.phonepe.termfix.core.model.ErrorEvent;
import com.phonepe.termfix.core.tracker.CommandTracker;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Attributes a failure to a command. Keystroke tracking is not always right (history recall, tab completion, output
 * of a previous command arriving late), so the evidence line is used to correct the tracked command where it names
 * the failing program.
 */
@Slf4j
public class CommandCorrelator {
    private static final Pattern SHELL_NOT_FOUND = Pattern.compile("\\w+:\\s+command not found:\\s+(\\S+)",
                                                                   Pattern.CASE_INSENSITIVE);
    private static final Pattern NAME_NOT_FOUND = Pattern.compile("([^\\s:]+):\\s+command not found");

    static final String NODE_VERSION_COMMAND = "node -ver";
    static final String PYTHON_VERSION_COMMAND = "python --v";

    /**
     * Correlates the evidence with the tracked command. Updates the last command of the tracker if the evidence
     * points elsewhere.
     */
    public ErrorEvent correlate(final CommandTracker tracker, final FailureEvidence evidence) {
        final var line = evidence.getLine();
        final var lastCommand = tracker.getLastCommand();
        final var command = attributedCommand(tracker, evidence).orElse(lastCommand);
        if (!command.equals(lastCommand)) {
            log.debug("Failure attributed to {} instead of {}", command, lastCommand);
            tracker.correctLastCommand(command);
        }
        return new ErrorEvent(line, command);
    }

    private Optional<String> attributedCommand(CommandTracker tracker, FailureEvidence evidence) {
        final var line = evidence.getLine();
        final var lastCommand = tracker.getLastCommand();
        if (evidence.isCommandNotFound()) {
            return missingCommandName(line)
                    .map(name -> tracker.getHistory()
                            .find(recent -> recent.equals(name) || recent.startsWith(name + " "))
                            .orElseGet(() -> lastCommand.equals(name) || lastCommand.startsWith(name + " ")
                                             ? lastCommand
                                             : name));
        }
        if (isNodeVersionError(line) && !lastCommand.contains("node")) {
            return Optional.of(NODE_VERSION_COMMAND);
        }
        if (isPythonVersionError(line) && !lastCommand.contains("python")) {
            return Optional.of(PYTHON_VERSION_COMMAND);
        }
        return Optional.empty();
    }

    static Optional<String> missingCommandName(final String line) {
        final var shellMatcher = SHELL_NOT_FOUND.matcher(line);
        if (shellMatcher.find()) {
            return Optional.of(shellMatcher.group(1).trim());
        }
        final var nameMatcher = NAME_NOT_FOUND.matcher(line);
        if (nameMatcher.find()) {
            return Optional.of(nameMatcher.group(1).trim());
        }
        return Optional.empty();
    }

    private static boolean isNodeVersionError(String line) {
        return (line.contains("bad option") && line.contains("-ver"))
                || FailureSignal.NODE_BAD_OPTION.matches(line);
    }

    private static boolean isPythonVersionError(String line) {
        return (line.contains("python") || line.equals("unknown option --v"))
                && (line.contains("unknown option") || line.contains("invalid option"))
                && (line.contains("--v") || line.contains("-ver"));
    }
}
