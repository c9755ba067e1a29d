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

package com.phonepe.termfix.core.classifier;

import com.google.common.base.Strings;
import com.phonepe.termfix.core.utils.TermFixUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a chunk of shell output carries evidence of a failed command. Stateless and thread safe.
 */
@Slf4j
public class OutputClassifier {
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\n|\\r");
    private static final Pattern ANSI_SEQUENCE = Pattern.compile("\\u001B(?:\\[[0-?]*[ -/]*[@-~]|\\][^\\u0007]*\\u0007|[@-Z\\\\-_])");

    private final List<FailureSignal> signals;

    public OutputClassifier() {
        this(Arrays.asList(FailureSignal.values()));
    }

    public OutputClassifier(List<FailureSignal> signals) {
        this.signals = List.copyOf(signals);
    }

    /**
     * Classifies a chunk of output
     * @param chunk Raw output as received from the shell
     * @return The evidence line, or empty if the chunk does not show a failure
     */
    public Optional<FailureEvidence> classify(final String chunk) {
        if (Strings.isNullOrEmpty(chunk)) {
            return Optional.empty();
        }
        final var text = stripAnsi(chunk);
        if (matchingSignal(text).isEmpty()) {
            return Optional.empty();
        }
        for (final var line : LINE_BREAK.split(text)) {
            final var trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            final var signal = matchingSignal(trimmed);
            if (signal.isPresent()) {
                log.debug("Failure signal {} in line: {}", signal.get(), TermFixUtils.snippet(trimmed));
                return Optional.of(new FailureEvidence(trimmed, signal.get()));
            }
        }
        log.debug("Chunk matched a failure signal but no single line did: {}", TermFixUtils.snippet(chunk));
        return Optional.empty();
    }

    static String stripAnsi(final String text) {
        return ANSI_SEQUENCE.matcher(text).replaceAll("");
    }

    private Optional<FailureSignal> matchingSignal(final String text) {
        return signals.stream()
                .filter(signal -> signal.matches(text))
                .findFirst();
    }
}
