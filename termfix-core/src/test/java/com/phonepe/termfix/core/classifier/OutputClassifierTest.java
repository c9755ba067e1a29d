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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link OutputClassifier}
 */
class OutputClassifierTest {
    private final OutputClassifier classifier = new OutputClassifier();

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "zsh: command not found: gti|SHELL_COMMAND_NOT_FOUND",
            "bash: gti: command not found|COMMAND_NOT_FOUND",
            "mkdir: /root/x: Permission denied|PERMISSION_DENIED",
            "cat: foo.txt: No such file or directory|NO_SUCH_FILE",
            "ls: cannot access 'nope': No such file or directory|NO_SUCH_FILE",
            "/usr/local/bin/node: bad option: -ver|NODE_BAD_OPTION",
            "git: 'stauts' is not a git command. See 'git --help'.|",
            "unknown option --v|UNKNOWN_OPTION",
            "Traceback (most recent call last):|TRACEBACK",
            "ModuleNotFoundError: No module named 'requests'|MODULE_NOT_FOUND",
            "npm ERR! code E404|",
            "fatal: could not read Username|COULD_NOT",
    })
    void testSignals(String line, String expected) {
        final var evidence = classifier.classify(line + "\r\n");
        if (expected == null) {
            assertTrue(evidence.isEmpty());
            return;
        }
        assertEquals(FailureSignal.valueOf(expected), evidence.orElseThrow().getSignal());
        assertEquals(line, evidence.orElseThrow().getLine());
    }

    @Test
    void testFirstMatchingLineWins() {
        final var chunk = "total 0\r\n\r\n  zsh: command not found: gti  \r\nerror: something else\r\n";
        final var evidence = classifier.classify(chunk).orElseThrow();
        assertEquals("zsh: command not found: gti", evidence.getLine());
        assertTrue(evidence.isCommandNotFound());
    }

    @Test
    void testAnsiStripped() {
        final var evidence = classifier.classify("\u001b[31mbash: foo: command not found\u001b[0m\n").orElseThrow();
        assertEquals("bash: foo: command not found", evidence.getLine());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "total 8\r\ndrwxr-xr-x  2 root root 4096 .\r\n", "\u001b]0;title\u0007", "$ "})
    void testNoFailure(String chunk) {
        assertTrue(classifier.classify(chunk).isEmpty());
    }

    @Test
    void testCaseInsensitive() {
        assertEquals(FailureSignal.PERMISSION_DENIED,
                     classifier.classify("PERMISSION DENIED").orElseThrow().getSignal());
    }

    @Test
    void testRestrictedSignals() {
        final var restricted = new OutputClassifier(List.of(FailureSignal.SYNTAX_ERROR));
        assertTrue(restricted.classify("bash: foo: command not found").isEmpty());
        assertEquals("bash: syntax error near unexpected token `)'",
                     restricted.classify("bash: syntax error near unexpected token `)'").orElseThrow().getLine());
    }
}
