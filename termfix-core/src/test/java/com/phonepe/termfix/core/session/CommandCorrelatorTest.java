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
import com.phonepe.termfix.core.tracker.CommandTracker;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link CommandCorrelator}
 */
class CommandCorrelatorTest {
    private final CommandCorrelator correlator = new CommandCorrelator();

    @Test
    void testTrackedCommandUsed() {
        final var tracker = tracker("ls /nope");
        final var event = correlator.correlate(tracker, evidence("ls: /nope: No such file or directory",
                                                                 FailureSignal.NO_SUCH_FILE));
        assertEquals("ls /nope", event.getAssociatedCommand());
        assertEquals("Error after: ls /nope\n→ ls: /nope: No such file or directory", event.formatted());
    }

    @Test
    void testMissingCommandFromHistory() {
        final var tracker = tracker("gti status", "ls", "pwd");
        final var event = correlator.correlate(tracker, evidence("zsh: command not found: gti",
                                                                 FailureSignal.SHELL_COMMAND_NOT_FOUND));
        assertEquals("gti status", event.getAssociatedCommand());
        assertEquals("gti status", tracker.getLastCommand());
    }

    @Test
    void testMissingCommandNameOnly() {
        final var tracker = tracker("ls");
        final var event = correlator.correlate(tracker, evidence("bash: dockr: command not found",
                                                                 FailureSignal.COMMAND_NOT_FOUND));
        assertEquals("dockr", event.getAssociatedCommand());
        assertEquals("dockr", tracker.getLastCommand());
    }

    @Test
    void testNodeVersionError() {
        final var tracker = tracker("ls");
        final var event = correlator.correlate(tracker, evidence("/usr/local/bin/node: bad option: -ver",
                                                                 FailureSignal.NODE_BAD_OPTION));
        assertEquals(CommandCorrelator.NODE_VERSION_COMMAND, event.getAssociatedCommand());
    }

    @Test
    void testNodeCommandKept() {
        final var tracker = tracker("node --ver");
        final var event = correlator.correlate(tracker, evidence("/usr/local/bin/node: bad option: --ver",
                                                                 FailureSignal.NODE_BAD_OPTION));
        assertEquals("node --ver", event.getAssociatedCommand());
    }

    @Test
    void testPythonVersionError() {
        final var tracker = tracker("clear");
        final var event = correlator.correlate(tracker, evidence("unknown option --v",
                                                                 FailureSignal.UNKNOWN_OPTION));
        assertEquals(CommandCorrelator.PYTHON_VERSION_COMMAND, event.getAssociatedCommand());
    }

    @Test
    void testNoCommandYet() {
        final var event = correlator.correlate(new CommandTracker(),
                                               evidence("error: boom", FailureSignal.GENERIC_ERROR));
        assertFalse(event.hasCommand());
        assertEquals("error: boom", event.formatted());
    }

    @Test
    void testMissingCommandName() {
        assertEquals("gti", CommandCorrelator.missingCommandName("zsh: command not found: gti").orElseThrow());
        assertEquals("foo", CommandCorrelator.missingCommandName("bash: foo: command not found").orElseThrow());
        assertTrue(CommandCorrelator.missingCommandName("permission denied").isEmpty());
    }

    private static CommandTracker tracker(String... commands) {
        final var tracker = new CommandTracker();
        for (final var command : commands) {
            tracker.accept(command + "\r");
        }
        return tracker;
    }

    private static FailureEvidence evidence(String line, FailureSignal signal) {
        return new FailureEvidence(line, signal);
    }
}
