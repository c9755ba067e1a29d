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

package com.phonepe.termfix.core.tracker;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Rebuilds the logical command line from the keystrokes sent to the shell. Never fails, only mutates state.
 * Not thread safe. Callers serialise access per session.
 */
@Slf4j
public class CommandTracker {

    /**
     * Called when a submitted command differs from the previous one
     */
    @FunctionalInterface
    public interface CommandChangeListener {
        void commandChanged(String previous, String current);
    }

    private final StringBuilder buffer = new StringBuilder();
    @Getter
    private final CommandHistory history;
    private final CommandChangeListener changeListener;
    private String lastCommand = "";

    public CommandTracker() {
        this(new CommandHistory(), (previous, current) -> {});
    }

    public CommandTracker(@NonNull CommandHistory history, CommandChangeListener changeListener) {
        this.history = history;
        this.changeListener = Objects.requireNonNullElse(changeListener, (previous, current) -> {});
    }

    /**
     * Applies raw input data
     * @param data Data as received from the terminal
     * @return The command submitted by this input, if any. If the data holds several carriage returns, the last
     * submitted command is returned.
     */
    public Optional<CommandRecord> accept(final String data) {
        Optional<CommandRecord> submitted = Optional.empty();
        for (final var unit : InputUnit.split(data)) {
            final var result = apply(unit);
            if (result.isPresent()) {
                submitted = result;
            }
        }
        return submitted;
    }

    public Optional<CommandRecord> apply(final InputUnit unit) {
        switch (unit.getType()) {
            case ENTER -> {
                return submit();
            }
            case BACKSPACE -> {
                if (!buffer.isEmpty()) {
                    buffer.setLength(buffer.length() - 1);
                }
            }
            case INTERRUPT -> buffer.setLength(0);
            case TEXT -> buffer.append(unit.getText());
            case ESCAPE_SEQUENCE, CONTROL -> log.trace("Ignoring control input");
        }
        return Optional.empty();
    }

    /**
     * Overrides the command a failure is attributed to. Used when the shell output names a different command than
     * the one tracked from the keystrokes. Notifies the change listener like a submission would.
     */
    public void correctLastCommand(@NonNull final String command) {
        updateLastCommand(command);
    }

    public String getLastCommand() {
        return lastCommand;
    }

    public String getBuffer() {
        return buffer.toString();
    }

    public void clearBuffer() {
        buffer.setLength(0);
    }

    private Optional<CommandRecord> submit() {
        final var record = CommandRecord.of(buffer.toString());
        buffer.setLength(0);
        record.ifPresent(submitted -> {
            final var command = submitted.getCommand();
            log.debug("Command submitted: {}", command);
            updateLastCommand(command);
            history.add(submitted);
        });
        return record;
    }

    private void updateLastCommand(final String command) {
        final var previous = lastCommand;
        lastCommand = command;
        if (!previous.equals(command)) {
            changeListener.commandChanged(previous, command);
        }
    }
}
