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

import lombok.NonNull;
import lombok.Value;

/**
 * A classified failure, tied to the command it is attributed to
 */
@Value
public class ErrorEvent {
    /**
     * The trimmed evidence line
     */
    @NonNull
    String line;

    /**
     * Command the failure is attributed to. Empty if no command has been submitted yet.
     */
    @NonNull
    String associatedCommand;

    public boolean hasCommand() {
        return !associatedCommand.isEmpty();
    }

    /**
     * Message shown to the user when the failure is detected
     */
    public String formatted() {
        return hasCommand()
               ? "Error after: %s\n→ %s".formatted(associatedCommand, line)
               : line;
    }
}
