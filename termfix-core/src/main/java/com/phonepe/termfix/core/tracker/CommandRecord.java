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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * A submitted command line. Always trimmed and never empty.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CommandRecord {
    String command;

    public static Optional<CommandRecord> of(final String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        final var trimmed = raw.trim();
        return trimmed.isEmpty()
               ? Optional.empty()
               : Optional.of(new CommandRecord(trimmed));
    }

    @Override
    public String toString() {
        return command;
    }
}
