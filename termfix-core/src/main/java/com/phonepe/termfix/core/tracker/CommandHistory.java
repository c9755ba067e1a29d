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

import com.google.common.base.Preconditions;
import com.google.common.collect.EvictingQueue;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Recently submitted commands. Fixed capacity, no duplicates, oldest entry evicted first.
 */
public class CommandHistory {
    public static final int DEFAULT_CAPACITY = 10;

    private final EvictingQueue<String> commands;

    public CommandHistory() {
        this(DEFAULT_CAPACITY);
    }

    public CommandHistory(int capacity) {
        Preconditions.checkArgument(capacity > 0, "History capacity must be positive");
        this.commands = EvictingQueue.create(capacity);
    }

    /**
     * @return true if the command was added, false if it was already present
     */
    public boolean add(final CommandRecord record) {
        if (commands.contains(record.getCommand())) {
            return false;
        }
        return commands.add(record.getCommand());
    }

    public boolean contains(final String command) {
        return commands.contains(command);
    }

    /**
     * Oldest match first, mirroring the order commands were submitted in
     */
    public Optional<String> find(final Predicate<String> filter) {
        return commands.stream()
                .filter(filter)
                .findFirst();
    }

    public List<String> asList() {
        return List.copyOf(commands);
    }

    public int size() {
        return commands.size();
    }
}
