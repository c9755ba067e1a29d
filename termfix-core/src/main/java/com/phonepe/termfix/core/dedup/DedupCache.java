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

package com.phonepe.termfix.core.dedup;

import com.google.common.base.Preconditions;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Remembers which (command, error line) pairs were already handled inside the current time bucket. Keys are held
 * in insertion order so the oldest buckets are evicted first once the cache is full.
 * Not thread safe. Callers serialise access per session.
 */
@Slf4j
public class DedupCache {
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_ENTRIES = 256;

    @Getter
    private final Duration window;
    private final int maxEntries;
    private final Set<DedupKey> keys = new LinkedHashSet<>();

    public DedupCache() {
        this(DEFAULT_WINDOW, DEFAULT_MAX_ENTRIES);
    }

    public DedupCache(@NonNull Duration window, int maxEntries) {
        Preconditions.checkArgument(window.toSeconds() > 0, "Dedup window must be at least one second");
        Preconditions.checkArgument(maxEntries > 0, "Dedup capacity must be positive");
        this.window = window;
        this.maxEntries = maxEntries;
    }

    /**
     * Checks and records a failure
     * @param command Command the failure is attributed to
     * @param errorLine Evidence line
     * @param now Current time
     * @return false if the same pair was already recorded in the same bucket, true otherwise (the key is recorded)
     */
    public boolean shouldProcess(@NonNull String command, @NonNull String errorLine, @NonNull Instant now) {
        final var key = DedupKey.of(command, errorLine, now, window);
        if (!keys.add(key)) {
            log.debug("Skipping duplicate failure {}", key);
            return false;
        }
        evictOverflow();
        return true;
    }

    /**
     * Drops every key recorded for a command
     * @return number of keys removed
     */
    public int clearCommand(final String command) {
        var removed = 0;
        final Iterator<DedupKey> iterator = keys.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getCommand().equals(command)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Removed {} dedup keys for command {}", removed, command);
        }
        return removed;
    }

    /**
     * Called when the operator moves on to a different command. Keys of other commands are kept.
     */
    public int purgeCommand(final String previousCommand) {
        return clearCommand(previousCommand);
    }

    public void clear() {
        keys.clear();
    }

    public int size() {
        return keys.size();
    }

    public boolean contains(final DedupKey key) {
        return keys.contains(key);
    }

    private void evictOverflow() {
        final var iterator = keys.iterator();
        while (keys.size() > maxEntries && iterator.hasNext()) {
            iterator.next();
            iterator.remove();
        }
    }
}
