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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link DedupCache}
 */
class DedupCacheTest {
    private static final Instant BUCKET_START = Instant.ofEpochSecond(1_700_000_010L);

    @Test
    void testSameBucketDeduplicated() {
        final var cache = new DedupCache();
        assertTrue(cache.shouldProcess("gti", "zsh: command not found: gti", BUCKET_START));
        assertFalse(cache.shouldProcess("gti", "zsh: command not found: gti", BUCKET_START.plusSeconds(29)));
        assertEquals(1, cache.size());
    }

    @Test
    void testNextBucketProcessedAgain() {
        final var cache = new DedupCache();
        assertTrue(cache.shouldProcess("gti", "zsh: command not found: gti", BUCKET_START.plusSeconds(29)));
        assertTrue(cache.shouldProcess("gti", "zsh: command not found: gti", BUCKET_START.plusSeconds(30)));
    }

    @Test
    void testDifferentErrorsAreDistinct() {
        final var cache = new DedupCache();
        assertTrue(cache.shouldProcess("ls /x", "ls: /x: No such file or directory", BUCKET_START));
        assertTrue(cache.shouldProcess("ls /x", "ls: /x: Permission denied", BUCKET_START));
        assertTrue(cache.shouldProcess("ls /y", "ls: /x: Permission denied", BUCKET_START));
    }

    @Test
    void testBucketKey() {
        final var key = DedupKey.of("ls", "error: x", BUCKET_START, Duration.ofSeconds(30));
        assertEquals(1_700_000_010L / 30, key.getBucket());
    }

    @Test
    void testClearCommand() {
        final var cache = new DedupCache();
        cache.shouldProcess("gti", "zsh: command not found: gti", BUCKET_START);
        cache.shouldProcess("gti", "other error: x", BUCKET_START);
        cache.shouldProcess("ls", "error: x", BUCKET_START);
        assertEquals(2, cache.clearCommand("gti"));
        assertEquals(1, cache.size());
        assertTrue(cache.shouldProcess("gti", "zsh: command not found: gti", BUCKET_START));
        assertTrue(cache.contains(DedupKey.of("ls", "error: x", BUCKET_START, cache.getWindow())));
    }

    @Test
    void testOldestEvicted() {
        final var cache = new DedupCache(Duration.ofSeconds(30), 2);
        cache.shouldProcess("a", "error: a", BUCKET_START);
        cache.shouldProcess("b", "error: b", BUCKET_START);
        cache.shouldProcess("c", "error: c", BUCKET_START);
        assertEquals(2, cache.size());
        assertFalse(cache.contains(DedupKey.of("a", "error: a", BUCKET_START, cache.getWindow())));
        assertTrue(cache.shouldProcess("a", "error: a", BUCKET_START));
    }

    @Test
    void testInvalidSetup() {
        assertThrows(IllegalArgumentException.class, () -> new DedupCache(Duration.ZERO, 10));
        assertThrows(IllegalArgumentException.class, () -> new DedupCache(Duration.ofSeconds(30), 0));
    }
}
