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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.phonepe.termfix.core.TermFixSetup;
import com.phonepe.termfix.core.dedup.DedupCache;
import com.phonepe.termfix.core.tracker.CommandHistory;
import com.phonepe.termfix.core.tracker.CommandTracker;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * State of one shell connection. All state is touched only from the session's own task queue, which processes
 * input events and output chunks in arrival order. Nothing is persisted, everything is dropped on {@link #close()}.
 */
@Slf4j
public class TerminalSession {
    @Getter
    private final String sessionId;
    @Getter
    private final SessionListener listener;
    @Getter
    private final ShellInput shellInput;
    @Getter
    private final CommandTracker tracker;
    @Getter
    private final DedupCache dedupCache;
    @Getter
    private final SingleFlightGate gate = new SingleFlightGate();
    private final ScheduledExecutorService queue;

    @Getter
    private String lastErrorLine = "";
    private boolean configErrorReported;
    private volatile boolean closed;

    public TerminalSession(
            @NonNull String sessionId,
            @NonNull SessionListener listener,
            ShellInput shellInput,
            @NonNull TermFixSetup setup) {
        this.sessionId = sessionId;
        this.listener = listener;
        this.shellInput = Objects.requireNonNullElse(shellInput, ShellInput.NONE);
        this.dedupCache = new DedupCache(setup.getDedupWindow(), setup.getMaxDedupEntries());
        this.tracker = new CommandTracker(new CommandHistory(setup.getHistoryCapacity()), this::commandChanged);
        this.queue = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                                                                        .setNameFormat("termfix-session-%d")
                                                                        .setDaemon(true)
                                                                        .build());
    }

    /**
     * Queues a task for this session. Tasks queued after the session was closed are discarded.
     */
    public void execute(final Runnable task) {
        if (closed) {
            log.debug("Session {} is closed. Discarding task.", sessionId);
            return;
        }
        try {
            queue.execute(() -> runGuarded(task));
        }
        catch (RejectedExecutionException e) {
            log.debug("Session {} closed while queueing task", sessionId);
        }
    }

    /**
     * Queues a task to run after a delay. Discarded if the session is closed by then.
     */
    public void schedule(final Runnable task, final Duration delay) {
        if (closed) {
            return;
        }
        try {
            queue.schedule(() -> runGuarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (RejectedExecutionException e) {
            log.debug("Session {} closed while scheduling task", sessionId);
        }
    }

    public void setLastErrorLine(@NonNull final String lastErrorLine) {
        this.lastErrorLine = lastErrorLine;
    }

    /**
     * @return true only the first time it is called for this session
     */
    public boolean markConfigErrorReported() {
        if (configErrorReported) {
            return false;
        }
        configErrorReported = true;
        return true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Discards all state. Outstanding work completing later is dropped.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.shutdownNow();
        log.info("Session {} closed", sessionId);
    }

    private void commandChanged(String previous, String current) {
        dedupCache.purgeCommand(previous);
        lastErrorLine = "";
    }

    private void runGuarded(Runnable task) {
        if (closed) {
            return;
        }
        try {
            task.run();
        }
        catch (RuntimeException e) {
            log.error("Error processing event for session {}: {}", sessionId, e.getMessage(), e);
        }
    }
}
