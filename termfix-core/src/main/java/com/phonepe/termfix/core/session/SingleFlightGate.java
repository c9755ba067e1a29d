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

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Two state machine that allows at most one pipeline run per session. Runs that arrive while one is active are
 * dropped, not queued.
 */
@Slf4j
public class SingleFlightGate {
    private final AtomicReference<ProcessingState> state = new AtomicReference<>(ProcessingState.IDLE);

    /**
     * Moves from {@link ProcessingState#IDLE} to {@link ProcessingState#PROCESSING}
     * @return false if a run is already active
     */
    public boolean tryAcquire() {
        return state.compareAndSet(ProcessingState.IDLE, ProcessingState.PROCESSING);
    }

    /**
     * Moves back to {@link ProcessingState#IDLE}. Releasing an idle gate is a no-op.
     */
    public void release() {
        if (!state.compareAndSet(ProcessingState.PROCESSING, ProcessingState.IDLE)) {
            log.trace("Gate was already idle");
        }
    }

    public ProcessingState state() {
        return state.get();
    }

    public boolean isProcessing() {
        return state.get() == ProcessingState.PROCESSING;
    }
}
