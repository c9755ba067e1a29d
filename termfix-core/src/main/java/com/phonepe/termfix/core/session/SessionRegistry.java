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

import lombok.NonNull;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active sessions keyed by session id. Sessions share nothing with each other.
 */
public class SessionRegistry {
    private final Map<String, TerminalSession> sessions = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if a session with the same id is already active
     */
    public TerminalSession register(@NonNull final TerminalSession session) {
        final var existing = sessions.putIfAbsent(session.getSessionId(), session);
        if (existing != null) {
            throw new IllegalStateException("Session %s is already active".formatted(session.getSessionId()));
        }
        return session;
    }

    public Optional<TerminalSession> get(final String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<TerminalSession> remove(final String sessionId) {
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    public List<TerminalSession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
