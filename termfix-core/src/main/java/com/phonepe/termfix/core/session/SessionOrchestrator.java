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

import com.google.common.base.Strings;
import com.phonepe.termfix.core.TermFixSetup;
import com.phonepe.termfix.core.assistant.AssistantClient;
import com.phonepe.termfix.core.classifier.FailureEvidence;
import com.phonepe.termfix.core.classifier.OutputClassifier;
import com.phonepe.termfix.core.errors.ConfigError;
import com.phonepe.termfix.core.errors.InputError;
import com.phonepe.termfix.core.errors.TermFixException;
import com.phonepe.termfix.core.fetcher.SuggestionFetcher;
import com.phonepe.termfix.core.model.ErrorEvent;
import com.phonepe.termfix.core.model.SuggestionBatch;
import com.phonepe.termfix.core.parser.SuggestionParser;
import com.phonepe.termfix.core.tracker.CommandRecord;
import com.phonepe.termfix.core.utils.TermFixUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Wires command tracking, failure classification, dedup, fetching and parsing together for every active session.
 * <p>
 * Input and output of a session are processed in arrival order on the session's task queue. The only suspension is
 * the assistant call, whose continuation is queued back on the same session. While a run is active, new output is
 * not classified (single flight). Nothing here terminates a session: every failure degrades to no suggestions.
 */
@Slf4j
public class SessionOrchestrator implements AutoCloseable {
    static final String FETCHING_NOTICE = "Getting command suggestions...";
    static final String NODE_VERSION_NOTICE
            = "Note: The command you entered might be using an incorrect version flag. Watching for errors...";
    static final String PYTHON_VERSION_NOTICE
            = "Note: Python uses -V (capital V) or --version for checking version. Watching for errors...";

    private static final Pattern NODE_VERSION_FLAG = Pattern.compile("node\\s+--?ver\\b");
    private static final Pattern PYTHON_VERSION_FLAG = Pattern.compile("python3?\\s+(?:--v|-ver)\\b");

    @Getter
    private final TermFixSetup setup;
    private final SuggestionFetcher fetcher;
    private final OutputClassifier classifier;
    private final SuggestionParser parser;
    private final CommandCorrelator correlator;
    private final Clock clock;
    private final SessionRegistry registry;

    public SessionOrchestrator(AssistantClient assistantClient, TermFixSetup setup) {
        this(assistantClient, setup, null, null, null, null);
    }

    @Builder
    public SessionOrchestrator(
            @NonNull AssistantClient assistantClient,
            TermFixSetup setup,
            OutputClassifier classifier,
            SuggestionParser parser,
            Clock clock,
            SessionRegistry registry) {
        this.setup = Objects.requireNonNullElse(setup, TermFixSetup.DEFAULT);
        this.fetcher = new SuggestionFetcher(assistantClient, this.setup);
        this.classifier = Objects.requireNonNullElseGet(classifier, OutputClassifier::new);
        this.parser = Objects.requireNonNullElseGet(parser, SuggestionParser::new);
        this.correlator = new CommandCorrelator();
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.registry = Objects.requireNonNullElseGet(registry, SessionRegistry::new);
    }

    public TerminalSession start(final String sessionId, final SessionListener listener) {
        return start(sessionId, listener, ShellInput.NONE);
    }

    /**
     * Starts tracking a shell session
     * @param sessionId Unique id of the session
     * @param listener Receives failures and suggestions
     * @param shellInput Used to send suggested commands to the shell
     * @return The new session
     * @throws IllegalStateException if a session with the same id is already active
     */
    public TerminalSession start(final String sessionId, final SessionListener listener, final ShellInput shellInput) {
        final var session = registry.register(new TerminalSession(sessionId, listener, shellInput, setup));
        log.info("Session {} started", sessionId);
        return session;
    }

    /**
     * Ends a session. Results of a fetch that is still outstanding are discarded.
     */
    public void end(final String sessionId) {
        registry.remove(sessionId)
                .ifPresentOrElse(TerminalSession::close,
                                 () -> log.warn("End requested for unknown session {}", sessionId));
    }

    /**
     * Input sent by the operator towards the shell
     */
    public void onInput(final String sessionId, final String data) {
        withSession(sessionId, session -> session.execute(() -> handleInput(session, data)));
    }

    /**
     * Output produced by the shell
     */
    public void onOutput(final String sessionId, final String chunk) {
        withSession(sessionId, session -> session.execute(() -> handleOutput(session, chunk)));
    }

    /**
     * Runs a suggested command in the shell, as if the operator typed it and pressed enter
     */
    public void runSuggestion(final String sessionId, final String command) {
        if (Strings.isNullOrEmpty(command) || command.isBlank()) {
            log.warn("Attempted to run empty command in session {}", sessionId);
            return;
        }
        withSession(sessionId, session -> session.execute(() -> {
            session.getShellInput().write(command);
            session.getShellInput().write("\r");
            handleInput(session, command);
            handleInput(session, "\r");
        }));
    }

    public int activeSessions() {
        return registry.size();
    }

    @Override
    public void close() {
        registry.all().forEach(session -> end(session.getSessionId()));
    }

    private void withSession(String sessionId, Consumer<TerminalSession> action) {
        registry.get(sessionId)
                .ifPresentOrElse(action, () -> log.warn("Ignoring event for unknown session {}", sessionId));
    }

    private void handleInput(TerminalSession session, String data) {
        session.getTracker()
                .accept(data)
                .ifPresent(record -> raiseSubmissionNotices(session, record));
    }

    private void raiseSubmissionNotices(TerminalSession session, CommandRecord record) {
        final var command = record.getCommand();
        if (NODE_VERSION_FLAG.matcher(command).find()) {
            session.getListener().onNotice(NODE_VERSION_NOTICE);
        }
        if (PYTHON_VERSION_FLAG.matcher(command).find()) {
            session.getDedupCache().clear();
            session.getListener().onNotice(PYTHON_VERSION_NOTICE);
        }
    }

    private void handleOutput(TerminalSession session, String chunk) {
        if (session.getGate().isProcessing()) {
            log.debug("Session {} is processing a failure. Skipping classification.", session.getSessionId());
            return;
        }
        final var evidence = classifier.classify(chunk).orElse(null);
        if (null == evidence) {
            return;
        }
        if (evidence.getLine().equals(session.getLastErrorLine())) {
            log.debug("Skipping repeat of last error: {}", evidence.getLine());
            return;
        }
        session.setLastErrorLine(evidence.getLine());
        if (!session.getGate().tryAcquire()) {
            return;
        }
        try {
            process(session, evidence);
        }
        catch (RuntimeException e) {
            log.error("Error handling failure in session {}: {}", session.getSessionId(), e.getMessage(), e);
            releaseAfterGrace(session);
        }
    }

    private void process(TerminalSession session, FailureEvidence evidence) {
        final var event = correlator.correlate(session.getTracker(), evidence);
        //A corrected command resets the session's error line
        session.setLastErrorLine(event.getLine());
        final var command = event.getAssociatedCommand();
        if (evidence.isCommandNotFound() && event.hasCommand()) {
            session.getDedupCache().clearCommand(command);
        }
        log.info("Failure detected in session {} after command '{}': {}",
                 session.getSessionId(), command, TermFixUtils.snippet(event.getLine()));
        session.getListener().onFailureDetected(event.formatted());
        if (!event.hasCommand()) {
            releaseAfterGrace(session);
            return;
        }
        if (!session.getDedupCache().shouldProcess(command, event.getLine(), clock.instant())) {
            session.getGate().release();
            return;
        }
        CommandRecord.of(command).ifPresent(record -> session.getTracker().getHistory().add(record));
        session.getListener().onNotice(FETCHING_NOTICE);
        requestSuggestions(session, event);
    }

    private void requestSuggestions(TerminalSession session, ErrorEvent event) {
        final CompletableFuture<String> reply;
        try {
            reply = fetcher.fetch(event.getAssociatedCommand(), event.getLine());
        }
        catch (ConfigError | InputError e) {
            reportError(session, e);
            releaseAfterGrace(session);
            return;
        }
        reply.whenComplete((text, error) -> session.execute(() -> completeRequest(session, event, text, error)));
    }

    private void completeRequest(TerminalSession session, ErrorEvent event, String reply, Throwable error) {
        try {
            final var batch = null == error
                              ? parsed(reply)
                              : fallback(session, event, TermFixUtils.unwrap(error));
            if (null != batch) {
                session.getListener().onSuggestionsReady(event.getAssociatedCommand(), event.getLine(), batch);
            }
        }
        finally {
            releaseAfterGrace(session);
        }
    }

    private SuggestionBatch parsed(String reply) {
        final var batch = parser.parse(reply);
        return batch.isEmpty()
               ? SuggestionBatch.of(SuggestionParser.PARSE_MISS)
               : batch;
    }

    private SuggestionBatch fallback(TerminalSession session, ErrorEvent event, Throwable error) {
        if (error instanceof ConfigError || error instanceof InputError) {
            reportError(session, (TermFixException) error);
            return null;
        }
        log.warn("Could not get suggestions for '{}': {}", event.getAssociatedCommand(), error.getMessage());
        return FallbackSuggestions.forFailure(event.getAssociatedCommand(), event.getLine());
    }

    private void reportError(TerminalSession session, TermFixException error) {
        if (error instanceof ConfigError && !session.markConfigErrorReported()) {
            log.debug("Configuration error already reported for session {}", session.getSessionId());
            return;
        }
        log.error("Suggestions unavailable for session {}: {}", session.getSessionId(), error.getMessage());
        session.getListener().onError(error);
    }

    private void releaseAfterGrace(TerminalSession session) {
        session.schedule(() -> {
            session.getGate().release();
            final var tracker = session.getTracker();
            if (tracker.getBuffer().equals(tracker.getLastCommand())) {
                tracker.clearBuffer();
            }
        }, setup.getGraceDelay());
    }
}
