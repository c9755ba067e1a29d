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

package com.phonepe.termfix.core.fetcher;

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.phonepe.termfix.core.TermFixSetup;
import com.phonepe.termfix.core.assistant.AssistantClient;
import com.phonepe.termfix.core.assistant.AssistantRequest;
import com.phonepe.termfix.core.assistant.AssistantResponse;
import com.phonepe.termfix.core.errors.ConfigError;
import com.phonepe.termfix.core.errors.FormatError;
import com.phonepe.termfix.core.errors.InputError;
import com.phonepe.termfix.core.errors.TermFixException;
import com.phonepe.termfix.core.errors.UpstreamError;
import com.phonepe.termfix.core.parser.SuggestionParser;
import com.phonepe.termfix.core.utils.TermFixUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks the assistant for corrected alternatives of a failed command and returns the raw reply text.
 * <p>
 * Preconditions are checked before any call is made: an empty command raises {@link InputError} and a missing
 * credential raises {@link ConfigError}, both thrown directly. Failures of the call itself complete the returned future
 * exceptionally with {@link UpstreamError} (network, status, timeout) or {@link FormatError} (no reply text).
 * Replies are not cached here.
 */
@Slf4j
public class SuggestionFetcher {
    private final AssistantClient client;
    private final TermFixSetup setup;
    private final PromptBuilder promptBuilder;

    public SuggestionFetcher(@NonNull AssistantClient client, @NonNull TermFixSetup setup) {
        this.client = client;
        this.setup = setup;
        this.promptBuilder = new PromptBuilder(setup.getPromptStyle());
    }

    /**
     * Fetch suggestions for a command and the error line it produced
     * @param command The failed command
     * @param errorLine Evidence line from the shell output
     * @return Future with the trimmed reply text
     */
    public CompletableFuture<String> fetch(final String command, final String errorLine) {
        requireCommand(command);
        final var apiKey = requireCredential();
        log.info("Requesting suggestions for command: {} error: {}", command, TermFixUtils.snippet(errorLine));
        return call(apiKey, promptBuilder.build(command, Strings.nullToEmpty(errorLine).trim()));
    }

    /**
     * Fetch suggestions for a command with a known exit code. A zero exit code without error output is treated as
     * success and answered locally with {@link SuggestionParser#NO_CORRECTIONS_NEEDED}.
     */
    public CompletableFuture<String> fetchForExit(final String command, int exitCode, final String stderr) {
        if (exitCode == 0 && Strings.nullToEmpty(stderr).isBlank()) {
            log.debug("Command {} succeeded. No suggestions needed.", command);
            return CompletableFuture.completedFuture(SuggestionParser.NO_CORRECTIONS_NEEDED);
        }
        requireCommand(command);
        final var apiKey = requireCredential();
        log.info("Requesting suggestions for command: {} exit code: {}", command, exitCode);
        return call(apiKey, promptBuilder.buildForExit(command, exitCode, stderr));
    }

    private CompletableFuture<String> call(String apiKey, String prompt) {
        final var request = AssistantRequest.builder()
                .prompt(prompt)
                .model(setup.getModel())
                .apiKey(apiKey)
                .maxTokens(setup.getMaxTokens())
                .temperature(setup.getTemperature())
                .build();
        log.debug("Prompt: {}", prompt);
        final var stopwatch = Stopwatch.createStarted();
        final CompletableFuture<AssistantResponse> response;
        try {
            response = client.complete(request);
        }
        catch (TermFixException e) {
            return CompletableFuture.failedFuture(e);
        }
        catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new UpstreamError(TermFixUtils.rootCause(e).getMessage(), e));
        }
        return response
                .orTimeout(setup.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error != null) {
                        throw translate(error);
                    }
                    final var reply = result == null ? null : result.getReply();
                    if (Strings.isNullOrEmpty(reply) || reply.isBlank()) {
                        throw new FormatError("Reply text is missing");
                    }
                    log.info("Received assistant reply in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
                    return reply.trim();
                });
    }

    private TermFixException translate(Throwable error) {
        final var cause = TermFixUtils.unwrap(error);
        if (cause instanceof TermFixException termFixException) {
            return termFixException;
        }
        if (cause instanceof TimeoutException) {
            return new UpstreamError("Timed out after %d ms".formatted(setup.getFetchTimeout().toMillis()), cause);
        }
        return new UpstreamError(TermFixUtils.rootCause(cause).getMessage(), cause);
    }

    private String requireCredential() {
        final var apiKey = setup.getApiKey();
        if (Strings.isNullOrEmpty(apiKey) || apiKey.isBlank()) {
            throw ConfigError.missingVariable(TermFixSetup.API_KEY_VARIABLE);
        }
        return apiKey;
    }

    private static void requireCommand(String command) {
        if (Strings.isNullOrEmpty(command) || command.isBlank()) {
            throw new InputError("Empty command passed to suggestion fetcher");
        }
    }
}
