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

package com.phonepe.termfix.assistant.openrouter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.common.net.HttpHeaders;
import com.phonepe.termfix.core.assistant.AssistantClient;
import com.phonepe.termfix.core.assistant.AssistantRequest;
import com.phonepe.termfix.core.assistant.AssistantResponse;
import com.phonepe.termfix.core.errors.FormatError;
import com.phonepe.termfix.core.errors.UpstreamError;
import com.phonepe.termfix.core.utils.JsonUtils;
import com.phonepe.termfix.core.utils.TermFixUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link AssistantClient} that talks to OpenRouter, or any other OpenAI compatible chat completion endpoint.
 * Calls are made asynchronously on the OkHttp dispatcher.
 */
@Slf4j
public class OpenRouterAssistantClient implements AssistantClient {
    static final String COMPLETIONS_PATH = "/chat/completions";
    static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(15);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final OpenRouterAssistantClientSetup setup;

    public OpenRouterAssistantClient() {
        this(null, null, null);
    }

    @Builder
    public OpenRouterAssistantClient(
            OkHttpClient httpClient,
            ObjectMapper mapper,
            OpenRouterAssistantClientSetup setup) {
        this.httpClient = Objects.requireNonNullElseGet(
                httpClient,
                () -> new OkHttpClient.Builder()
                        .callTimeout(DEFAULT_CALL_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
                        .build());
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.setup = Objects.requireNonNullElse(setup, OpenRouterAssistantClientSetup.DEFAULT);
    }

    @Override
    public CompletableFuture<AssistantResponse> complete(@NonNull final AssistantRequest request) {
        final var result = new CompletableFuture<AssistantResponse>();
        final var stopwatch = Stopwatch.createStarted();
        httpClient.newCall(httpRequest(request))
                .enqueue(new Callback() {
                    @Override
                    public void onFailure(Call call, IOException e) {
                        log.error("Error calling {}: {}", call.request().url(), TermFixUtils.rootCause(e).getMessage());
                        result.completeExceptionally(new UpstreamError(e.getMessage(), e));
                    }

                    @Override
                    public void onResponse(Call call, Response response) {
                        try (response) {
                            result.complete(parseResponse(response));
                        }
                        catch (RuntimeException e) {
                            result.completeExceptionally(e);
                        }
                        finally {
                            log.debug("Call to {} completed in {} ms",
                                      call.request().url(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
                        }
                    }
                });
        return result;
    }

    private Request httpRequest(AssistantRequest request) {
        final var body = ChatCompletionRequest.builder()
                .model(request.getModel())
                .message(ChatCompletionRequest.Message.user(request.getPrompt()))
                .maxTokens(request.getMaxTokens())
                .temperature(request.getTemperature())
                .build();
        final var builder = new Request.Builder()
                .url(setup.getBaseUrl() + COMPLETIONS_PATH)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + request.getApiKey())
                .post(RequestBody.create(serialize(body), JSON));
        setup.getHeaders().forEach(builder::header);
        return builder.build();
    }

    private byte[] serialize(ChatCompletionRequest body) {
        try {
            return mapper.writeValueAsBytes(body);
        }
        catch (IOException e) {
            throw new UpstreamError("Could not serialize request: " + e.getMessage(), e);
        }
    }

    private AssistantResponse parseResponse(Response response) {
        final var bodyText = readBody(response);
        if (!response.isSuccessful()) {
            log.error("Assistant call failed with status {}: {}", response.code(), TermFixUtils.snippet(bodyText));
            throw new UpstreamError("Received status %d".formatted(response.code()));
        }
        final JsonNode root;
        try {
            root = mapper.readTree(bodyText);
        }
        catch (IOException e) {
            throw new FormatError("Response is not valid json");
        }
        final var choices = root.path("choices");
        if (JsonUtils.empty(choices)) {
            log.warn("No choices in assistant response: {}", TermFixUtils.snippet(bodyText));
            throw new FormatError("Response has no choices");
        }
        final var content = choices.path(0).path("message").path("content");
        if (!content.isTextual()) {
            log.warn("No message content in assistant response: {}", TermFixUtils.snippet(bodyText));
            throw new FormatError("Reply text is missing");
        }
        return new AssistantResponse(content.asText().trim());
    }

    private static String readBody(Response response) {
        final var body = response.body();
        if (null == body) {
            return "";
        }
        try {
            return Strings.nullToEmpty(body.string());
        }
        catch (IOException e) {
            throw new UpstreamError("Could not read response body: " + e.getMessage(), e);
        }
    }
}
