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

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phonepe.termfix.core.TermFixSetup;
import com.phonepe.termfix.core.assistant.AssistantRequest;
import com.phonepe.termfix.core.errors.FormatError;
import com.phonepe.termfix.core.errors.UpstreamError;
import com.phonepe.termfix.core.fetcher.SuggestionFetcher;
import com.phonepe.termfix.core.model.Suggestion;
import com.phonepe.termfix.core.parser.SuggestionParser;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link OpenRouterAssistantClient}
 */
@WireMockTest
class OpenRouterAssistantClientTest {
    private static final AssistantRequest REQUEST = AssistantRequest.builder()
            .prompt("User command: gti status")
            .model(TermFixSetup.DEFAULT_MODEL)
            .apiKey("test-key")
            .maxTokens(150)
            .temperature(0.2)
            .build();

    @Test
    void testCompletion(final WireMockRuntimeInfo wiremock) throws Exception {
        stubFor(post(urlEqualTo("/api/v1/chat/completions"))
                        .willReturn(jsonResponse("""
                                                         {
                                                           "id": "gen-1",
                                                           "choices": [
                                                             {
                                                               "message": {
                                                                 "role": "assistant",
                                                                 "content": "  1. git status → Show status\\n"
                                                               }
                                                             }
                                                           ]
                                                         }
                                                         """, 200)));
        final var client = client(wiremock, Map.of("X-Title", "termfix"));

        final var response = client.complete(REQUEST).get(5, TimeUnit.SECONDS);
        assertEquals("1. git status → Show status", response.getReply());

        verify(postRequestedFor(urlEqualTo("/api/v1/chat/completions"))
                       .withHeader("Authorization", equalTo("Bearer test-key"))
                       .withHeader("X-Title", equalTo("termfix"))
                       .withRequestBody(matchingJsonPath("$.model", equalTo(TermFixSetup.DEFAULT_MODEL)))
                       .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("user")))
                       .withRequestBody(matchingJsonPath("$.messages[0].content",
                                                         equalTo("User command: gti status")))
                       .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("150")))
                       .withRequestBody(matchingJsonPath("$.temperature", equalTo("0.2"))));
    }

    @Test
    void testErrorStatus(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/api/v1/chat/completions"))
                        .willReturn(jsonResponse("""
                                                         { "error": { "message": "No auth credentials found" } }
                                                         """, 401)));
        final var error = assertThrows(ExecutionException.class,
                                       () -> client(wiremock, Map.of()).complete(REQUEST).get(5, TimeUnit.SECONDS));
        assertInstanceOf(UpstreamError.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("401"));
    }

    @Test
    void testMissingContent(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/api/v1/chat/completions"))
                        .willReturn(jsonResponse("""
                                                         { "choices": [] }
                                                         """, 200)));
        final var error = assertThrows(ExecutionException.class,
                                       () -> client(wiremock, Map.of()).complete(REQUEST).get(5, TimeUnit.SECONDS));
        assertInstanceOf(FormatError.class, error.getCause());
    }

    @Test
    void testNotJson(final WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/api/v1/chat/completions"))
                        .willReturn(ok("<html>gateway</html>")));
        final var error = assertThrows(ExecutionException.class,
                                       () -> client(wiremock, Map.of()).complete(REQUEST).get(5, TimeUnit.SECONDS));
        assertInstanceOf(FormatError.class, error.getCause());
    }

    @Test
    void testConnectionFailure() {
        final var client = OpenRouterAssistantClient.builder()
                .setup(OpenRouterAssistantClientSetup.builder()
                               .baseUrl("http://localhost:1/api/v1")
                               .build())
                .build();
        final var error = assertThrows(ExecutionException.class,
                                       () -> client.complete(REQUEST).get(5, TimeUnit.SECONDS));
        assertInstanceOf(UpstreamError.class, error.getCause());
    }

    @Test
    void testWithFetcherAndParser(final WireMockRuntimeInfo wiremock) throws Exception {
        stubFor(post(urlEqualTo("/api/v1/chat/completions"))
                        .willReturn(jsonResponse("""
                                                         {
                                                           "choices": [
                                                             {
                                                               "message": {
                                                                 "content": "mkdir -p ~/demo ~ Create directory with parents\\nmkdir ~/demo ~ Create directory"
                                                               }
                                                             }
                                                           ]
                                                         }
                                                         """, 200)));
        final var fetcher = new SuggestionFetcher(client(wiremock, Map.of()),
                                                  TermFixSetup.builder()
                                                          .apiKey("test-key")
                                                          .fetchTimeout(Duration.ofSeconds(5))
                                                          .build());
        final var reply = fetcher.fetchForExit("mkdri ~/demo", 127, "zsh: command not found: mkdri")
                .get(5, TimeUnit.SECONDS);
        final var batch = new SuggestionParser().parse(reply);
        assertEquals(List.of(Suggestion.of("mkdir -p ~/demo", "Create directory with parents"),
                             Suggestion.of("mkdir ~/demo", "Create directory")),
                     batch.getSuggestions());
    }

    private static OpenRouterAssistantClient client(WireMockRuntimeInfo wiremock, Map<String, String> headers) {
        return OpenRouterAssistantClient.builder()
                .httpClient(new OkHttpClient.Builder()
                                    .callTimeout(5, TimeUnit.SECONDS)
                                    .build())
                .setup(OpenRouterAssistantClientSetup.builder()
                               .baseUrl(wiremock.getHttpBaseUrl() + "/api/v1")
                               .headers(headers)
                               .build())
                .build();
    }
}
