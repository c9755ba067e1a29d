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

package com.phonepe.termfix.core;

import com.phonepe.termfix.core.dedup.DedupCache;
import com.phonepe.termfix.core.fetcher.PromptStyle;
import com.phonepe.termfix.core.tracker.CommandHistory;
import com.phonepe.termfix.core.utils.EnvLoader;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.With;

import java.time.Duration;

/**
 * Setup for the failure detection and suggestion pipeline
 */
@Value
@Builder
@With
@SuppressWarnings("java:S6548")
public class TermFixSetup {
    public static final String API_KEY_VARIABLE = "OPENROUTER_API_KEY";
    public static final String DEFAULT_MODEL = "anthropic/claude-3.5-sonnet";
    public static final int DEFAULT_MAX_TOKENS = 150;
    public static final double DEFAULT_TEMPERATURE = 0.2;
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_GRACE_DELAY = Duration.ofMillis(300);

    public static final TermFixSetup DEFAULT = TermFixSetup.builder().build();

    /**
     * Credential for the assistant service. Suggestions are not requested if this is missing.
     */
    @Builder.Default
    @ToString.Exclude
    String apiKey = EnvLoader.readEnv(API_KEY_VARIABLE, null);

    /**
     * Model identifier passed to the assistant
     */
    @Builder.Default
    String model = DEFAULT_MODEL;

    @Builder.Default
    int maxTokens = DEFAULT_MAX_TOKENS;

    @Builder.Default
    double temperature = DEFAULT_TEMPERATURE;

    /**
     * Upper bound on a single assistant call
     */
    @Builder.Default
    Duration fetchTimeout = DEFAULT_FETCH_TIMEOUT;

    /**
     * Reply format requested in the prompt
     */
    @Builder.Default
    PromptStyle promptStyle = PromptStyle.NUMBERED_ARROW;

    /**
     * Failures with the same command and evidence line inside one window are handled once
     */
    @Builder.Default
    Duration dedupWindow = DedupCache.DEFAULT_WINDOW;

    /**
     * Upper bound on dedup keys held per session
     */
    @Builder.Default
    int maxDedupEntries = DedupCache.DEFAULT_MAX_ENTRIES;

    /**
     * Number of distinct recent commands remembered per session
     */
    @Builder.Default
    int historyCapacity = CommandHistory.DEFAULT_CAPACITY;

    /**
     * Time after a pipeline run completes before classification resumes. Absorbs trailing redraws of the same error.
     */
    @Builder.Default
    Duration graceDelay = DEFAULT_GRACE_DELAY;
}
