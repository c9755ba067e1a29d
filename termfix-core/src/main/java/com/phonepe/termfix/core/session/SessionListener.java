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

import com.phonepe.termfix.core.errors.TermFixException;
import com.phonepe.termfix.core.model.SuggestionBatch;

/**
 * Receives the results of the pipeline for one session. Usually implemented by the UI layer.
 * Calls for a session are made from that session's task queue, one at a time.
 */
public interface SessionListener {
    /**
     * A failed command was detected
     * @param formattedMessage Message embedding the last command and the evidence line
     */
    void onFailureDetected(String formattedMessage);

    /**
     * Suggestions are available for a failure. Called at most once per pipeline run.
     */
    void onSuggestionsReady(String command, String errorLine, SuggestionBatch batch);

    /**
     * Informational messages such as progress or hints about the submitted command
     */
    default void onNotice(String message) {
        //Nothing to do by default
    }

    /**
     * Failures that prevented suggestions from being requested at all (missing credential, invalid input)
     */
    default void onError(TermFixException error) {
        //Nothing to do by default
    }
}
