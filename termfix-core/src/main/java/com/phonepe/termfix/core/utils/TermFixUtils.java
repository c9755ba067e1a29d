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

package com.phonepe.termfix.core.utils;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Various small utilities used across the pipeline
 */
@UtilityClass
public class TermFixUtils {
    private static final int LOG_SNIPPET_LENGTH = 100;

    public static Throwable rootCause(final Throwable leaf) {
        Throwable cause = leaf;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Strips the wrappers added by {@link java.util.concurrent.CompletableFuture} stages
     */
    public static Throwable unwrap(final Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Shortens text for log lines. Terminal output can be arbitrarily long.
     */
    public static String snippet(final String text) {
        if (Strings.isNullOrEmpty(text) || text.length() <= LOG_SNIPPET_LENGTH) {
            return Strings.nullToEmpty(text);
        }
        return text.substring(0, LOG_SNIPPET_LENGTH) + "...";
    }
}
