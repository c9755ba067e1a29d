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

import com.google.common.annotations.VisibleForTesting;
import io.github.cdimascio.dotenv.Dotenv;
import lombok.experimental.UtilityClass;

import java.util.Optional;

/**
 * Loads variables from a {@code .env} file or the process environment. The file name can be overridden with the
 * {@code dotenv.file} system property.
 */
@UtilityClass
public class EnvLoader {
    private static final Dotenv DOTENV = Dotenv.configure()
            .filename(System.getProperty("dotenv.file", ".env"))
            .ignoreIfMissing()
            .ignoreIfMalformed()
            .load();

    /**
     * Reads a variable
     * @param variable the name of the variable
     * @return the value of the variable or empty if it is not set
     */
    public static Optional<String> readEnv(final String variable) {
        return Optional.ofNullable(readEnv(variable, null));
    }

    /**
     * Reads a variable, falling back to a default
     * @param variable the name of the variable
     * @param defaultValue value returned when the variable is not set
     * @return the value of the variable or the default
     */
    public static String readEnv(final String variable, final String defaultValue) {
        return readEnv(DOTENV, variable, defaultValue);
    }

    @VisibleForTesting
    static String readEnv(final Dotenv dotenv, final String variable, final String defaultValue) {
        final var fromFile = dotenv.get(variable);
        if (fromFile != null) {
            return fromFile;
        }
        final var fromEnvironment = System.getenv(variable);
        return fromEnvironment != null ? fromEnvironment : defaultValue;
    }
}
