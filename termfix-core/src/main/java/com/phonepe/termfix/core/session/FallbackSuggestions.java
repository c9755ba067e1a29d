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

import com.phonepe.termfix.core.model.Suggestion;
import com.phonepe.termfix.core.model.SuggestionBatch;
import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

/**
 * Corrections that can be made locally, used when the assistant could not be reached
 */
@UtilityClass
public class FallbackSuggestions {
    //-ver as a separate token, not a prefix of --version or --verbose
    private static final Pattern LONG_VERSION_FLAG = Pattern.compile("(?<=\\s)-ver\\b");

    /**
     * @param command The failed command
     * @param errorLine Evidence line
     * @return Known corrections, or an empty batch
     */
    public static SuggestionBatch forFailure(final String command, final String errorLine) {
        final var versionFlag = LONG_VERSION_FLAG.matcher(command);
        if (versionFlag.find()) {
            return SuggestionBatch.of(Suggestion.of(versionFlag.replaceAll("-v"),
                                                    "Use -v instead of -ver for version flag"));
        }
        if (command.contains("node") && errorLine.contains("bad option")) {
            return SuggestionBatch.of(Suggestion.of("node -v", "Show Node.js version"),
                                      Suggestion.of("node -h", "Show Node.js help"));
        }
        return SuggestionBatch.empty();
    }
}
