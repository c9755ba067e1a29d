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

import lombok.experimental.UtilityClass;

import java.util.Set;

/**
 * Maps mistyped or partial command names to the tool family they most likely belong to. The hint is passed to the
 * assistant as extra context.
 */
@UtilityClass
public class CommandHints {
    private static final Set<String> MKDIR_TYPOS = Set.of("mk", "mkd", "mkdi");

    /**
     * @param commandName Command name, or a full command line
     * @return The related command, or the input itself when nothing is known about it
     */
    public static String related(final String commandName) {
        if (commandName.contains("py")) {
            return "python";
        }
        if (commandName.contains("node") || commandName.contains("npm")) {
            return "node";
        }
        if (commandName.contains("kube") || commandName.contains("k8s")) {
            return "kubernetes";
        }
        if (MKDIR_TYPOS.contains(commandName)) {
            return "mkdir";
        }
        return commandName;
    }
}
