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

package com.phonepe.termfix.core.classifier;

import lombok.Getter;

import java.util.regex.Pattern;

/**
 * Failure markers recognised in shell output. Declaration order is the order in which signals are tested.
 */
@Getter
public enum FailureSignal {
    SHELL_COMMAND_NOT_FOUND("\\w+:\\s+command not found:\\s+\\S+"),
    COMMAND_NOT_FOUND("command not found"),
    PERMISSION_DENIED("permission denied"),
    NO_SUCH_FILE("no such file or directory"),
    CANNOT_ACCESS("cannot access"),
    NODE_BAD_OPTION("/.*node:.*bad option"),
    BAD_OPTION("bad option"),
    BAD_FLAG("bad flag"),
    UNKNOWN_OPTION("(?:unknown|unrecognized|unrecognised|invalid|illegal) (?:option|flag)"),
    UNKNOWN_COMMAND("(?:unknown|unrecognized) command"),
    NOT_A_DIRECTORY("not a directory"),
    NOT_RECOGNIZED("not recognized"),
    SYNTAX_ERROR("syntax error"),
    SEGMENTATION_FAULT("segmentation fault"),
    MODULE_NOT_FOUND("ModuleNotFoundError|ImportError|AttributeError|cannot find module"),
    PYTHON_ERROR("python\\d?:.*error"),
    TRACEBACK("traceback"),
    EXCEPTION("exception"),
    GENERIC_ERROR("error:"),
    GENERIC_FAILURE("failed:"),
    COULD_NOT("could not"),
    ;

    private final Pattern pattern;

    FailureSignal(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    public boolean matches(final CharSequence text) {
        return pattern.matcher(text).find();
    }

    public boolean isCommandNotFound() {
        return this == SHELL_COMMAND_NOT_FOUND || this == COMMAND_NOT_FOUND;
    }
}
