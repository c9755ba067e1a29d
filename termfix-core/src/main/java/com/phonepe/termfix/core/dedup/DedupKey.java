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

package com.phonepe.termfix.core.dedup;

import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Identity of a handled failure: command, evidence line and time bucket
 */
@Value
public class DedupKey {
    @NonNull
    String command;
    @NonNull
    String errorLine;
    long bucket;

    public static DedupKey of(String command, String errorLine, Instant now, Duration window) {
        return new DedupKey(command, errorLine, Math.floorDiv(now.getEpochSecond(), window.toSeconds()));
    }
}
