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

package com.phonepe.termfix.core.tracker;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One unit of operator input sent towards the shell
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InputUnit {
    public enum Type {
        TEXT,
        ENTER,
        BACKSPACE,
        INTERRUPT,
        ESCAPE_SEQUENCE,
        CONTROL,
    }

    static final char CR = '\r';
    static final char DEL = '\u007F';
    static final char BS = '\b';
    static final char ETX = '\u0003';
    static final char ESC = '\u001b';

    Type type;
    String text;

    /**
     * Splits raw terminal input into units. Data starting with ESC is a single escape sequence (cursor keys and
     * the like). Anything else is classified character by character, so pasted text with an embedded carriage
     * return submits the line.
     */
    public static List<InputUnit> split(final String data) {
        if (data == null || data.isEmpty()) {
            return List.of();
        }
        if (data.charAt(0) == ESC) {
            return List.of(new InputUnit(Type.ESCAPE_SEQUENCE, data));
        }
        final var units = new ArrayList<InputUnit>();
        final var text = new StringBuilder();
        for (int i = 0; i < data.length(); i++) {
            final var ch = data.charAt(i);
            final var type = typeOf(ch);
            if (type == Type.TEXT) {
                text.append(ch);
                continue;
            }
            if (!text.isEmpty()) {
                units.add(new InputUnit(Type.TEXT, text.toString()));
                text.setLength(0);
            }
            if (type == Type.ESCAPE_SEQUENCE) {
                units.add(new InputUnit(type, data.substring(i)));
                return units;
            }
            units.add(new InputUnit(type, String.valueOf(ch)));
        }
        if (!text.isEmpty()) {
            units.add(new InputUnit(Type.TEXT, text.toString()));
        }
        return units;
    }

    private static Type typeOf(char ch) {
        return switch (ch) {
            case CR -> Type.ENTER;
            case DEL, BS -> Type.BACKSPACE;
            case ETX -> Type.INTERRUPT;
            case ESC -> Type.ESCAPE_SEQUENCE;
            default -> Character.isISOControl(ch) ? Type.CONTROL : Type.TEXT;
        };
    }
}
