/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.memory.domain.service;

import java.util.Locale;

/**
 * Text helpers shared by the write and comparison paths.
 */
public final class KnowledgeText {

    private KnowledgeText() {
    }

    /**
     * Strips NUL characters and surrounding whitespace. Returns an empty string for
     * {@code null}.
     */
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\u0000", "").strip();
    }

    /**
     * Comparison form: lowercase with whitespace runs collapsed.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    public static boolean sameMeaningText(String left, String right) {
        return normalize(left).equals(normalize(right));
    }
}
