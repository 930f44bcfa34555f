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

package me.golemcore.memory.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status shared by knowledge entries and skills. DELETED is terminal.
 */
public enum EntryStatus {
    ACTIVE("active"), SUPERSEDED("superseded"), DELETED("deleted");

    private final String code;

    EntryStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolves a stored status code. Missing or unknown codes read as ACTIVE, which
     * is how entries written before status tracking behave.
     */
    @JsonCreator
    public static EntryStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return ACTIVE;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (EntryStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        return ACTIVE;
    }
}
