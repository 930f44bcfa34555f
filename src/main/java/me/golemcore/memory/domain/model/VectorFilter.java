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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conjunction of payload equality conditions. Immutable.
 */
public final class VectorFilter {

    private static final VectorFilter NONE = new VectorFilter(Map.of());

    private final Map<String, Object> conditions;

    private VectorFilter(Map<String, Object> conditions) {
        this.conditions = conditions;
    }

    public static VectorFilter none() {
        return NONE;
    }

    public static VectorFilter where(String key, Object value) {
        return NONE.and(key, value);
    }

    /**
     * Adds a condition. A null value leaves the filter unchanged so optional
     * request parameters can be chained directly.
     */
    public VectorFilter and(String key, Object value) {
        if (value == null) {
            return this;
        }
        Map<String, Object> next = new LinkedHashMap<>(conditions);
        next.put(key, value instanceof EntryStatus status ? status.getCode() : value);
        return new VectorFilter(Collections.unmodifiableMap(next));
    }

    public Map<String, Object> getConditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * Evaluates the filter against a payload. Numbers compare by value, everything
     * else by string form.
     */
    public boolean matches(Map<String, Object> payload) {
        for (Map.Entry<String, Object> condition : conditions.entrySet()) {
            Object actual = payload != null ? payload.get(condition.getKey()) : null;
            if (!valueEquals(condition.getValue(), actual)) {
                return false;
            }
        }
        return true;
    }

    private static boolean valueEquals(Object expected, Object actual) {
        if (actual == null) {
            return false;
        }
        if (expected instanceof Number e && actual instanceof Number a) {
            return Double.compare(e.doubleValue(), a.doubleValue()) == 0;
        }
        return String.valueOf(expected).equals(String.valueOf(actual));
    }

    @Override
    public String toString() {
        return "VectorFilter" + conditions;
    }
}
