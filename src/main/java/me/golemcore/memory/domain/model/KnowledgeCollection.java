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

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Backend collections owned by the memory engine.
 */
public enum KnowledgeCollection {
    FACTS("facts", "agent_memory_facts"),
    FILES("files", "agent_memory_files"),
    LEARNINGS("learnings", "agent_learnings"),
    SKILLS("skills", "agent_skills"),
    RELATIONSHIPS("relationships", "agent_relationships");

    /**
     * Collections that hold knowledge entries and are subject to TTL and reindexing.
     */
    public static final List<KnowledgeCollection> KNOWLEDGE = List.of(FACTS, FILES, LEARNINGS);

    private final String shortName;
    private final String collectionName;

    KnowledgeCollection(String shortName, String collectionName) {
        this.shortName = shortName;
        this.collectionName = collectionName;
    }

    public String getShortName() {
        return shortName;
    }

    public String getCollectionName() {
        return collectionName;
    }

    /**
     * Accepts either the short name ({@code facts}) or the backend collection name
     * ({@code agent_memory_facts}).
     */
    public static Optional<KnowledgeCollection> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (KnowledgeCollection collection : values()) {
            if (collection.shortName.equals(normalized) || collection.collectionName.equals(normalized)) {
                return Optional.of(collection);
            }
        }
        return Optional.empty();
    }
}
