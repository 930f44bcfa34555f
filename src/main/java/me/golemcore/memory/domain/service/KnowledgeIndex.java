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

import me.golemcore.memory.domain.model.KnowledgeCollection;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.KnowledgeMetadata;
import me.golemcore.memory.domain.model.KnowledgeValidationException;
import me.golemcore.memory.domain.model.SearchResult;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.domain.model.VectorHit;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Knowledge entry access on top of the vector index: text validation,
 * embedding, typed metadata mapping and ranked similarity queries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KnowledgeIndex {

    private final VectorIndexPort vectorIndex;
    private final EmbeddingPort embeddingPort;
    private final PayloadMapper payloadMapper;
    private final RankingService rankingService;
    private final MemoryProperties properties;

    /**
     * Sanitizes text for storage. Returns an empty string for blank input.
     *
     * @throws KnowledgeValidationException
     *             when the text exceeds {@code memory.search.max-text-length}
     */
    public String prepareText(String text) {
        String sanitized = KnowledgeText.sanitize(text);
        int maxLength = properties.getSearch().getMaxTextLength();
        if (sanitized.length() > maxLength) {
            throw new KnowledgeValidationException(KnowledgeValidationException.ValidationError.TEXT_TOO_LONG,
                    "text length " + sanitized.length() + " exceeds limit " + maxLength);
        }
        return sanitized;
    }

    /**
     * Embeds text, unwrapping the async failure so callers see the original cause.
     */
    public float[] embed(String text) {
        try {
            return embeddingPort.embed(text).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    public void write(KnowledgeCollection collection, String id, String text, float[] vector,
            KnowledgeMetadata metadata) {
        metadata.validate();
        vectorIndex.upsert(collection.getCollectionName(),
                List.of(new VectorRecord(id, vector, text, payloadMapper.toPayload(metadata))));
    }

    public List<KnowledgeEntry> find(KnowledgeCollection collection, VectorFilter filter, int limit) {
        return vectorIndex.find(collection.getCollectionName(), filter, limit).stream()
                .map(record -> toEntry(collection, record))
                .toList();
    }

    /**
     * Rewrites metadata of existing entries; text and vectors stay untouched.
     */
    public void updateMetadata(KnowledgeCollection collection, List<KnowledgeEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        Map<String, Map<String, Object>> payloads = new LinkedHashMap<>();
        for (KnowledgeEntry entry : entries) {
            payloads.put(entry.getId(), payloadMapper.toPayload(entry.getMetadata()));
        }
        vectorIndex.updatePayloads(collection.getCollectionName(), payloads);
    }

    public void hardDelete(KnowledgeCollection collection, List<String> ids) {
        vectorIndex.delete(collection.getCollectionName(), ids);
    }

    /**
     * Similarity query scored by the ranking engine. Non-active entries are
     * dropped; results come back in backend order.
     */
    public List<SearchResult> rankedQuery(KnowledgeCollection collection, String query, float[] queryVector,
            VectorFilter filter, int limit) {
        List<VectorHit> hits = vectorIndex.query(collection.getCollectionName(), queryVector, filter, limit);
        List<SearchResult> results = new ArrayList<>();
        for (VectorHit hit : hits) {
            KnowledgeEntry entry = toEntry(collection, hit.record());
            if (!entry.getMetadata().isActive()) {
                continue;
            }
            double semantic = hit.similarity();
            double keyword = rankingService.keywordOverlap(query, entry.getText());
            double relevance = rankingService.blendRelevance(semantic, keyword);
            results.add(SearchResult.builder()
                    .id(entry.getId())
                    .text(entry.getText())
                    .semanticScore(RankingService.round(semantic))
                    .keywordScore(keyword)
                    .relevance(relevance)
                    .score(rankingService.buildRankScore(relevance, entry.getMetadata()))
                    .source(collection.getShortName())
                    .metadata(entry.getMetadata())
                    .build());
        }
        return results;
    }

    public long count(KnowledgeCollection collection) {
        return vectorIndex.count(collection.getCollectionName());
    }

    private KnowledgeEntry toEntry(KnowledgeCollection collection, VectorRecord record) {
        return KnowledgeEntry.builder()
                .id(record.id())
                .text(record.document())
                .collection(collection)
                .metadata(payloadMapper.fromPayload(record.payload(), KnowledgeMetadata.class))
                .build();
    }
}
