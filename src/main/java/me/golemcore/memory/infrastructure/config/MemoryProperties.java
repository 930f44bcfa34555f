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

package me.golemcore.memory.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the memory engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code memory.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - local files (snapshots, audit log)</li>
 * <li>{@link EmbeddingProperties} - embedding model</li>
 * <li>{@link VectorProperties} - vector index backend selection</li>
 * <li>{@link SearchProperties} and {@link RankingProperties} - retrieval</li>
 * <li>{@link ContradictionProperties}, {@link SkillsProperties},
 * {@link GraphProperties}</li>
 * <li>{@link TtlProperties} - expiry and the lifecycle scheduler</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    private StorageProperties storage = new StorageProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private VectorProperties vector = new VectorProperties();
    private SearchProperties search = new SearchProperties();
    private RankingProperties ranking = new RankingProperties();
    private ContradictionProperties contradiction = new ContradictionProperties();
    private SkillsProperties skills = new SkillsProperties();
    private GraphProperties graph = new GraphProperties();
    private TtlProperties ttl = new TtlProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/memory";
        private String vectorsDirectory = "vectors";
        private String auditDirectory = "audit";
        private String registryDirectory = "registry";
    }

    @Data
    public static class EmbeddingProperties {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "text-embedding-3-small";
        private String modelVersion = "1";
        private int dimension = 1536;
    }

    @Data
    public static class VectorProperties {
        private String backend = "local";
        private LocalIndexProperties local = new LocalIndexProperties();
        private QdrantProperties qdrant = new QdrantProperties();
    }

    @Data
    public static class LocalIndexProperties {
        private boolean persist = true;
    }

    @Data
    public static class QdrantProperties {
        private String url = "http://localhost:6333";
        private String apiKey;
    }

    @Data
    public static class SearchProperties {
        private int topK = 5;
        private int maxTextLength = 10 * 1024 * 1024;
        private double semanticWeight = 0.8;
        private double keywordWeight = 0.2;
    }

    @Data
    public static class RankingProperties {
        private double relevanceWeight = 0.50;
        private double importanceWeight = 0.15;
        private double reliabilityWeight = 0.15;
        private double recencyWeight = 0.10;
        private double frequencyWeight = 0.05;
        private double priorityWeight = 0.05;
        private int recencyWindowDays = 30;
    }

    @Data
    public static class ContradictionProperties {
        private double similarityThreshold = 0.85;
        private int candidateCount = 5;
        private boolean linkInGraph = true;
    }

    @Data
    public static class SkillsProperties {
        private double defaultConfidence = 0.5;
        private double minConfidence = 0.3;
        private int searchTopK = 5;
        private double confidenceBoostRate = 0.05;
    }

    @Data
    public static class GraphProperties {
        private int maxDepth = 3;
        private int maxNeighbors = 50;
        private int maxNodes = 50;
        private List<String> relationshipTypes = new ArrayList<>(
                List.of("relates_to", "contradicts", "depends_on", "supersedes", "derived_from"));
    }

    @Data
    public static class TtlProperties {
        private int factsDays = 90;
        private int filesDays = 30;
        private int learningsDays = 0;
        private long checkIntervalSeconds = 3600;
        private boolean schedulerEnabled = true;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
