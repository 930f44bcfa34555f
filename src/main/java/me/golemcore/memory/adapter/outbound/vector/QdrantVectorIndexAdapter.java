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

package me.golemcore.memory.adapter.outbound.vector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.domain.model.VectorHit;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Vector index backed by the Qdrant REST API.
 *
 * <p>
 * Qdrant point ids must be unsigned integers or UUIDs, so string record ids
 * are mapped to name-based UUIDs and the original id is kept in the payload.
 * Point payload layout:
 *
 * <pre>
 * { "record_id": "...", "document": "...", "metadata": { ...filterable fields... } }
 * </pre>
 *
 * <p>
 * Collections use cosine distance; Qdrant returns similarity scores, which are
 * converted to {@code distance = 1 - score}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code memory.vector.qdrant.url} - Qdrant base URL
 * <li>{@code memory.vector.qdrant.api-key} - optional API key
 * </ul>
 */
@Slf4j
public class QdrantVectorIndexAdapter implements VectorIndexPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String RECORD_ID = "record_id";
    private static final String DOCUMENT = "document";
    private static final String METADATA = "metadata";
    private static final int SCROLL_PAGE_SIZE = 256;

    private final MemoryProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public QdrantVectorIndexAdapter(MemoryProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public void ensureCollection(String collection, int dimension) {
        JsonNode existing = call("GET", collection, "", null);
        if (existing != null) {
            return;
        }
        Map<String, Object> body = Map.of("vectors", Map.of("size", dimension, "distance", "Cosine"));
        call("PUT", collection, "", body);
        log.info("[Qdrant] Created collection {} (dimension {})", collection, dimension);
    }

    @Override
    public void upsert(String collection, List<VectorRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        List<Map<String, Object>> points = new ArrayList<>();
        for (VectorRecord record : records) {
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("id", pointId(record.id()));
            point.put("vector", record.vector());
            point.put("payload", toPointPayload(record.id(), record.document(), record.payload()));
            points.add(point);
        }
        call("PUT", collection, "/points?wait=true", Map.of("points", points));
    }

    @Override
    public List<VectorRecord> get(String collection, Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ids", ids.stream().map(QdrantVectorIndexAdapter::pointId).toList());
        body.put("with_payload", true);
        body.put("with_vector", true);
        JsonNode result = call("POST", collection, "/points", body);
        List<VectorRecord> records = new ArrayList<>();
        if (result != null && result.isArray()) {
            for (JsonNode point : result) {
                records.add(toRecord(point));
            }
        }
        return records;
    }

    @Override
    public List<VectorRecord> find(String collection, VectorFilter filter, int limit) {
        List<VectorRecord> records = new ArrayList<>();
        Object offset = null;
        do {
            int pageSize = limit > 0 ? Math.min(SCROLL_PAGE_SIZE, limit - records.size()) : SCROLL_PAGE_SIZE;
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("limit", pageSize);
            body.put("with_payload", true);
            body.put("with_vector", true);
            if (!filter.isEmpty()) {
                body.put("filter", toQdrantFilter(filter));
            }
            if (offset != null) {
                body.put("offset", offset);
            }
            JsonNode result = call("POST", collection, "/points/scroll", body);
            if (result == null) {
                break;
            }
            for (JsonNode point : result.path("points")) {
                records.add(toRecord(point));
            }
            JsonNode next = result.path("next_page_offset");
            offset = next.isMissingNode() || next.isNull() ? null : next.asText();
        } while (offset != null && (limit <= 0 || records.size() < limit));
        return records;
    }

    @Override
    public List<VectorHit> query(String collection, float[] vector, VectorFilter filter, int limit) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vector", vector);
        body.put("limit", limit);
        body.put("with_payload", true);
        body.put("with_vector", true);
        if (!filter.isEmpty()) {
            body.put("filter", toQdrantFilter(filter));
        }
        JsonNode result = call("POST", collection, "/points/search", body);
        List<VectorHit> hits = new ArrayList<>();
        if (result != null && result.isArray()) {
            for (JsonNode point : result) {
                double score = point.path("score").asDouble(0.0);
                hits.add(new VectorHit(toRecord(point), 1.0 - score));
            }
        }
        return hits;
    }

    @Override
    public void delete(String collection, Collection<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        List<String> points = ids.stream().map(QdrantVectorIndexAdapter::pointId).toList();
        call("POST", collection, "/points/delete?wait=true", Map.of("points", points));
    }

    @Override
    public long count(String collection) {
        JsonNode result = call("POST", collection, "/points/count", Map.of("exact", true));
        return result != null ? result.path("count").asLong(0) : 0;
    }

    @Override
    public void updatePayloads(String collection, Map<String, Map<String, Object>> payloadsById) {
        for (Map.Entry<String, Map<String, Object>> entry : payloadsById.entrySet()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("payload", Map.of(METADATA, entry.getValue()));
            body.put("points", List.of(pointId(entry.getKey())));
            call("POST", collection, "/points/payload?wait=true", body);
        }
    }

    @Override
    public void updateVectors(String collection, Map<String, float[]> vectorsById) {
        if (vectorsById.isEmpty()) {
            return;
        }
        List<Map<String, Object>> points = new ArrayList<>();
        for (Map.Entry<String, float[]> entry : vectorsById.entrySet()) {
            points.add(Map.of("id", pointId(entry.getKey()), "vector", entry.getValue()));
        }
        call("PUT", collection, "/points/vectors?wait=true", Map.of("points", points));
    }

    static String pointId(String recordId) {
        return UUID.nameUUIDFromBytes(recordId.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private Map<String, Object> toPointPayload(String id, String document, Map<String, Object> metadata) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(RECORD_ID, id);
        payload.put(DOCUMENT, document);
        payload.put(METADATA, metadata != null ? metadata : Map.of());
        return payload;
    }

    private Map<String, Object> toQdrantFilter(VectorFilter filter) {
        List<Map<String, Object>> must = new ArrayList<>();
        for (Map.Entry<String, Object> condition : filter.getConditions().entrySet()) {
            must.add(Map.of(
                    "key", METADATA + "." + condition.getKey(),
                    "match", Map.of("value", condition.getValue())));
        }
        return Map.of("must", must);
    }

    private VectorRecord toRecord(JsonNode point) {
        JsonNode payload = point.path("payload");
        String id = payload.path(RECORD_ID).asText(point.path("id").asText());
        String document = payload.path(DOCUMENT).asText("");
        Map<String, Object> metadata = payload.has(METADATA)
                ? objectMapper.convertValue(payload.get(METADATA), new TypeReference<LinkedHashMap<String, Object>>() {
                })
                : new LinkedHashMap<>();
        float[] vector = null;
        JsonNode vectorNode = point.path("vector");
        if (vectorNode.isArray()) {
            vector = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                vector[i] = (float) vectorNode.get(i).asDouble();
            }
        }
        return new VectorRecord(id, vector, document, metadata);
    }

    /**
     * Executes a request against {@code /collections/{collection}{suffix}} and
     * returns the {@code result} node, or {@code null} on HTTP 404.
     */
    private JsonNode call(String method, String collection, String suffix, Object body) {
        String url = baseUrl() + "/collections/" + collection + suffix;
        try {
            RequestBody requestBody = body != null
                    ? RequestBody.create(objectMapper.writeValueAsString(body), JSON)
                    : null;
            Request.Builder requestBuilder = new Request.Builder()
                    .url(HttpUrl.get(url))
                    .method(method, requestBody);
            addApiKeyHeader(requestBuilder);

            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (response.code() == 404) {
                    return null;
                }
                ResponseBody responseBody = response.body();
                String responseStr = responseBody != null ? responseBody.string() : "";
                if (!response.isSuccessful()) {
                    throw new IllegalStateException(
                            "Qdrant " + method + " " + suffix + " failed: HTTP " + response.code() + " " + responseStr);
                }
                if (responseStr.isBlank()) {
                    return objectMapper.nullNode();
                }
                return objectMapper.readTree(responseStr).path("result");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Qdrant request failed: " + method + " " + url, e);
        }
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getVector().getQdrant().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
    }

    private String baseUrl() {
        String url = properties.getVector().getQdrant().getUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
