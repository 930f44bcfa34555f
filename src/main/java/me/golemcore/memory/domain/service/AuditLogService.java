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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.domain.model.AuditEvent;
import me.golemcore.memory.domain.model.AuditEventType;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit log of memory state changes, stored as JSONL.
 */
@Service
@Slf4j
public class AuditLogService {

    private static final String FILE_NAME = "audit.jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;

    public AuditLogService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            MemoryProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getStorage().getAuditDirectory();
    }

    /**
     * Appends an event. Failures are logged and do not fail the operation being
     * audited.
     */
    public synchronized AuditEvent record(AuditEventType type, String modelName, String workspaceId, String entryId,
            Map<String, Object> details) {
        AuditEvent event = AuditEvent.builder()
                .id(UUID.randomUUID().toString())
                .eventType(type)
                .modelName(modelName)
                .workspaceId(workspaceId)
                .entryId(entryId)
                .timestamp(clock.instant())
                .details(details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>())
                .build();
        try {
            String line = objectMapper.writeValueAsString(event) + "\n";
            storagePort.appendText(directory, FILE_NAME, line).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Audit] Failed to append {} event for {}: {}", type.getCode(), entryId, e.getMessage());
        }
        return event;
    }

    /**
     * Most recent events first.
     *
     * @param topK
     *            maximum number of events
     * @param workspaceId
     *            optional workspace filter
     * @param modelName
     *            optional model filter
     */
    public List<AuditEvent> list(int topK, String workspaceId, String modelName) {
        String content;
        try {
            content = storagePort.getText(directory, FILE_NAME).join();
        } catch (RuntimeException e) {
            log.warn("[Audit] Failed to read audit log: {}", e.getMessage());
            return List.of();
        }
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<AuditEvent> events = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                AuditEvent event = objectMapper.readValue(line, AuditEvent.class);
                if (workspaceId != null && !workspaceId.equals(event.getWorkspaceId())) {
                    continue;
                }
                if (modelName != null && !modelName.equals(event.getModelName())) {
                    continue;
                }
                events.add(event);
            } catch (JsonProcessingException e) {
                log.debug("[Audit] Skipping malformed line: {}", e.getMessage());
            }
        }
        Collections.reverse(events);
        return events.size() > topK ? new ArrayList<>(events.subList(0, Math.max(0, topK))) : events;
    }
}
