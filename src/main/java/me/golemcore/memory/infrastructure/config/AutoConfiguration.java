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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.memory.domain.service.CollectionRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration that provides shared infrastructure beans and prepares
 * the backend collections on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Logs startup information (embedding model, backend, storage location)</li>
 * <li>Creates missing collections and records their embedding model</li>
 * <li>Warns when a collection was indexed with a different model</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final MemoryProperties properties;
    private final CollectionRegistry collectionRegistry;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Memory starting...");
        log.info("Embedding Model: {} (v{})", properties.getEmbedding().getModel(),
                properties.getEmbedding().getModelVersion());
        log.info("Vector Backend: {}", properties.getVector().getBackend());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());

        try {
            collectionRegistry.initializeCollections();
        } catch (RuntimeException e) {
            log.warn("Collection initialization failed, will retry on first use: {}", e.getMessage());
        }

        log.info("GolemCore Memory started successfully");
    }
}
