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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.adapter.outbound.vector.LocalVectorIndexAdapter;
import me.golemcore.memory.adapter.outbound.vector.QdrantVectorIndexAdapter;
import me.golemcore.memory.port.outbound.StoragePort;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Selects the vector index backend from {@code memory.vector.backend}.
 *
 * <p>
 * Supported values: {@code local}, {@code qdrant}. Any other value fails the
 * application context, so the service never starts half-configured.
 */
@Configuration
@Slf4j
public class VectorIndexConfig {

    public enum Backend {
        LOCAL, QDRANT
    }

    @Bean
    public VectorIndexPort vectorIndexPort(MemoryProperties properties, StoragePort storagePort,
            OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        Backend backend = resolveBackend(properties.getVector().getBackend());
        log.info("[VectorIndex] Using backend: {}", backend.name().toLowerCase(Locale.ROOT));
        return switch (backend) {
        case LOCAL -> new LocalVectorIndexAdapter(properties, storagePort, objectMapper);
        case QDRANT -> new QdrantVectorIndexAdapter(properties, okHttpClient, objectMapper);
        };
    }

    /**
     * Normalizes (trim, lowercase) and resolves the configured backend name.
     *
     * @throws IllegalStateException
     *             for a blank or unsupported value
     */
    public static Backend resolveBackend(String configured) {
        String normalized = configured != null ? configured.trim().toLowerCase(Locale.ROOT) : "";
        return switch (normalized) {
        case "local" -> Backend.LOCAL;
        case "qdrant" -> Backend.QDRANT;
        default -> throw new IllegalStateException(
                "Unsupported vector backend: '" + configured + "' (expected 'local' or 'qdrant')");
        };
    }
}
