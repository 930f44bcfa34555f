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

import me.golemcore.memory.domain.model.RetrievalMetricsSnapshot;
import org.springframework.stereotype.Component;

/**
 * Process-wide search metrics. Updates and snapshots share one lock, so a
 * snapshot never mixes counters from different calls.
 */
@Component
public class RetrievalMetrics {

    private final Object lock = new Object();

    private long requests;
    private long errors;
    private long totalResults;
    private double totalLatencyMs;

    public void record(double latencyMs, int resultCount, boolean error) {
        synchronized (lock) {
            requests++;
            totalLatencyMs += latencyMs;
            totalResults += resultCount;
            if (error) {
                errors++;
            }
        }
    }

    public RetrievalMetricsSnapshot snapshot() {
        synchronized (lock) {
            double avgLatency = requests > 0 ? totalLatencyMs / requests : 0.0;
            double avgResults = requests > 0 ? (double) totalResults / requests : 0.0;
            return new RetrievalMetricsSnapshot(requests, errors, totalResults, RankingService.round(totalLatencyMs),
                    RankingService.round(avgLatency), RankingService.round(avgResults));
        }
    }
}
