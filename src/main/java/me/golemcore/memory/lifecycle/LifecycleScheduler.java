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

package me.golemcore.memory.lifecycle;

import me.golemcore.memory.domain.model.CleanupResult;
import me.golemcore.memory.domain.model.ReindexStatus;
import me.golemcore.memory.domain.service.LearningService;
import me.golemcore.memory.domain.service.LifecycleService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background maintenance of the memory store.
 *
 * <p>
 * Each tick, every {@code memory.ttl.check-interval-seconds}:
 * <ol>
 * <li>hard-deletes entries past their collection TTL</li>
 * <li>repairs learning keys with more than one active version</li>
 * <li>checks collections for a stale embedding model and logs a warning (no
 * automatic reindex)</li>
 * </ol>
 *
 * <p>
 * A failing tick is logged and the schedule continues. {@link #start()} and
 * {@link #stop()} are idempotent.
 *
 * @since 1.0
 * @see LifecycleService
 */
@Component
@Slf4j
public class LifecycleScheduler {

    private final LifecycleService lifecycleService;
    private final LearningService learningService;
    private final MemoryProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public LifecycleScheduler(LifecycleService lifecycleService, LearningService learningService,
            MemoryProperties properties) {
        this.lifecycleService = lifecycleService;
        this.learningService = learningService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.getTtl().isSchedulerEnabled()) {
            log.info("[Lifecycle] Scheduler disabled");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-lifecycle-scheduler");
            t.setDaemon(true);
            return t;
        });

        long intervalSeconds = Math.max(1, properties.getTtl().getCheckIntervalSeconds());
        tickTask = scheduler.scheduleAtFixedRate(this::tick, 0, intervalSeconds, TimeUnit.SECONDS);
        log.info("[Lifecycle] Started with interval: {}s", intervalSeconds);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Lifecycle] Shut down");
    }

    public boolean isRunning() {
        return running.get();
    }

    void tick() {
        try {
            CleanupResult cleanup = lifecycleService.cleanupExpired(LifecycleService.ALL);
            if (cleanup.totalDeleted() > 0) {
                log.info("[Lifecycle] Tick removed {} expired entries", cleanup.totalDeleted());
            }

            int reconciled = learningService.reconcileActiveVersions();
            if (reconciled > 0) {
                log.info("[Lifecycle] Tick superseded {} duplicate active learnings", reconciled);
            }

            List<ReindexStatus> stale = lifecycleService.checkReindexNeeded().stream()
                    .filter(ReindexStatus::reindexNeeded)
                    .toList();
            for (ReindexStatus status : stale) {
                log.warn("[Lifecycle] Collection {} needs reindex: {} v{} -> {} v{}", status.collection(),
                        status.storedModel(), status.storedVersion(), status.currentModel(),
                        status.currentVersion());
            }
        } catch (Exception e) {
            log.error("[Lifecycle] Tick failed", e);
        }
    }
}
