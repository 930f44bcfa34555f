package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.RetrievalMetricsSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class RetrievalMetricsTest {

    @Test
    void shouldStartAtZero() {
        RetrievalMetricsSnapshot snapshot = new RetrievalMetrics().snapshot();

        assertEquals(0, snapshot.requests());
        assertEquals(0.0, snapshot.averageLatencyMs());
        assertEquals(0.0, snapshot.averageResults());
    }

    @Test
    void shouldAverageAcrossRequests() {
        RetrievalMetrics metrics = new RetrievalMetrics();
        metrics.record(10.0, 4, false);
        metrics.record(20.0, 0, true);

        RetrievalMetricsSnapshot snapshot = metrics.snapshot();

        assertEquals(2, snapshot.requests());
        assertEquals(1, snapshot.errors());
        assertEquals(4, snapshot.totalResults());
        assertEquals(30.0, snapshot.totalLatencyMs(), 1e-9);
        assertEquals(15.0, snapshot.averageLatencyMs(), 1e-9);
        assertEquals(2.0, snapshot.averageResults(), 1e-9);
    }

    @Test
    void shouldNotLoseConcurrentUpdates() throws Exception {
        RetrievalMetrics metrics = new RetrievalMetrics();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        metrics.record(1.0, 1, false);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        RetrievalMetricsSnapshot snapshot = metrics.snapshot();
        assertEquals(8000, snapshot.requests());
        assertEquals(8000, snapshot.totalResults());
        assertEquals(1.0, snapshot.averageLatencyMs(), 1e-9);
    }
}
