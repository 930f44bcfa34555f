package me.golemcore.memory.testsupport;

import me.golemcore.memory.port.outbound.EmbeddingPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic embeddings for unit tests.
 *
 * <p>
 * Registered texts embed to their registered vector. Any other text gets the
 * next unused basis vector, so unrelated texts are orthogonal (similarity 0)
 * until the axes run out.
 */
public final class FakeEmbeddingPort implements EmbeddingPort {

    public static final int DIMENSION = 16;

    private final Map<String, float[]> vectors = new ConcurrentHashMap<>();
    private final AtomicInteger nextAxis = new AtomicInteger(DIMENSION - 1);
    private final AtomicInteger calls = new AtomicInteger();
    private volatile String model = "test-embedding";
    private volatile String modelVersion = "1";
    private volatile boolean failing;

    /**
     * Unit vector along {@code axis}.
     */
    public static float[] axis(int axis) {
        float[] vector = new float[DIMENSION];
        vector[axis] = 1.0f;
        return vector;
    }

    /**
     * Unit vector whose cosine similarity to {@code axis(primary)} is exactly
     * {@code cosine}; the remainder lies on {@code secondary}.
     */
    public static float[] tilted(int primary, int secondary, double cosine) {
        float[] vector = new float[DIMENSION];
        vector[primary] = (float) cosine;
        vector[secondary] = (float) Math.sqrt(1.0 - cosine * cosine);
        return vector;
    }

    public void register(String text, float[] vector) {
        vectors.put(text, vector.clone());
    }

    public void setModel(String model) {
        this.model = model;
    }

    public void setModelVersion(String modelVersion) {
        this.modelVersion = modelVersion;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int getCalls() {
        return calls.get();
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        calls.incrementAndGet();
        if (failing) {
            return CompletableFuture.failedFuture(new IllegalStateException("embedding backend unavailable"));
        }
        return CompletableFuture.completedFuture(vectorFor(text));
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        calls.incrementAndGet();
        if (failing) {
            return CompletableFuture.failedFuture(new IllegalStateException("embedding backend unavailable"));
        }
        List<float[]> result = new ArrayList<>();
        for (String text : texts) {
            result.add(vectorFor(text));
        }
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public int getDimension() {
        return DIMENSION;
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public String getModelVersion() {
        return modelVersion;
    }

    @Override
    public boolean isAvailable() {
        return !failing;
    }

    // Fresh axes are handed out from the top so tests can use the low ones.
    private float[] vectorFor(String text) {
        return vectors.computeIfAbsent(text, t -> axis(Math.floorMod(nextAxis.getAndDecrement(), DIMENSION)))
                .clone();
    }
}
