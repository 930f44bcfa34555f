package me.golemcore.memory.testsupport;

import me.golemcore.memory.port.outbound.StoragePort;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link StoragePort} for unit tests. Every call completes
 * synchronously.
 */
public final class InMemoryStoragePort implements StoragePort {

    private final Map<String, String> files = new ConcurrentHashMap<>();
    private volatile boolean failingWrites;

    public String read(String directory, String path) {
        return files.get(key(directory, path));
    }

    public void write(String directory, String path, String content) {
        files.put(key(directory, path), content);
    }

    public void setFailingWrites(boolean failingWrites) {
        this.failingWrites = failingWrites;
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.completedFuture(files.get(key(directory, path)));
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.completedFuture(files.containsKey(key(directory, path)));
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        if (failingWrites) {
            return CompletableFuture.failedFuture(new IllegalStateException("disk full"));
        }
        files.merge(key(directory, path), content, String::concat);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        if (failingWrites) {
            return CompletableFuture.failedFuture(new IllegalStateException("disk full"));
        }
        String previous = files.put(key(directory, path), content);
        if (backup && previous != null) {
            files.put(key(directory, path + ".bak"), previous);
        }
        return CompletableFuture.completedFuture(null);
    }

    private static String key(String directory, String path) {
        return directory + "/" + path;
    }
}
