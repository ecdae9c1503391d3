package kaspi.lab.attachmentService.storage;

import kaspi.lab.attachmentService.exception.StorageObjectNotFoundException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Heap-backed backend for tests and throwaway deployments. */
public class InMemoryStorageBackend implements StorageBackend {

    private final ConcurrentMap<String, byte[]> objects = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> store(String key, byte[] data) {
        return Mono.fromRunnable(() -> objects.put(StorageKeys.requireSafe(key), data.clone()));
    }

    @Override
    public Mono<byte[]> retrieve(String key) {
        return Mono.fromCallable(() -> {
            byte[] data = objects.get(StorageKeys.requireSafe(key));
            if (data == null) {
                throw new StorageObjectNotFoundException(key);
            }
            return data.clone();
        });
    }

    @Override
    public Flux<byte[]> stream(String key, int chunkSize) {
        if (chunkSize <= 0) {
            return Flux.error(new IllegalArgumentException("chunkSize must be positive"));
        }
        return retrieve(key).flatMapMany(data -> Flux.range(0, (data.length + chunkSize - 1) / chunkSize)
                .map(i -> Arrays.copyOfRange(data, i * chunkSize, Math.min(data.length, (i + 1) * chunkSize))));
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> objects.remove(StorageKeys.requireSafe(key)));
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return Mono.fromCallable(() -> objects.containsKey(StorageKeys.requireSafe(key)));
    }

    @Override
    public Mono<Void> appendChunk(String key, byte[] data) {
        return Mono.fromRunnable(() -> objects.merge(StorageKeys.requireSafe(key), data.clone(), (existing, extra) -> {
            byte[] joined = Arrays.copyOf(existing, existing.length + extra.length);
            System.arraycopy(extra, 0, joined, existing.length, extra.length);
            return joined;
        }));
    }

    /** Snapshot of stored keys, sorted. */
    public Set<String> keys() {
        return new TreeSet<>(objects.keySet());
    }
}
