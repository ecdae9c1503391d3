package kaspi.lab.attachmentService.storage;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface StorageBackend {

    Mono<Void> store(String key, byte[] data);

    /** Whole object; errors with {@code StorageObjectNotFoundException} when absent. */
    Mono<byte[]> retrieve(String key);

    Flux<byte[]> stream(String key, int chunkSize);

    /** Deleting a missing key completes normally. */
    Mono<Void> delete(String key);

    Mono<Boolean> exists(String key);

    Mono<Void> appendChunk(String key, byte[] data);
}
