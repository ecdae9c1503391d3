package kaspi.lab.attachmentService.service;

import kaspi.lab.attachmentService.domain.AttachmentEntity;
import kaspi.lab.attachmentService.domain.AttachmentStatus;
import kaspi.lab.attachmentService.storage.StorageBackend;
import kaspi.lab.attachmentService.storage.StorageKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Best-effort removal of the objects behind an attachment row. Failures are logged and never
 * propagate: the row is already gone when this runs, and a leftover object is harmless.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttachmentStorageCleaner {

    private final StorageBackend storage;

    public Mono<Void> deleteObjects(AttachmentEntity attachment) {
        Mono<Void> primary = deleteQuietly(attachment.getStorageKey());
        Mono<Void> thumbnail = attachment.getThumbnailStorageKey() != null
                ? deleteQuietly(attachment.getThumbnailStorageKey())
                : Mono.empty();
        // у READY чанки уже удалены при сборке
        Mono<Void> chunks = attachment.getStatus() != AttachmentStatus.READY
                ? deleteChunks(attachment.getStorageKey(), totalChunks(attachment))
                : Mono.empty();
        return primary.then(thumbnail).then(chunks);
    }

    public Mono<Void> deleteChunks(String storageKey, int totalChunks) {
        return Flux.range(0, totalChunks)
                .concatMap(i -> deleteQuietly(StorageKeys.forChunk(storageKey, i)))
                .then();
    }

    private Mono<Void> deleteQuietly(String key) {
        if (key == null) {
            return Mono.empty();
        }
        return storage.delete(key)
                .onErrorResume(e -> {
                    log.warn("Failed to delete storage object {}: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    private static int totalChunks(AttachmentEntity attachment) {
        return attachment.getTotalChunks() == null ? 0 : attachment.getTotalChunks();
    }
}
