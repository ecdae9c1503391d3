package kaspi.lab.attachmentService.service;

import kaspi.lab.attachmentService.config.WorkerSchedulers;
import kaspi.lab.attachmentService.crypto.FileEncryptor;
import kaspi.lab.attachmentService.domain.AttachmentEntity;
import kaspi.lab.attachmentService.domain.AttachmentStatus;
import kaspi.lab.attachmentService.event.AttachmentEventPublisher;
import kaspi.lab.attachmentService.exception.AttachmentException;
import kaspi.lab.attachmentService.exception.ErrorCode;
import kaspi.lab.attachmentService.exception.IntegrityException;
import kaspi.lab.attachmentService.exception.ValidationException;
import kaspi.lab.attachmentService.mapper.AttachmentMapper;
import kaspi.lab.attachmentService.repository.AttachmentRepository;
import kaspi.lab.attachmentService.storage.StorageBackend;
import kaspi.lab.attachmentService.storage.StorageKeys;
import kaspi.lab.attachmentService.validation.FileValidator;
import kaspi.lab.attachmentService.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns the encrypted chunks of a completed upload into a single encrypted file.
 *
 * <p>Chunks are decrypted in order and their embedded index is checked against the position. The
 * running size is checked after every chunk against the declared size and the category limit, so
 * an oversized upload is rejected before it is fully buffered. The reassembled bytes then go
 * through magic-byte validation, are hashed, re-encrypted under the same file key and stored at
 * the attachment's storage key. All CPU work runs on the reassembly scheduler. Any failure moves
 * the row to QUARANTINED. Errors never leave {@link #reassemble}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReassemblyWorker {

    private final AttachmentRepository attachmentRepository;
    private final StorageBackend storage;
    private final FileEncryptor encryptor;
    private final FileValidator validator;
    private final AttachmentStorageCleaner storageCleaner;
    private final AttachmentEventPublisher eventPublisher;
    private final AttachmentMapper attachmentMapper;
    private final WorkerSchedulers schedulers;

    public Mono<ReassemblyResult> reassemble(UUID attachmentId) {
        return attachmentRepository.findById(attachmentId)
                .publishOn(schedulers.reassembly())
                .flatMap(attachment -> {
                    if (attachment.getStatus() != AttachmentStatus.PROCESSING) {
                        log.warn("Skipping reassembly of {}: status is {}", attachmentId, attachment.getStatus().value());
                        return Mono.just(ReassemblyResult.skipped(attachmentId, attachment.getStatus(),
                                "Attachment is not processing"));
                    }
                    return process(attachment)
                            .onErrorResume(e -> quarantine(attachment, e));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Skipping reassembly of {}: attachment no longer exists", attachmentId);
                    return ReassemblyResult.skipped(attachmentId, null, "Attachment not found");
                }))
                .onErrorResume(e -> {
                    log.error("Reassembly of {} failed before it could be quarantined", attachmentId, e);
                    return abandon(attachmentId, e);
                });
    }

    /** Quarantines a PROCESSING row whose reassembly could not even be started. */
    public Mono<ReassemblyResult> abandon(UUID attachmentId, Throwable cause) {
        return attachmentRepository.findById(attachmentId)
                .flatMap(attachment -> quarantine(attachment, cause))
                .switchIfEmpty(Mono.fromSupplier(() -> ReassemblyResult.skipped(attachmentId, null, "Attachment not found")))
                .onErrorResume(e -> {
                    log.error("Failed to quarantine abandoned upload {}", attachmentId, e);
                    return Mono.just(ReassemblyResult.skipped(attachmentId, AttachmentStatus.PROCESSING, describe(e)));
                });
    }

    private Mono<ReassemblyResult> process(AttachmentEntity attachment) {
        UUID id = attachment.getId();
        String storageKey = attachment.getStorageKey();
        int totalChunks = attachment.getTotalChunks() == null ? 0 : attachment.getTotalChunks();

        log.info("Reassembling upload {} from {} chunks", id, totalChunks);

        return Mono.fromCallable(() -> encryptor.unwrapKey(attachment.getEncryptedFileKey()))
                .flatMap(fileKey -> readChunks(attachment, totalChunks, fileKey)
                        .publishOn(schedulers.reassembly())
                        .flatMap(data -> {
                            validateContent(data, attachment.getContentType());

                            String checksum = FileEncryptor.sha256Hex(data);
                            byte[] encrypted = encryptor.encryptFile(data, fileKey);

                            return storage.store(storageKey, encrypted)
                                    .then(storageCleaner.deleteChunks(storageKey, totalChunks))
                                    .then(attachmentRepository.markReady(id, data.length, checksum, Instant.now()))
                                    .flatMap(updated -> attachmentRepository.deleteChunkRecords(id).thenReturn(updated))
                                    .flatMap(updated -> {
                                        if (updated == 0) {
                                            // строку удалили, пока шла сборка
                                            log.warn("Upload {} left processing state during reassembly, discarding result", id);
                                            return storageCleaner.deleteObjects(attachment)
                                                    .thenReturn(ReassemblyResult.skipped(id, null, "Attachment left processing state"));
                                        }
                                        attachment.setFileSize((long) data.length);
                                        attachment.setChecksumSha256(checksum);
                                        attachment.setStatus(AttachmentStatus.READY);
                                        log.info("Upload {} is ready ({} bytes, sha256={})", id, data.length, checksum);
                                        return publishReady(attachment).thenReturn(ReassemblyResult.ready(id));
                                    });
                        }));
    }

    private Mono<byte[]> readChunks(AttachmentEntity attachment, int totalChunks, byte[] fileKey) {
        String storageKey = attachment.getStorageKey();
        long declared = attachment.getFileSize() == null ? Long.MAX_VALUE : attachment.getFileSize();
        AtomicLong received = new AtomicLong();

        return Flux.range(0, totalChunks)
                .concatMap(i -> storage.retrieve(StorageKeys.forChunk(storageKey, i))
                        .publishOn(schedulers.reassembly())
                        .map(encryptedChunk -> {
                            FileEncryptor.DecryptedChunk chunk = encryptor.decryptChunk(encryptedChunk, fileKey);
                            if (chunk.index() != i) {
                                throw new IntegrityException(
                                        "Chunk ordering mismatch: expected " + i + ", got " + chunk.index());
                            }
                            requireWithinLimits(received.addAndGet(chunk.data().length), declared,
                                    attachment.getContentType());
                            return chunk.data();
                        }))
                .reduce(new ByteArrayOutputStream(), (out, data) -> {
                    out.writeBytes(data);
                    return out;
                })
                .map(ByteArrayOutputStream::toByteArray);
    }

    private void requireWithinLimits(long receivedBytes, long declaredBytes, String contentType) {
        if (receivedBytes > declaredBytes) {
            throw new ValidationException(ErrorCode.FILE_SIZE_EXCEEDED,
                    "Reassembled size exceeds the declared " + declaredBytes + " bytes");
        }
        ValidationResult size = validator.validateFileSize(receivedBytes, contentType);
        if (!size.valid()) {
            throw new ValidationException(ErrorCode.FILE_SIZE_EXCEEDED, size.reason());
        }
    }

    private void validateContent(byte[] data, String contentType) {
        if (!validator.validateMagicBytes(data, contentType)) {
            throw new ValidationException(ErrorCode.MAGIC_BYTES_MISMATCH,
                    "File content does not match claimed content type " + contentType);
        }
    }

    private Mono<ReassemblyResult> quarantine(AttachmentEntity attachment, Throwable cause) {
        UUID id = attachment.getId();
        String reason = describe(cause);
        if (cause instanceof ValidationException) {
            log.warn("Upload {} rejected after reassembly: {}", id, reason);
        } else {
            log.error("Reassembly of upload {} failed, quarantining", id, cause);
        }

        int totalChunks = attachment.getTotalChunks() == null ? 0 : attachment.getTotalChunks();
        return attachmentRepository.markQuarantined(id, Instant.now())
                .flatMap(updated -> storageCleaner.deleteChunks(attachment.getStorageKey(), totalChunks)
                        .then(attachmentRepository.deleteChunkRecords(id))
                        .then(Mono.defer(() -> {
                            if (updated == 0) {
                                log.warn("Upload {} is no longer processing, not quarantined", id);
                                return Mono.just(ReassemblyResult.skipped(id, null, reason));
                            }
                            return publishQuarantined(attachment, reason)
                                    .thenReturn(ReassemblyResult.quarantined(id, reason));
                        })));
    }

    private Mono<Void> publishReady(AttachmentEntity attachment) {
        return eventPublisher.attachmentReady(attachmentMapper.toReadyEvent(attachment))
                .onErrorResume(e -> {
                    log.error("Failed to publish ready event for {}", attachment.getId(), e);
                    return Mono.empty();
                });
    }

    private Mono<Void> publishQuarantined(AttachmentEntity attachment, String reason) {
        return eventPublisher.attachmentQuarantined(attachmentMapper.toQuarantinedEvent(attachment, reason))
                .onErrorResume(e -> {
                    log.error("Failed to publish quarantine event for {}", attachment.getId(), e);
                    return Mono.empty();
                });
    }

    private static String describe(Throwable e) {
        if (e instanceof AttachmentException ae) {
            return ae.getErrorCode().name() + ": " + ae.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
