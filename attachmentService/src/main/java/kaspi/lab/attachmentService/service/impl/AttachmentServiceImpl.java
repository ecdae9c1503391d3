package kaspi.lab.attachmentService.service.impl;

import kaspi.lab.attachmentService.config.AppAttachmentProperties;
import kaspi.lab.attachmentService.config.WorkerSchedulers;
import kaspi.lab.attachmentService.crypto.FileEncryptor;
import kaspi.lab.attachmentService.domain.AttachmentEntity;
import kaspi.lab.attachmentService.domain.AttachmentStatus;
import kaspi.lab.attachmentService.dto.request.ChunkedUploadInitRequest;
import kaspi.lab.attachmentService.dto.response.AttachmentResponse;
import kaspi.lab.attachmentService.dto.response.ChunkUploadResponse;
import kaspi.lab.attachmentService.dto.response.ChunkedUploadCompleteResponse;
import kaspi.lab.attachmentService.dto.response.ChunkedUploadInitResponse;
import kaspi.lab.attachmentService.exception.AttachmentException;
import kaspi.lab.attachmentService.exception.AttachmentNotFoundException;
import kaspi.lab.attachmentService.exception.ErrorCode;
import kaspi.lab.attachmentService.exception.IntegrityException;
import kaspi.lab.attachmentService.exception.InvalidStateException;
import kaspi.lab.attachmentService.exception.ValidationException;
import kaspi.lab.attachmentService.lifecycle.AttachmentLifecycle;
import kaspi.lab.attachmentService.mapper.AttachmentMapper;
import kaspi.lab.attachmentService.repository.AttachmentRepository;
import kaspi.lab.attachmentService.service.AttachmentService;
import kaspi.lab.attachmentService.service.AttachmentStorageCleaner;
import kaspi.lab.attachmentService.service.DownloadedAttachment;
import kaspi.lab.attachmentService.service.IdempotencyGuard;
import kaspi.lab.attachmentService.service.ReassemblyQueue;
import kaspi.lab.attachmentService.storage.StorageBackend;
import kaspi.lab.attachmentService.storage.StorageKeys;
import kaspi.lab.attachmentService.validation.FileValidator;
import kaspi.lab.attachmentService.validation.UploadValidation;
import kaspi.lab.attachmentService.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class AttachmentServiceImpl implements AttachmentService {

    private static final int DOWNLOAD_READ_SIZE = 64 * 1024;
    private static final String COMPLETE_MESSAGE = "Upload complete. Processing in background.";

    private final AttachmentRepository attachmentRepository;
    private final StorageBackend storage;
    private final FileEncryptor encryptor;
    private final FileValidator validator;
    private final AttachmentLifecycle lifecycle;
    private final AttachmentStorageCleaner storageCleaner;
    private final ReassemblyQueue reassemblyQueue;
    private final IdempotencyGuard idempotencyGuard;
    private final AttachmentMapper attachmentMapper;
    private final AppAttachmentProperties props;
    private final WorkerSchedulers schedulers;

    // ключи чанков, которые сейчас пишутся
    private final Set<String> inFlightChunks = ConcurrentHashMap.newKeySet();

    @Override
    public Mono<AttachmentResponse> simpleUpload(String filename, String contentType, Flux<DataBuffer> content,
                                                 Long uploaderId, String idempotencyKey) {
        return idempotencyGuard.tryAcquire(idempotencyKey)
                .flatMap(allowed -> {
                    if (!allowed) {
                        return Mono.error(new AttachmentException(ErrorCode.DUPLICATE_REQUEST));
                    }

                    long limit = props.getSimpleUploadLimit();
                    return readBytes(content, limit, "File too large for simple upload. Use chunked upload for files > "
                            + limit / (1024 * 1024) + "MB.")
                            .flatMap(data -> storeSimpleUpload(filename, contentType, data, uploaderId));
                })
                .map(attachmentMapper::toResponse)
                .doOnSuccess(res -> log.info("Simple upload complete: {} ({}, {} bytes)",
                        res.id(), res.filename(), res.fileSize()))
                .doOnError(err -> log.warn("Simple upload of {} failed: {}", filename, err.getMessage()));
    }

    private Mono<AttachmentEntity> storeSimpleUpload(String filename, String contentType, byte[] data, Long uploaderId) {
        return Mono.fromCallable(() -> seal(filename, contentType, data, uploaderId))
                .subscribeOn(schedulers.crypto())
                .flatMap(sealed -> storage.store(sealed.entity().getStorageKey(), sealed.encrypted())
                        .then(attachmentRepository.save(sealed.entity())));
    }

    private SealedUpload seal(String filename, String contentType, byte[] data, Long uploaderId) {
        UploadValidation validation = validator.validateUpload(data, contentType, filename);
        if (!validation.ok()) {
            throw new ValidationException(validation.errorCode(), validation.error());
        }

        UUID id = UUID.randomUUID();
        byte[] fileKey = encryptor.generateFileKey();
        Instant now = Instant.now();

        AttachmentEntity entity = AttachmentEntity.builder()
                .id(id)
                .uploaderId(uploaderId)
                .filename(validation.sanitizedFilename())
                .contentType(contentType)
                .fileSize((long) data.length)
                .storageKey(StorageKeys.forAttachment(id, validation.sanitizedFilename()))
                .checksumSha256(FileEncryptor.sha256Hex(data))
                .encryptedFileKey(encryptor.wrapKey(fileKey))
                .status(AttachmentStatus.READY)
                .createdAt(now)
                .updatedAt(now)
                .isNewEntry(true)
                .build();
        return new SealedUpload(entity, encryptor.encryptFile(data, fileKey));
    }

    @Override
    public Mono<ChunkedUploadInitResponse> initChunkedUpload(ChunkedUploadInitRequest request, Long uploaderId) {
        return Mono.fromCallable(() -> {
                    if (!validator.validateContentType(request.contentType())) {
                        throw new ValidationException(ErrorCode.CONTENT_TYPE_NOT_ALLOWED,
                                "Content type not allowed: " + request.contentType());
                    }
                    ValidationResult size = validator.validateFileSize(request.totalSize(), request.contentType());
                    if (!size.valid()) {
                        throw new ValidationException(ErrorCode.FILE_SIZE_EXCEEDED, size.reason());
                    }
                    requireConsistentChunking(request);

                    UUID id = UUID.randomUUID();
                    String safeFilename = validator.sanitizeFilename(request.filename());
                    Instant now = Instant.now();

                    return AttachmentEntity.builder()
                            .id(id)
                            .uploaderId(uploaderId)
                            .uploadSession(UUID.randomUUID().toString())
                            .filename(safeFilename)
                            .contentType(request.contentType())
                            .fileSize(request.totalSize())
                            .storageKey(StorageKeys.forAttachment(id, safeFilename))
                            .checksumSha256("")
                            .encryptedFileKey(encryptor.wrapKey(encryptor.generateFileKey()))
                            .status(AttachmentStatus.UPLOADING)
                            .totalChunks(request.totalChunks())
                            .receivedChunks(0)
                            .createdAt(now)
                            .updatedAt(now)
                            .isNewEntry(true)
                            .build();
                })
                .flatMap(attachmentRepository::save)
                .doOnNext(saved -> log.info("Chunked upload initialized: {} ({}, {} chunks, {} bytes)",
                        saved.getId(), saved.getFilename(), saved.getTotalChunks(), saved.getFileSize()))
                .map(attachmentMapper::toInitResponse);
    }

    @Override
    public Mono<ChunkUploadResponse> uploadChunk(UUID uploadId, int chunkIndex, Flux<DataBuffer> content, Long uploaderId) {
        return findOwned(uploadId, uploaderId, "Upload not found: " + uploadId)
                .flatMap(attachment -> {
                    lifecycle.requireUploading(attachment);
                    lifecycle.requireChunkInRange(attachment, chunkIndex);

                    String chunkKey = StorageKeys.forChunk(attachment.getStorageKey(), chunkIndex);
                    if (!inFlightChunks.add(chunkKey)) {
                        return Mono.error(new InvalidStateException(ErrorCode.CHUNK_UPLOAD_IN_PROGRESS,
                                "Chunk " + chunkIndex + " of upload " + uploadId + " is already being uploaded"));
                    }

                    return readBytes(content, props.getMaxChunkSize(),
                            "Chunk exceeds the maximum chunk size of " + props.getMaxChunkSize() + " bytes")
                            .flatMap(data -> storeChunk(attachment, chunkIndex, chunkKey, data))
                            .doFinally(signal -> inFlightChunks.remove(chunkKey));
                });
    }

    private Mono<ChunkUploadResponse> storeChunk(AttachmentEntity attachment, int chunkIndex, String chunkKey, byte[] data) {
        if (data.length == 0) {
            return Mono.error(new ValidationException(ErrorCode.EMPTY_CHUNK, "Empty chunk"));
        }
        UUID id = attachment.getId();
        long declared = attachment.getFileSize() == null ? 0 : attachment.getFileSize();

        return attachmentRepository.sumChunkBytesExcept(id, chunkIndex)
                .defaultIfEmpty(0L)
                .flatMap(stored -> {
                    if (stored + data.length > declared) {
                        return Mono.error(new ValidationException(ErrorCode.FILE_SIZE_EXCEEDED,
                                "Received chunks exceed the declared size of " + declared + " bytes"));
                    }
                    return Mono.fromCallable(() -> encryptor.encryptChunk(data,
                                    encryptor.unwrapKey(attachment.getEncryptedFileKey()), chunkIndex))
                            .subscribeOn(schedulers.crypto());
                })
                .flatMap(encrypted -> storage.store(chunkKey, encrypted)
                        .then(recordChunk(id, chunkIndex, data.length)))
                .flatMap(updated -> {
                    if (updated == 0) {
                        return Mono.error(new InvalidStateException(
                                "Upload " + id + " is no longer accepting chunks"));
                    }
                    return attachmentRepository.findById(id);
                })
                .map(current -> ChunkUploadResponse.builder()
                        .status("received")
                        .chunkIndex(chunkIndex)
                        .receivedChunks(lifecycle.receivedChunks(current))
                        .totalChunks(lifecycle.totalChunks(current))
                        .build())
                .doOnNext(res -> log.debug("Chunk {} uploaded for {} ({} bytes, {}/{})",
                        chunkIndex, id, data.length, res.receivedChunks(), res.totalChunks()));
    }

    /**
     * Records the chunk under its index, then recounts. Both steps are idempotent, so a retry
     * after any partial failure converges on the right counter.
     */
    private Mono<Integer> recordChunk(UUID id, int chunkIndex, long size) {
        Instant now = Instant.now();
        return attachmentRepository.updateChunkRecord(id, chunkIndex, size, now)
                .flatMap(updated -> {
                    if (updated > 0) {
                        log.debug("Chunk {} of {} re-uploaded, replacing previous record", chunkIndex, id);
                        return Mono.just(updated);
                    }
                    return attachmentRepository.insertChunkRecord(id, chunkIndex, size, now);
                })
                // строку удалили или тот же индекс записал другой узел; пересчёт ниже всё решит
                .onErrorResume(DataIntegrityViolationException.class, e -> {
                    log.warn("Chunk {} of {} was not recorded: {}", chunkIndex, id, e.getMessage());
                    return Mono.just(0);
                })
                .then(attachmentRepository.recountReceivedChunks(id, now));
    }

    @Override
    public Mono<ChunkedUploadCompleteResponse> completeChunkedUpload(UUID uploadId, Long uploaderId) {
        return attachmentRepository.recountReceivedChunks(uploadId, Instant.now())
                .then(findOwned(uploadId, uploaderId, "Upload not found: " + uploadId))
                .flatMap(attachment -> {
                    lifecycle.requireUploading(attachment);
                    lifecycle.requireAllChunksReceived(attachment);
                    lifecycle.checkTransition(attachment.getStatus(), AttachmentStatus.PROCESSING);

                    return attachmentRepository.markProcessing(uploadId, uploaderId, Instant.now())
                            .flatMap(updated -> {
                                if (updated == 0) {
                                    // параллельный complete уже перевёл загрузку дальше
                                    return Mono.error(new InvalidStateException(
                                            "Upload " + uploadId + " is not in uploading state"));
                                }
                                attachment.setStatus(AttachmentStatus.PROCESSING);
                                log.info("Upload {} complete, queued for reassembly", uploadId);
                                reassemblyQueue.submit(uploadId);
                                return Mono.just(ChunkedUploadCompleteResponse.builder()
                                        .attachment(attachmentMapper.toResponse(attachment))
                                        .message(COMPLETE_MESSAGE)
                                        .build());
                            });
                });
    }

    @Override
    public Mono<DownloadedAttachment> download(UUID attachmentId) {
        return attachmentRepository.findById(attachmentId)
                .filter(attachment -> attachment.getStatus() == AttachmentStatus.READY)
                .switchIfEmpty(Mono.error(new AttachmentNotFoundException("Attachment not found or not ready")))
                .flatMap(attachment -> storage.stream(attachment.getStorageKey(), DOWNLOAD_READ_SIZE)
                        .reduce(new ByteArrayOutputStream(), (out, part) -> {
                            out.writeBytes(part);
                            return out;
                        })
                        .publishOn(schedulers.crypto())
                        .map(out -> {
                            byte[] fileKey = encryptor.unwrapKey(attachment.getEncryptedFileKey());
                            byte[] data = encryptor.decryptFile(out.toByteArray(), fileKey);

                            String actual = FileEncryptor.sha256Hex(data);
                            if (!actual.equals(attachment.getChecksumSha256())) {
                                log.error("Checksum mismatch for {}: expected {}, got {}",
                                        attachmentId, attachment.getChecksumSha256(), actual);
                                throw new IntegrityException("File integrity check failed");
                            }
                            return new DownloadedAttachment(attachment.getFilename(), attachment.getContentType(), data);
                        }));
    }

    @Override
    public Mono<AttachmentResponse> getInfo(UUID attachmentId) {
        return attachmentRepository.findById(attachmentId)
                .switchIfEmpty(Mono.error(new AttachmentNotFoundException(attachmentId)))
                .map(attachmentMapper::toResponse);
    }

    @Override
    public Mono<Void> delete(UUID attachmentId, Long uploaderId) {
        return findOwned(attachmentId, uploaderId,
                "Attachment not found or you don't have permission to delete it")
                .flatMap(attachment -> {
                    lifecycle.requireDeletable(attachment);

                    return attachmentRepository.deleteIfUnlinked(attachmentId, uploaderId)
                            .flatMap(deleted -> {
                                if (deleted == 0) {
                                    return attachmentRepository.existsById(attachmentId)
                                            .flatMap(exists -> Mono.<Void>error(exists
                                                    ? new InvalidStateException(ErrorCode.ATTACHMENT_LINKED,
                                                    ErrorCode.ATTACHMENT_LINKED.getMessage())
                                                    : new AttachmentNotFoundException(attachmentId)));
                                }
                                log.info("Attachment deleted: {}", attachmentId);
                                return storageCleaner.deleteObjects(attachment);
                            });
                });
    }

    @Override
    public Mono<AttachmentResponse> linkToComment(UUID attachmentId, Long commentId, Long uploaderId) {
        return attachmentRepository.linkToComment(attachmentId, commentId, uploaderId, Instant.now())
                .flatMap(updated -> {
                    if (updated == 1) {
                        log.info("Attachment {} linked to comment {}", attachmentId, commentId);
                        return attachmentRepository.findById(attachmentId);
                    }
                    return findOwned(attachmentId, uploaderId, "Attachment not found: " + attachmentId)
                            .flatMap(attachment -> {
                                lifecycle.requireLinkable(attachment);
                                return Mono.<AttachmentEntity>error(new InvalidStateException(
                                        "Attachment " + attachmentId + " could not be linked"));
                            });
                })
                .map(attachmentMapper::toResponse);
    }

    @Override
    public Flux<AttachmentResponse> linkAll(Long commentId, Long uploaderId, Collection<UUID> attachmentIds) {
        return Flux.fromIterable(attachmentIds)
                .distinct()
                .concatMap(id -> linkToComment(id, commentId, uploaderId)
                        .onErrorResume(AttachmentException.class, e -> {
                            log.warn("Skipping attachment {} for comment {}: {}", id, commentId, e.getMessage());
                            return Mono.empty();
                        }));
    }

    private void requireConsistentChunking(ChunkedUploadInitRequest request) {
        if (request.totalChunks() > request.totalSize()) {
            throw new ValidationException(ErrorCode.INVALID_INPUT_VALUE,
                    "Total chunks " + request.totalChunks() + " exceed total size of " + request.totalSize() + " bytes");
        }
        // каждый чанк не больше max-chunk-size, иначе заявленный размер не набрать
        if (request.totalSize() > (long) request.totalChunks() * props.getMaxChunkSize()) {
            throw new ValidationException(ErrorCode.INVALID_INPUT_VALUE,
                    "Total size of " + request.totalSize() + " bytes does not fit into " + request.totalChunks()
                            + " chunks of at most " + props.getMaxChunkSize() + " bytes");
        }
    }

    private Mono<AttachmentEntity> findOwned(UUID id, Long uploaderId, String notFoundMessage) {
        return attachmentRepository.findByIdAndUploaderId(id, uploaderId)
                .switchIfEmpty(Mono.error(new AttachmentNotFoundException(notFoundMessage)));
    }

    private static Mono<byte[]> readBytes(Flux<DataBuffer> content, long limit, String tooLargeMessage) {
        return DataBufferUtils.join(content, (int) Math.min(limit, Integer.MAX_VALUE))
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .onErrorMap(DataBufferLimitException.class,
                        e -> new ValidationException(ErrorCode.FILE_TOO_LARGE, tooLargeMessage));
    }

    private record SealedUpload(AttachmentEntity entity, byte[] encrypted) {}
}
