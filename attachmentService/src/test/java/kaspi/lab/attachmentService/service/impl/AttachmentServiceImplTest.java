package kaspi.lab.attachmentService.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import kaspi.lab.attachmentService.config.AppAttachmentProperties;
import kaspi.lab.attachmentService.config.WorkerSchedulers;
import kaspi.lab.attachmentService.crypto.FileEncryptor;
import kaspi.lab.attachmentService.domain.AttachmentEntity;
import kaspi.lab.attachmentService.domain.AttachmentStatus;
import kaspi.lab.attachmentService.domain.OutboxEntity;
import kaspi.lab.attachmentService.dto.request.ChunkedUploadInitRequest;
import kaspi.lab.attachmentService.dto.response.AttachmentResponse;
import kaspi.lab.attachmentService.dto.response.ChunkUploadResponse;
import kaspi.lab.attachmentService.dto.response.ChunkedUploadCompleteResponse;
import kaspi.lab.attachmentService.dto.response.ChunkedUploadInitResponse;
import kaspi.lab.attachmentService.event.OutboxAttachmentEventPublisher;
import kaspi.lab.attachmentService.exception.AttachmentException;
import kaspi.lab.attachmentService.exception.AttachmentNotFoundException;
import kaspi.lab.attachmentService.exception.ChunkIndexOutOfRangeException;
import kaspi.lab.attachmentService.exception.ErrorCode;
import kaspi.lab.attachmentService.exception.IntegrityException;
import kaspi.lab.attachmentService.exception.InvalidStateException;
import kaspi.lab.attachmentService.exception.ValidationException;
import kaspi.lab.attachmentService.lifecycle.AttachmentLifecycle;
import kaspi.lab.attachmentService.mapper.AttachmentMapper;
import kaspi.lab.attachmentService.repository.AttachmentRepository;
import kaspi.lab.attachmentService.repository.OutboxRepository;
import kaspi.lab.attachmentService.service.AttachmentStorageCleaner;
import kaspi.lab.attachmentService.service.IdempotencyGuard;
import kaspi.lab.attachmentService.service.ReassemblyQueue;
import kaspi.lab.attachmentService.service.ReassemblyResult;
import kaspi.lab.attachmentService.service.ReassemblyWorker;
import kaspi.lab.attachmentService.storage.InMemoryStorageBackend;
import kaspi.lab.attachmentService.storage.StorageKeys;
import kaspi.lab.attachmentService.validation.FileValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.stubbing.Answer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.test.context.ActiveProfiles;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

@DataR2dbcTest
@ActiveProfiles("test")
@Import({
        AttachmentServiceImpl.class,
        ReassemblyQueue.class,
        ReassemblyWorker.class,
        FileEncryptor.class,
        FileValidator.class,
        AttachmentLifecycle.class,
        AttachmentStorageCleaner.class,
        OutboxAttachmentEventPublisher.class,
        WorkerSchedulers.class,
        AttachmentServiceImplTest.Config.class
})
class AttachmentServiceImplTest {

    private static final Long OWNER = 1L;
    private static final Long STRANGER = 2L;
    private static final int CHUNK_SIZE = 100_000;

    @TestConfiguration
    @EnableConfigurationProperties(AppAttachmentProperties.class)
    static class Config {

        @Bean
        InMemoryStorageBackend storageBackend() {
            return new InMemoryStorageBackend();
        }

        @Bean
        AttachmentMapper attachmentMapper() {
            return Mappers.getMapper(AttachmentMapper.class);
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    @Autowired
    private AttachmentServiceImpl attachmentService;

    @Autowired
    private AttachmentRepository attachmentRepository;

    @Autowired
    private OutboxRepository outboxRepository;

    @Autowired
    private InMemoryStorageBackend storage;

    @Autowired
    private ReassemblyQueue reassemblyQueue;

    @SpyBean
    private FileEncryptor fileEncryptor;

    @MockBean
    private IdempotencyGuard idempotencyGuard;

    @BeforeEach
    void setUp() {
        attachmentRepository.deleteAll().block();
        outboxRepository.deleteAll().block();
        for (String key : storage.keys()) {
            storage.delete(key).block();
        }
        when(idempotencyGuard.tryAcquire(any())).thenReturn(Mono.just(true));
    }

    // ── chunked upload ──────────────────────────────

    @Test
    void chunkedUploadEndToEnd() throws Exception {
        byte[] original = jpeg(3 * CHUNK_SIZE);
        ChunkedUploadInitResponse init = init("car front.jpg", "image/jpeg", original.length, 3);

        for (int i = 0; i < 3; i++) {
            ChunkUploadResponse chunk = attachmentService
                    .uploadChunk(init.uploadId(), i, content(slice(original, i)), OWNER).block();
            assertThat(chunk.receivedChunks()).isEqualTo(i + 1);
            assertThat(chunk.totalChunks()).isEqualTo(3);
        }

        ReassemblyResult result = completeAndAwait(init.uploadId());

        assertThat(result.status()).isEqualTo(AttachmentStatus.READY);

        AttachmentResponse info = attachmentService.getInfo(init.uploadId()).block();
        assertThat(info.status()).isEqualTo("ready");
        assertThat(info.filename()).isEqualTo("car_front.jpg");
        assertThat(info.fileSize()).isEqualTo(300_000L);
        assertThat(info.checksumSha256()).isEqualTo(FileEncryptor.sha256Hex(original));

        StepVerifier.create(attachmentService.download(init.uploadId()))
                .assertNext(file -> {
                    assertThat(file.data()).isEqualTo(original);
                    assertThat(file.contentType()).isEqualTo("image/jpeg");
                })
                .verifyComplete();

        AttachmentEntity row = attachmentRepository.findById(init.uploadId()).block();
        assertThat(row.getUploadSession()).isNull();
        assertThat(storage.keys()).containsExactly(row.getStorageKey());
        assertThat(outboxRepository.findAllByStatus(OutboxEntity.STATUS_NEW).collectList().block())
                .extracting(OutboxEntity::getEventType)
                .containsExactly(OutboxAttachmentEventPublisher.ATTACHMENT_READY);
    }

    @Test
    void completeIsRefusedUntilEveryChunkArrived() {
        byte[] original = jpeg(3 * CHUNK_SIZE);
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", original.length, 3);
        upload(init.uploadId(), 0, slice(original, 0));
        upload(init.uploadId(), 2, slice(original, 2));

        StepVerifier.create(attachmentService.completeChunkedUpload(init.uploadId(), OWNER))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(InvalidStateException.class)
                        .hasMessage("Missing chunks: received 2/3"))
                .verify();

        assertThat(status(init.uploadId())).isEqualTo(AttachmentStatus.UPLOADING);
    }

    @Test
    void chunkIndexOutsideDeclaredTotalIsRejected() {
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", 10, 3);

        StepVerifier.create(attachmentService.uploadChunk(init.uploadId(), 3, content(new byte[]{1}), OWNER))
                .expectError(ChunkIndexOutOfRangeException.class)
                .verify();
        StepVerifier.create(attachmentService.uploadChunk(init.uploadId(), -1, content(new byte[]{1}), OWNER))
                .expectError(ChunkIndexOutOfRangeException.class)
                .verify();
    }

    @Test
    void retriedChunkIsNotCountedTwice() {
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", 20, 2);

        upload(init.uploadId(), 0, new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF});
        ChunkUploadResponse retry = attachmentService
                .uploadChunk(init.uploadId(), 0, content(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0}), OWNER)
                .block();

        assertThat(retry.receivedChunks()).isEqualTo(1);
    }

    @Test
    void emptyChunkIsRejected() {
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", 20, 2);

        StepVerifier.create(attachmentService.uploadChunk(init.uploadId(), 0, Flux.empty(), OWNER))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(ValidationException.class)
                        .extracting("errorCode").isEqualTo(ErrorCode.EMPTY_CHUNK))
                .verify();
    }

    @Test
    void strangerCannotUploadIntoSomeoneElsesSession() {
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", 20, 2);

        StepVerifier.create(attachmentService.uploadChunk(init.uploadId(), 0, content(new byte[]{1}), STRANGER))
                .expectError(AttachmentNotFoundException.class)
                .verify();
    }

    @Test
    void initRejectsDisallowedTypeAndOversizedDeclaration() {
        StepVerifier.create(attachmentService.initChunkedUpload(request("a.exe", "application/x-msdownload", 10, 1), OWNER))
                .expectErrorSatisfies(e -> assertThat(e).extracting("errorCode").isEqualTo(ErrorCode.CONTENT_TYPE_NOT_ALLOWED))
                .verify();
        StepVerifier.create(attachmentService.initChunkedUpload(request("a.jpg", "image/jpeg", 21L * 1024 * 1024, 3), OWNER))
                .expectErrorSatisfies(e -> assertThat(e).extracting("errorCode").isEqualTo(ErrorCode.FILE_SIZE_EXCEEDED))
                .verify();
    }

    @Test
    void mismatchedContentIsQuarantined() throws Exception {
        byte[] png = new byte[64];
        byte[] signature = {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A};
        System.arraycopy(signature, 0, png, 0, signature.length);
        ChunkedUploadInitResponse init = init("fake.jpg", "image/jpeg", png.length, 1);
        upload(init.uploadId(), 0, png);

        ReassemblyResult result = completeAndAwait(init.uploadId());

        assertThat(result.status()).isEqualTo(AttachmentStatus.QUARANTINED);
        assertThat(result.reason()).contains(ErrorCode.MAGIC_BYTES_MISMATCH.name());
        assertThat(status(init.uploadId())).isEqualTo(AttachmentStatus.QUARANTINED);
        assertThat(storage.keys()).isEmpty();
        assertThat(outboxRepository.findAll().collectList().block())
                .extracting(OutboxEntity::getEventType)
                .containsExactly(OutboxAttachmentEventPublisher.ATTACHMENT_QUARANTINED);

        StepVerifier.create(attachmentService.download(init.uploadId()))
                .expectError(AttachmentNotFoundException.class)
                .verify();
    }

    @Test
    void swappedChunkObjectsAreQuarantined() throws Exception {
        byte[] original = jpeg(3 * CHUNK_SIZE);
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", original.length, 3);
        for (int i = 0; i < 3; i++) {
            upload(init.uploadId(), i, slice(original, i));
        }

        String storageKey = attachmentRepository.findById(init.uploadId()).block().getStorageKey();
        String first = StorageKeys.forChunk(storageKey, 0);
        String second = StorageKeys.forChunk(storageKey, 1);
        byte[] firstBytes = storage.retrieve(first).block();
        byte[] secondBytes = storage.retrieve(second).block();
        storage.store(first, secondBytes).then(storage.store(second, firstBytes)).block();

        ReassemblyResult result = completeAndAwait(init.uploadId());

        assertThat(result.status()).isEqualTo(AttachmentStatus.QUARANTINED);
        assertThat(result.reason()).contains("Chunk ordering mismatch: expected 0, got 1");
        assertThat(storage.keys()).isEmpty();
    }

    @Test
    void secondCompleteIsAStateError() throws Exception {
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", 4, 1);
        upload(init.uploadId(), 0, new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00});

        completeAndAwait(init.uploadId());

        StepVerifier.create(attachmentService.completeChunkedUpload(init.uploadId(), OWNER))
                .expectError(InvalidStateException.class)
                .verify();
    }

    @Test
    void chunksBeyondDeclaredSizeAreRejected() {
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", 10, 2);
        upload(init.uploadId(), 0, jpeg(8));

        StepVerifier.create(attachmentService.uploadChunk(init.uploadId(), 1, content(jpeg(8)), OWNER))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(ValidationException.class)
                        .hasMessage("Received chunks exceed the declared size of 10 bytes")
                        .extracting("errorCode").isEqualTo(ErrorCode.FILE_SIZE_EXCEEDED))
                .verify();

        AttachmentEntity row = attachmentRepository.findById(init.uploadId()).block();
        assertThat(row.getReceivedChunks()).isEqualTo(1);
        assertThat(storage.keys()).containsExactly(StorageKeys.forChunk(row.getStorageKey(), 0));

        // повтор чанка заменяет его байты, а не добавляет к ним
        upload(init.uploadId(), 0, jpeg(6));
        ChunkUploadResponse last = attachmentService.uploadChunk(init.uploadId(), 1, content(new byte[4]), OWNER).block();
        assertThat(last.receivedChunks()).isEqualTo(2);
    }

    @Test
    void initRejectsInconsistentChunking() {
        StepVerifier.create(attachmentService.initChunkedUpload(request("a.jpg", "image/jpeg", 2, 3), OWNER))
                .expectErrorSatisfies(e -> assertThat(e).extracting("errorCode").isEqualTo(ErrorCode.INVALID_INPUT_VALUE))
                .verify();
        StepVerifier.create(attachmentService.initChunkedUpload(request("a.jpg", "image/jpeg", 15L * 1024 * 1024, 1), OWNER))
                .expectErrorSatisfies(e -> assertThat(e).extracting("errorCode").isEqualTo(ErrorCode.INVALID_INPUT_VALUE))
                .verify();
        assertThat(attachmentRepository.count().block()).isZero();
    }

    @Test
    void oversizedChunkObjectIsQuarantinedDuringReassembly() throws Exception {
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", 10, 2);
        upload(init.uploadId(), 0, jpeg(5));
        upload(init.uploadId(), 1, new byte[5]);

        AttachmentEntity row = attachmentRepository.findById(init.uploadId()).block();
        byte[] fileKey = fileEncryptor.unwrapKey(row.getEncryptedFileKey());
        storage.store(StorageKeys.forChunk(row.getStorageKey(), 1), fileEncryptor.encryptChunk(new byte[64], fileKey, 1))
                .block();

        ReassemblyResult result = completeAndAwait(init.uploadId());

        assertThat(result.status()).isEqualTo(AttachmentStatus.QUARANTINED);
        assertThat(result.reason()).contains(ErrorCode.FILE_SIZE_EXCEEDED.name());
        assertThat(storage.keys()).isEmpty();
    }

    @Test
    void chunkStoredWithoutRecordIsCountedOnRetry() {
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", 8, 2);
        AttachmentEntity row = attachmentRepository.findById(init.uploadId()).block();
        byte[] fileKey = fileEncryptor.unwrapKey(row.getEncryptedFileKey());
        // объект чанка уже лежит в хранилище, а запись о нём так и не появилась
        storage.store(StorageKeys.forChunk(row.getStorageKey(), 0), fileEncryptor.encryptChunk(jpeg(4), fileKey, 0))
                .block();

        ChunkUploadResponse retry = attachmentService.uploadChunk(init.uploadId(), 0, content(jpeg(4)), OWNER).block();

        assertThat(retry.receivedChunks()).isEqualTo(1);
    }

    @Test
    void completeRecountsChunksWhoseCounterUpdateWasLost() throws Exception {
        byte[] original = jpeg(2 * CHUNK_SIZE);
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", original.length, 2);
        upload(init.uploadId(), 0, slice(original, 0));

        AttachmentEntity row = attachmentRepository.findById(init.uploadId()).block();
        byte[] fileKey = fileEncryptor.unwrapKey(row.getEncryptedFileKey());
        storage.store(StorageKeys.forChunk(row.getStorageKey(), 1), fileEncryptor.encryptChunk(slice(original, 1), fileKey, 1))
                .then(attachmentRepository.insertChunkRecord(init.uploadId(), 1, CHUNK_SIZE, Instant.now()))
                .block();
        assertThat(attachmentRepository.findById(init.uploadId()).block().getReceivedChunks()).isEqualTo(1);

        ReassemblyResult result = completeAndAwait(init.uploadId());

        assertThat(result.status()).isEqualTo(AttachmentStatus.READY);
        assertThat(attachmentService.download(init.uploadId()).block().data()).isEqualTo(original);
    }

    @Test
    void parallelChunkUploadsAreAllCounted() throws Exception {
        int chunks = 8;
        byte[] original = jpeg(chunks * CHUNK_SIZE);
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", original.length, chunks);

        Flux.range(0, chunks)
                .flatMap(i -> attachmentService.uploadChunk(init.uploadId(), i, content(slice(original, i)), OWNER)
                        .subscribeOn(Schedulers.parallel()), chunks)
                .blockLast(Duration.ofSeconds(30));

        assertThat(attachmentRepository.findById(init.uploadId()).block().getReceivedChunks()).isEqualTo(chunks);

        ReassemblyResult result = completeAndAwait(init.uploadId());

        assertThat(result.status()).isEqualTo(AttachmentStatus.READY);
        assertThat(attachmentService.download(init.uploadId()).block().data()).isEqualTo(original);
    }

    @Test
    void concurrentCompletesQueueOneReassembly() throws Exception {
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", 4, 1);
        upload(init.uploadId(), 0, new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00});

        CompletableFuture<List<ReassemblyResult>> results = reassemblyQueue.results()
                .filter(r -> r.attachmentId().equals(init.uploadId()))
                .take(Duration.ofSeconds(3))
                .collectList()
                .toFuture();

        List<Object> outcomes = Flux.range(0, 2)
                .flatMap(i -> attachmentService.completeChunkedUpload(init.uploadId(), OWNER)
                        .cast(Object.class)
                        .onErrorResume(Mono::just)
                        .subscribeOn(Schedulers.parallel()))
                .collectList()
                .block(Duration.ofSeconds(10));

        assertThat(outcomes).hasSize(2);
        assertThat(outcomes).filteredOn(ChunkedUploadCompleteResponse.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(InvalidStateException.class::isInstance).hasSize(1);
        assertThat(results.get(10, TimeUnit.SECONDS))
                .singleElement()
                .extracting(ReassemblyResult::status)
                .isEqualTo(AttachmentStatus.READY);
    }

    @Test
    void cryptoWorkStaysOffTheCallingThread() throws Exception {
        Map<String, Set<String>> threads = new ConcurrentHashMap<>();
        Answer<Object> recordThread = invocation -> {
            threads.computeIfAbsent(invocation.getMethod().getName(), name -> ConcurrentHashMap.newKeySet())
                    .add(Thread.currentThread().getName());
            return invocation.callRealMethod();
        };
        doAnswer(recordThread).when(fileEncryptor).encryptChunk(any(), any(), anyInt());
        doAnswer(recordThread).when(fileEncryptor).decryptChunk(any(), any());
        doAnswer(recordThread).when(fileEncryptor).encryptFile(any(), any());
        doAnswer(recordThread).when(fileEncryptor).decryptFile(any(), any());

        byte[] original = jpeg(2 * CHUNK_SIZE);
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", original.length, 2);
        upload(init.uploadId(), 0, slice(original, 0));
        upload(init.uploadId(), 1, slice(original, 1));
        completeAndAwait(init.uploadId());

        assertThat(threads.get("encryptChunk")).isNotEmpty().allMatch(name -> name.startsWith("crypto-"));
        assertThat(threads.get("decryptChunk")).isNotEmpty().allMatch(name -> name.startsWith("reassembly-"));
        assertThat(threads.get("encryptFile")).isNotEmpty().allMatch(name -> name.startsWith("reassembly-"));

        threads.clear();
        AttachmentResponse simple = simpleUpload("photo.jpg", jpeg(1024));
        attachmentService.download(simple.id()).block();

        assertThat(threads.get("encryptFile")).isNotEmpty().allMatch(name -> name.startsWith("crypto-"));
        assertThat(threads.get("decryptFile")).isNotEmpty().allMatch(name -> name.startsWith("crypto-"));
    }

    // ── simple upload ───────────────────────────────

    @Test
    void simpleUploadIsReadyImmediately() {
        byte[] original = jpeg(2048);

        AttachmentResponse response = simpleUpload("photo.jpg", original);

        assertThat(response.status()).isEqualTo("ready");
        assertThat(response.fileSize()).isEqualTo(2048L);
        assertThat(response.checksumSha256()).isEqualTo(FileEncryptor.sha256Hex(original));
        assertThat(attachmentService.download(response.id()).block().data()).isEqualTo(original);
    }

    @Test
    void simpleUploadAboveLimitIsTooLarge() {
        byte[] tooBig = jpeg(5 * 1024 * 1024 + 1);

        StepVerifier.create(attachmentService.simpleUpload("big.jpg", "image/jpeg", content(tooBig), OWNER, null))
                .expectErrorSatisfies(e -> assertThat(e).extracting("errorCode").isEqualTo(ErrorCode.FILE_TOO_LARGE))
                .verify();
        assertThat(storage.keys()).isEmpty();
    }

    @Test
    void simpleUploadWithForgedContentIsRejected() {
        byte[] notAJpeg = "%PDF-1.7 pretending".getBytes(StandardCharsets.US_ASCII);

        StepVerifier.create(attachmentService.simpleUpload("doc.jpg", "image/jpeg", content(notAJpeg), OWNER, null))
                .expectErrorSatisfies(e -> assertThat(e).extracting("errorCode").isEqualTo(ErrorCode.MAGIC_BYTES_MISMATCH))
                .verify();
    }

    @Test
    void duplicateIdempotencyKeyIsRejected() {
        when(idempotencyGuard.tryAcquire("dup-key")).thenReturn(Mono.just(false));

        StepVerifier.create(attachmentService.simpleUpload("photo.jpg", "image/jpeg", content(jpeg(16)), OWNER, "dup-key"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(AttachmentException.class)
                        .extracting("errorCode").isEqualTo(ErrorCode.DUPLICATE_REQUEST))
                .verify();
    }

    // ── download integrity ──────────────────────────

    @Test
    void tamperedCiphertextFailsDownload() {
        AttachmentResponse response = simpleUpload("photo.jpg", jpeg(512));
        String key = storage.keys().iterator().next();
        byte[] blob = storage.retrieve(key).block();
        blob[FileEncryptor.NONCE_SIZE_BYTES + 3] ^= 0x10;
        storage.store(key, blob).block();

        StepVerifier.create(attachmentService.download(response.id()))
                .expectError(IntegrityException.class)
                .verify();
    }

    @Test
    void checksumDriftFailsDownload() {
        AttachmentResponse response = simpleUpload("photo.jpg", jpeg(512));
        AttachmentEntity row = attachmentRepository.findById(response.id()).block();
        row.setChecksumSha256("0".repeat(64));
        attachmentRepository.save(row).block();

        StepVerifier.create(attachmentService.download(response.id()))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(IntegrityException.class)
                        .hasMessage("File integrity check failed"))
                .verify();
    }

    @Test
    void missingStorageObjectIsNotFound() {
        AttachmentResponse response = simpleUpload("photo.jpg", jpeg(512));
        storage.delete(storage.keys().iterator().next()).block();

        StepVerifier.create(attachmentService.download(response.id()))
                .expectErrorSatisfies(e -> assertThat(e)
                        .extracting("errorCode").isEqualTo(ErrorCode.STORAGE_OBJECT_NOT_FOUND))
                .verify();
    }

    // ── linkage & delete ────────────────────────────

    @Test
    void attachmentBindsToExactlyOneComment() {
        AttachmentResponse response = simpleUpload("photo.jpg", jpeg(256));

        AttachmentResponse linked = attachmentService.linkToComment(response.id(), 10L, OWNER).block();
        assertThat(linked.commentId()).isEqualTo(10L);

        StepVerifier.create(attachmentService.linkToComment(response.id(), 11L, OWNER))
                .expectErrorSatisfies(e -> assertThat(e).extracting("errorCode").isEqualTo(ErrorCode.ALREADY_LINKED))
                .verify();
        assertThat(attachmentRepository.findById(response.id()).block().getCommentId()).isEqualTo(10L);
    }

    @Test
    void strangerCannotLinkAndUnfinishedUploadCannotBeLinked() {
        AttachmentResponse ready = simpleUpload("photo.jpg", jpeg(256));
        ChunkedUploadInitResponse unfinished = init("car.jpg", "image/jpeg", 20, 2);

        StepVerifier.create(attachmentService.linkToComment(ready.id(), 10L, STRANGER))
                .expectError(AttachmentNotFoundException.class)
                .verify();
        StepVerifier.create(attachmentService.linkToComment(unfinished.uploadId(), 10L, OWNER))
                .expectErrorSatisfies(e -> assertThat(e).extracting("errorCode").isEqualTo(ErrorCode.INVALID_STATE))
                .verify();
    }

    @Test
    void linkAllSkipsIneligibleIds() {
        AttachmentResponse first = simpleUpload("one.jpg", jpeg(128));
        AttachmentResponse second = simpleUpload("two.jpg", jpeg(128));
        ChunkedUploadInitResponse unfinished = init("car.jpg", "image/jpeg", 20, 2);

        List<AttachmentResponse> linked = attachmentService.linkAll(42L, OWNER,
                List.of(first.id(), unfinished.uploadId(), UUID.randomUUID(), second.id(), first.id()))
                .collectList().block();

        assertThat(linked).extracting(AttachmentResponse::id).containsExactly(first.id(), second.id());
        assertThat(linked).extracting(AttachmentResponse::commentId).containsOnly(42L);
    }

    @Test
    void linkedAttachmentCannotBeDeleted() {
        AttachmentResponse response = simpleUpload("photo.jpg", jpeg(256));
        attachmentService.linkToComment(response.id(), 10L, OWNER).block();

        StepVerifier.create(attachmentService.delete(response.id(), OWNER))
                .expectErrorSatisfies(e -> assertThat(e).extracting("errorCode").isEqualTo(ErrorCode.ATTACHMENT_LINKED))
                .verify();
        assertThat(storage.keys()).hasSize(1);
    }

    @Test
    void uploaderDeletesUnlinkedAttachmentWithItsChunks() {
        ChunkedUploadInitResponse init = init("car.jpg", "image/jpeg", 20, 2);
        upload(init.uploadId(), 0, new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF});

        StepVerifier.create(attachmentService.delete(init.uploadId(), STRANGER))
                .expectError(AttachmentNotFoundException.class)
                .verify();
        StepVerifier.create(attachmentService.delete(init.uploadId(), OWNER))
                .verifyComplete();

        assertThat(attachmentRepository.findById(init.uploadId()).block()).isNull();
        assertThat(storage.keys()).isEmpty();
    }

    // ── helpers ─────────────────────────────────────

    private ChunkedUploadInitResponse init(String filename, String contentType, long totalSize, int totalChunks) {
        return attachmentService.initChunkedUpload(request(filename, contentType, totalSize, totalChunks), OWNER).block();
    }

    private static ChunkedUploadInitRequest request(String filename, String contentType, long totalSize, int totalChunks) {
        return ChunkedUploadInitRequest.builder()
                .filename(filename)
                .contentType(contentType)
                .totalSize(totalSize)
                .totalChunks(totalChunks)
                .build();
    }

    private void upload(UUID uploadId, int index, byte[] data) {
        attachmentService.uploadChunk(uploadId, index, content(data), OWNER).block();
    }

    private AttachmentResponse simpleUpload(String filename, byte[] data) {
        return attachmentService.simpleUpload(filename, "image/jpeg", content(data), OWNER, null).block();
    }

    private ReassemblyResult completeAndAwait(UUID uploadId) throws Exception {
        CompletableFuture<ReassemblyResult> result = reassemblyQueue.results()
                .filter(r -> r.attachmentId().equals(uploadId))
                .next()
                .toFuture();

        attachmentService.completeChunkedUpload(uploadId, OWNER).block();

        return result.get(10, TimeUnit.SECONDS);
    }

    private AttachmentStatus status(UUID id) {
        return attachmentRepository.findById(id).block().getStatus();
    }

    private static Flux<DataBuffer> content(byte[] data) {
        return Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(data.clone()));
    }

    private static byte[] slice(byte[] data, int index) {
        return Arrays.copyOfRange(data, index * CHUNK_SIZE, Math.min(data.length, (index + 1) * CHUNK_SIZE));
    }

    private static byte[] jpeg(int size) {
        byte[] data = new byte[size];
        new Random(size).nextBytes(data);
        data[0] = (byte) 0xFF;
        data[1] = (byte) 0xD8;
        data[2] = (byte) 0xFF;
        return data;
    }
}
