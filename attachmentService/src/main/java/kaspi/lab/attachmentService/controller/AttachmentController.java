package kaspi.lab.attachmentService.controller;

import jakarta.validation.Valid;
import kaspi.lab.attachmentService.dto.request.ChunkedUploadInitRequest;
import kaspi.lab.attachmentService.dto.request.LinkAttachmentRequest;
import kaspi.lab.attachmentService.dto.response.AttachmentResponse;
import kaspi.lab.attachmentService.dto.response.ChunkUploadResponse;
import kaspi.lab.attachmentService.dto.response.ChunkedUploadCompleteResponse;
import kaspi.lab.attachmentService.dto.response.ChunkedUploadInitResponse;
import kaspi.lab.attachmentService.service.AttachmentService;
import kaspi.lab.attachmentService.service.DownloadedAttachment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/attachments")
@RequiredArgsConstructor
public class AttachmentController {

    public static final String USER_HEADER = "X-User-Id";
    public static final String IDEMPOTENCY_HEADER = "X-Idempotency-Key";

    private static final int DOWNLOAD_BUFFER_SIZE = 64 * 1024;

    private final AttachmentService attachmentService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<AttachmentResponse> upload(
            @RequestPart("file") Mono<FilePart> filePartMono,
            @RequestHeader(USER_HEADER) Long userId,
            @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey
    ) {
        return filePartMono
                .flatMap(filePart -> {
                    log.info("Received upload request for file: {} from user {}", filePart.filename(), userId);

                    return attachmentService.simpleUpload(filePart.filename(), contentTypeOf(filePart),
                            filePart.content(), userId, idempotencyKey);
                });
    }

    @PostMapping(value = "/upload/init", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ChunkedUploadInitResponse> initChunkedUpload(
            @Valid @RequestBody ChunkedUploadInitRequest request,
            @RequestHeader(USER_HEADER) Long userId
    ) {
        return attachmentService.initChunkedUpload(request, userId);
    }

    @PatchMapping(value = "/upload/{uploadId}/chunk/{chunkIndex}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ChunkUploadResponse> uploadChunk(
            @PathVariable UUID uploadId,
            @PathVariable int chunkIndex,
            @RequestPart("file") Mono<FilePart> filePartMono,
            @RequestHeader(USER_HEADER) Long userId
    ) {
        return filePartMono
                .flatMap(filePart -> attachmentService.uploadChunk(uploadId, chunkIndex, filePart.content(), userId));
    }

    @PostMapping("/upload/{uploadId}/complete")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<ChunkedUploadCompleteResponse> completeChunkedUpload(
            @PathVariable UUID uploadId,
            @RequestHeader(USER_HEADER) Long userId
    ) {
        return attachmentService.completeChunkedUpload(uploadId, userId);
    }

    @GetMapping("/{attachmentId}/download")
    public Mono<ResponseEntity<Flux<DataBuffer>>> download(
            @PathVariable UUID attachmentId,
            @RequestHeader(USER_HEADER) Long userId
    ) {
        log.debug("User {} downloads attachment {}", userId, attachmentId);
        return attachmentService.download(attachmentId)
                .map(file -> ResponseEntity.ok()
                        .contentType(MediaType.parseMediaType(file.contentType()))
                        .contentLength(file.size())
                        .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                .filename(file.filename(), StandardCharsets.UTF_8)
                                .build()
                                .toString())
                        .header("X-Content-Type-Options", "nosniff")
                        .body(toBuffers(file)));
    }

    @GetMapping("/{attachmentId}")
    public Mono<AttachmentResponse> getInfo(
            @PathVariable UUID attachmentId,
            @RequestHeader(USER_HEADER) Long userId
    ) {
        return attachmentService.getInfo(attachmentId);
    }

    @DeleteMapping("/{attachmentId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(
            @PathVariable UUID attachmentId,
            @RequestHeader(USER_HEADER) Long userId
    ) {
        return attachmentService.delete(attachmentId, userId);
    }

    @PostMapping(value = "/{attachmentId}/link", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AttachmentResponse> linkToComment(
            @PathVariable UUID attachmentId,
            @Valid @RequestBody LinkAttachmentRequest request,
            @RequestHeader(USER_HEADER) Long userId
    ) {
        return attachmentService.linkToComment(attachmentId, request.commentId(), userId);
    }

    private static String contentTypeOf(FilePart filePart) {
        MediaType contentType = filePart.headers().getContentType();
        return contentType != null ? contentType.toString() : MediaType.APPLICATION_OCTET_STREAM_VALUE;
    }

    private static Flux<DataBuffer> toBuffers(DownloadedAttachment file) {
        byte[] data = file.data();
        int parts = Math.max(1, (data.length + DOWNLOAD_BUFFER_SIZE - 1) / DOWNLOAD_BUFFER_SIZE);
        return Flux.range(0, parts)
                .map(i -> DefaultDataBufferFactory.sharedInstance.wrap(Arrays.copyOfRange(data,
                        i * DOWNLOAD_BUFFER_SIZE, Math.min(data.length, (i + 1) * DOWNLOAD_BUFFER_SIZE))));
    }
}
