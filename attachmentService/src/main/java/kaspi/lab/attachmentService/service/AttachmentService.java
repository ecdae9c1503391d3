package kaspi.lab.attachmentService.service;

import kaspi.lab.attachmentService.dto.request.ChunkedUploadInitRequest;
import kaspi.lab.attachmentService.dto.response.AttachmentResponse;
import kaspi.lab.attachmentService.dto.response.ChunkUploadResponse;
import kaspi.lab.attachmentService.dto.response.ChunkedUploadCompleteResponse;
import kaspi.lab.attachmentService.dto.response.ChunkedUploadInitResponse;
import org.springframework.core.io.buffer.DataBuffer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.UUID;

public interface AttachmentService {

    /** Single-request upload of a small file; the attachment is READY when this completes. */
    Mono<AttachmentResponse> simpleUpload(String filename, String contentType, Flux<DataBuffer> content,
                                          Long uploaderId, String idempotencyKey);

    Mono<ChunkedUploadInitResponse> initChunkedUpload(ChunkedUploadInitRequest request, Long uploaderId);

    Mono<ChunkUploadResponse> uploadChunk(UUID uploadId, int chunkIndex, Flux<DataBuffer> content, Long uploaderId);

    /** Moves the upload to PROCESSING and queues reassembly; does not wait for it. */
    Mono<ChunkedUploadCompleteResponse> completeChunkedUpload(UUID uploadId, Long uploaderId);

    Mono<DownloadedAttachment> download(UUID attachmentId);

    Mono<AttachmentResponse> getInfo(UUID attachmentId);

    Mono<Void> delete(UUID attachmentId, Long uploaderId);

    Mono<AttachmentResponse> linkToComment(UUID attachmentId, Long commentId, Long uploaderId);

    /** Links every eligible attachment to the comment; ineligible ids are skipped. */
    Flux<AttachmentResponse> linkAll(Long commentId, Long uploaderId, Collection<UUID> attachmentIds);
}
