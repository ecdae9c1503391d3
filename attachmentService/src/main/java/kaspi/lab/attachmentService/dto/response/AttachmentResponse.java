package kaspi.lab.attachmentService.dto.response;

import lombok.Builder;

import java.time.Instant;
import java.util.UUID;

@Builder
public record AttachmentResponse(
        UUID id,
        Long commentId,
        Long uploaderId,
        String filename,
        String contentType,
        Long fileSize,
        String status,
        String checksumSha256,
        Instant createdAt
) {}
