package kaspi.lab.attachmentService.dto.response;

import lombok.Builder;

import java.util.UUID;

@Builder
public record ChunkedUploadInitResponse(
        UUID uploadId,
        String uploadSession,
        int totalChunks
) {}
