package kaspi.lab.attachmentService.dto.response;

import lombok.Builder;

@Builder
public record ChunkUploadResponse(
        String status,
        int chunkIndex,
        int receivedChunks,
        int totalChunks
) {}
