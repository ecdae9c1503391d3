package kaspi.lab.attachmentService.dto.event;

import lombok.Builder;

import java.util.UUID;

@Builder
public record AttachmentReadyEvent(
        UUID attachmentId,
        Long uploaderId,
        String filename,
        String contentType,
        long fileSize
) {}
