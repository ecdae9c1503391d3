package kaspi.lab.attachmentService.dto.event;

import lombok.Builder;

import java.util.UUID;

@Builder
public record AttachmentQuarantinedEvent(
        UUID attachmentId,
        Long uploaderId,
        String filename,
        String reason
) {}
