package kaspi.lab.attachmentService.dto.response;

import lombok.Builder;

@Builder
public record ChunkedUploadCompleteResponse(
        AttachmentResponse attachment,
        String message
) {}
