package kaspi.lab.attachmentService.dto.request;

import jakarta.validation.constraints.NotNull;

public record LinkAttachmentRequest(@NotNull(message = "commentId должен быть указан") Long commentId) {}
