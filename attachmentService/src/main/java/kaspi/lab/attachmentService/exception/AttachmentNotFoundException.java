package kaspi.lab.attachmentService.exception;

import java.util.UUID;

public class AttachmentNotFoundException extends AttachmentException {

    public AttachmentNotFoundException(UUID id) {
        super(ErrorCode.ATTACHMENT_NOT_FOUND, "Attachment not found: " + id);
    }

    public AttachmentNotFoundException(String message) {
        super(ErrorCode.ATTACHMENT_NOT_FOUND, message);
    }
}
