package kaspi.lab.attachmentService.exception;

/** Rejected content: type, size, magic bytes or malformed payload. Never retried. */
public class ValidationException extends AttachmentException {

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
