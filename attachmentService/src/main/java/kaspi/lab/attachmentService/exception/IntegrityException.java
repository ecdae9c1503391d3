package kaspi.lab.attachmentService.exception;

/**
 * Authentication tag failure, chunk ordering mismatch or checksum drift. Always fatal for the
 * operation in progress.
 */
public class IntegrityException extends AttachmentException {

    public IntegrityException(String message) {
        super(ErrorCode.INTEGRITY_FAILURE, message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(ErrorCode.INTEGRITY_FAILURE, message, cause);
    }
}
