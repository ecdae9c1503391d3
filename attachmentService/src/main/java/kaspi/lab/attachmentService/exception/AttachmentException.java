package kaspi.lab.attachmentService.exception;

import lombok.Getter;

/**
 * Base of the attachment error taxonomy. Carries an {@link ErrorCode} so the REST layer can map
 * any subtype to a status and a stable code without branching on types.
 */
@Getter
public class AttachmentException extends RuntimeException {

    private final ErrorCode errorCode;

    public AttachmentException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage(), null);
    }

    public AttachmentException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public AttachmentException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
