package kaspi.lab.attachmentService.exception;

public class InvalidStateException extends AttachmentException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }

    public InvalidStateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
