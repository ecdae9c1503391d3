package kaspi.lab.attachmentService.exception;

public class StorageException extends AttachmentException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }

    protected StorageException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
