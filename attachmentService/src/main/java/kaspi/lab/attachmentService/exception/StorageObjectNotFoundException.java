package kaspi.lab.attachmentService.exception;

public class StorageObjectNotFoundException extends AttachmentException {

    public StorageObjectNotFoundException(String key) {
        super(ErrorCode.STORAGE_OBJECT_NOT_FOUND, "Storage object not found: " + key);
    }
}
