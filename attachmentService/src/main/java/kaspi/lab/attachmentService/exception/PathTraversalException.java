package kaspi.lab.attachmentService.exception;

public class PathTraversalException extends StorageException {

    public PathTraversalException(String key) {
        super(ErrorCode.PATH_TRAVERSAL, "Path traversal detected: " + key);
    }
}
