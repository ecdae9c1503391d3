package kaspi.lab.attachmentService.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "Invalid input value"),
    MISSING_USER(HttpStatus.UNAUTHORIZED, "Authenticated user id is missing"),
    DUPLICATE_REQUEST(HttpStatus.CONFLICT, "Duplicate request: idempotency key already used"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),

    // Validation
    CONTENT_TYPE_NOT_ALLOWED(HttpStatus.UNPROCESSABLE_ENTITY, "Content type not allowed"),
    FILE_SIZE_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY, "File size exceeds the limit for its category"),
    MAGIC_BYTES_MISMATCH(HttpStatus.UNPROCESSABLE_ENTITY, "File content does not match claimed content type"),
    FILE_TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE, "File too large for this upload method"),
    EMPTY_CHUNK(HttpStatus.BAD_REQUEST, "Empty chunk"),

    // Lookup
    ATTACHMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "Attachment not found"),
    STORAGE_OBJECT_NOT_FOUND(HttpStatus.NOT_FOUND, "Attachment file not found in storage"),

    // Lifecycle
    INVALID_STATE(HttpStatus.CONFLICT, "Attachment is not in the required state"),
    CHUNK_INDEX_OUT_OF_RANGE(HttpStatus.BAD_REQUEST, "Chunk index out of range"),
    CHUNKS_INCOMPLETE(HttpStatus.CONFLICT, "Not all chunks have been received"),
    CHUNK_UPLOAD_IN_PROGRESS(HttpStatus.CONFLICT, "The same chunk is already being uploaded"),
    ALREADY_LINKED(HttpStatus.CONFLICT, "Attachment is already linked to a comment"),
    ATTACHMENT_LINKED(HttpStatus.CONFLICT, "Cannot delete an attachment linked to a comment. Delete the comment instead."),

    // Integrity
    INTEGRITY_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "File integrity check failed"),

    // Storage
    STORAGE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Storage backend error"),
    PATH_TRAVERSAL(HttpStatus.BAD_REQUEST, "Storage key escapes the storage root");

    private final HttpStatus status;
    private final String message;
}
