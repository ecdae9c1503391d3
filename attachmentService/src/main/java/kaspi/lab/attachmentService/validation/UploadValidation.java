package kaspi.lab.attachmentService.validation;

import kaspi.lab.attachmentService.exception.ErrorCode;

/**
 * Outcome of the full upload pipeline. {@code errorCode} is null and {@code sanitizedFilename}
 * is set only when {@code ok}.
 */
public record UploadValidation(boolean ok, ErrorCode errorCode, String error, String sanitizedFilename) {

    static UploadValidation accepted(String sanitizedFilename) {
        return new UploadValidation(true, null, "", sanitizedFilename);
    }

    static UploadValidation rejected(ErrorCode errorCode, String error) {
        return new UploadValidation(false, errorCode, error, "");
    }
}
