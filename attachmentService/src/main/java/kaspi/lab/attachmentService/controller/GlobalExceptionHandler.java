package kaspi.lab.attachmentService.controller;

import kaspi.lab.attachmentService.dto.response.ErrorResponse;
import kaspi.lab.attachmentService.exception.AttachmentException;
import kaspi.lab.attachmentService.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.MissingRequestValueException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AttachmentException.class)
    public ResponseEntity<ErrorResponse> handleAttachmentException(AttachmentException e) {
        ErrorCode code = e.getErrorCode();
        if (code.getStatus().is5xxServerError()) {
            log.error("Attachment operation failed: {}", e.getMessage(), e);
        } else {
            log.warn("Attachment request rejected: {} {}", code, e.getMessage());
        }
        return build(code, e.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBindException(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return build(ErrorCode.INVALID_INPUT_VALUE, message.isEmpty() ? ErrorCode.INVALID_INPUT_VALUE.getMessage() : message);
    }

    @ExceptionHandler(MissingRequestValueException.class)
    public ResponseEntity<ErrorResponse> handleMissingValue(MissingRequestValueException e) {
        if (AttachmentController.USER_HEADER.equals(e.getName())) {
            return build(ErrorCode.MISSING_USER, ErrorCode.MISSING_USER.getMessage());
        }
        return build(ErrorCode.INVALID_INPUT_VALUE, e.getReason());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException e) {
        return build(ErrorCode.INVALID_INPUT_VALUE, e.getReason());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        String code = status != null ? status.name() : String.valueOf(e.getStatusCode().value());
        return ResponseEntity.status(e.getStatusCode()).body(ErrorResponse.builder()
                .code(code)
                .message(e.getReason())
                .timestamp(Instant.now())
                .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return build(ErrorCode.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
    }

    private static ResponseEntity<ErrorResponse> build(ErrorCode code, String message) {
        HttpStatus status = code.getStatus();
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .code(code.name())
                .message(message != null ? message : code.getMessage())
                .timestamp(Instant.now())
                .build());
    }
}
