package com.example.baldnessdetector.exception;

import com.example.baldnessdetector.dto.response.ErrorResponse;
import com.example.baldnessdetector.dto.response.ErrorResponse.ErrorDetail;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String UPLOAD_PATH_PREFIX = "/api/v1/detect-baldness";

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiException(ApiException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Request failed: {}", ex.getMessage(), ex);
        } else {
            log.debug("Request rejected [{}]: {}", ex.getType(), ex.getMessage());
        }
        return build(ex.getStatus(), ex.getType(), ex.getMessage(), List.of());
    }

    /**
     * Covers both {@code @Valid @RequestBody} failures and bound form parameters.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(BindException ex) {
        List<ErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::toDetail)
                .toList();
        return validationError("Request validation failed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return validationError("Request body is missing or malformed",
                List.of(new ErrorDetail("body", "Request body could not be parsed")));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex) {
        return validationError("Request validation failed",
                List.of(new ErrorDetail(ex.getRequestPartName(), "Field required")));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return validationError("Request validation failed",
                List.of(new ErrorDetail(ex.getParameterName(), "Field required")));
    }

    /**
     * An upload route hit without a multipart body has no {@code photo} part to read.
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex,
                                                                    HttpServletRequest request) {
        if (request.getRequestURI().startsWith(UPLOAD_PATH_PREFIX)) {
            return validationError("Request validation failed",
                    List.of(new ErrorDetail("photo", "Field required")));
        }
        return build(ex.getStatusCode(), "http_error", ex.getBody().getDetail(), List.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        // Spring MVC exceptions that already know their status (unknown route, 405, 413 ...)
        if (ex instanceof org.springframework.web.ErrorResponse springError) {
            HttpStatusCode status = springError.getStatusCode();
            String detail = springError.getBody().getDetail();
            return build(status, "http_error", detail != null ? detail : ex.getMessage(), List.of());
        }
        log.error("Unhandled exception", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error", List.of());
    }

    private static ErrorDetail toDetail(FieldError error) {
        return new ErrorDetail(error.getField(), error.getDefaultMessage());
    }

    private static ResponseEntity<ErrorResponse> validationError(String message, List<ErrorDetail> details) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error", message, details);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatusCode status, String type, String message,
                                                       List<ErrorDetail> details) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status, type, message, details));
    }
}
