package com.telemetra.controller.rest;

import com.telemetra.controller.rest.tenant.TenantUnresolvedException;
import com.telemetra.service.core.job.IngestionJobNotFoundException;
import com.telemetra.service.core.query.QueryExecutionException;
import com.telemetra.service.core.query.QueryRejectedException;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Global REST exception mapper. Produces consistent JSON payloads for client-visible errors. */
@ControllerAdvice
@Slf4j
public class RestErrorHandler {

    /** Also covers {@code MalformedPayloadException}. */
    @ExceptionHandler({IllegalArgumentException.class, QueryRejectedException.class})
    public ResponseEntity<ErrorPayload> handleBadRequest(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorPayload> handleValidation(MethodArgumentNotValidException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Validation failed", request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorPayload> handleUnreadable(HttpMessageNotReadableException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Request body is not readable", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorPayload> handleTypeMismatch(MethodArgumentTypeMismatchException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid value for '" + ex.getName() + "'", request);
    }

    @ExceptionHandler(TenantUnresolvedException.class)
    public ResponseEntity<ErrorPayload> handleTenant(TenantUnresolvedException ex, WebRequest request) {
        return build(HttpStatus.UNAUTHORIZED, ex.getMessage(), request);
    }

    @ExceptionHandler(IngestionJobNotFoundException.class)
    public ResponseEntity<ErrorPayload> handleNotFound(IngestionJobNotFoundException ex, WebRequest request) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorPayload> handleQueryFailure(QueryExecutionException ex, WebRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorPayload> handleTooLarge(MaxUploadSizeExceededException ex, WebRequest request) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "Upload exceeds the maximum allowed size", request);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorPayload> handleIo(IOException ex, WebRequest request) {
        log.warn("Failed to read upload", ex);
        return build(HttpStatus.BAD_REQUEST, "Could not read the uploaded payload", request);
    }

    private ResponseEntity<ErrorPayload> build(HttpStatus status, String message, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        return ResponseEntity.status(status).body(ErrorPayload.of(status, message, path));
    }
}
