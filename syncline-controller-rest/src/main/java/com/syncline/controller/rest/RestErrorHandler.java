package com.syncline.controller.rest;

import com.syncline.service.core.error.CursorInvalidException;
import com.syncline.service.core.error.CursorTooOldException;
import com.syncline.service.core.error.SyncForbiddenException;
import com.syncline.service.core.error.SyncProtocolException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.OffsetDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps sync failures to consistent JSON payloads. Rejected acks come back as a problem detail listing them. */
@RestControllerAdvice
public class RestErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(RestErrorHandler.class);

    @ExceptionHandler(SyncProtocolException.class)
    public ResponseEntity<ProblemDetail> handleProtocol(SyncProtocolException ex, HttpServletRequest request) {
        log.warn("Rejected sync request on {}: {}", request.getRequestURI(), ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Invalid sync request");
        problem.setProperty("timestamp", OffsetDateTime.now());
        problem.setProperty("path", request.getRequestURI());
        if (!ex.rejected().isEmpty()) {
            problem.setProperty("rejected", ex.rejected());
        }
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler({CursorInvalidException.class, CursorTooOldException.class})
    public ResponseEntity<ErrorPayload> handleCursor(RuntimeException ex, HttpServletRequest request) {
        log.warn("Cursor problem on {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.CONFLICT, "cursor_invalid", ex.getMessage(), request);
    }

    @ExceptionHandler(SyncForbiddenException.class)
    public ResponseEntity<ErrorPayload> handleForbidden(SyncForbiddenException ex, HttpServletRequest request) {
        return build(HttpStatus.FORBIDDEN, "session_required", ex.getMessage(), request);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorPayload> handleUnauthenticated(
            MissingRequestHeaderException ex, HttpServletRequest request) {
        return build(HttpStatus.UNAUTHORIZED, "unauthenticated", "Authentication required", request);
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorPayload> handleBadRequest(Exception ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorPayload> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "validation_failed", "Validation failed", request);
    }

    @ExceptionHandler(TransientDataAccessException.class)
    public ResponseEntity<ErrorPayload> handleUnavailable(TransientDataAccessException ex, HttpServletRequest request) {
        log.warn("Storage unavailable on {}", request.getRequestURI(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "storage_unavailable", "Storage temporarily unavailable", request);
    }

    private static ResponseEntity<ErrorPayload> build(
            HttpStatus status, String code, String message, HttpServletRequest request) {
        return ResponseEntity.status(status).body(ErrorPayload.of(status, code, message, request.getRequestURI()));
    }
}
