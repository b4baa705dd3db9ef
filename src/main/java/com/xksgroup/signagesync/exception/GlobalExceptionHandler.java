package com.xksgroup.signagesync.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestNotUsableException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred",
            ex.getMessage()
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Object> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Invalid argument provided: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "Invalid request parameter",
            ex.getMessage()
        );
    }

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<Object> handleTransportException(TransportException ex) {
        log.warn("Content API unreachable: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_GATEWAY,
            "Content API request failed",
            ex.getMessage()
        );
    }

    @ExceptionHandler(ManifestFormatException.class)
    public ResponseEntity<Object> handleManifestFormatException(ManifestFormatException ex) {
        log.warn("Malformed content document: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_GATEWAY,
            "Content API returned an unreadable document",
            ex.getMessage()
        );
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Object> handleNoResourceFoundException(NoResourceFoundException ex) {
        log.debug("No resource: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.NOT_FOUND,
            "Resource not found",
            ex.getMessage()
        );
    }

    @ExceptionHandler(AsyncRequestNotUsableException.class)
    public ResponseEntity<Map<String, Object>> handleSseDisconnect(Exception ex) {
        Map<String, Object> body = Map.of(
            "timestamp", LocalDateTime.now().toString(),
            "status", 499, // client closed request
            "error", "Client Closed Request",
            "message", "SSE client disconnected or connection was lost",
            "exception", ex.getClass().getSimpleName()
        );

        log.info("SSE client disconnected: {}", ex.getMessage());

        return ResponseEntity
                .status(499)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }

    private ResponseEntity<Object> buildErrorResponse(HttpStatus status, String message, String details) {
        Map<String, Object> errorResponse = Map.of(
            "timestamp", LocalDateTime.now(),
            "status", status.value(),
            "error", status.getReasonPhrase(),
            "message", message,
            "details", details != null ? details : "No additional details available"
        );
        return new ResponseEntity<>(errorResponse, status);
    }
}
