package org.chatrooms.controller;

import lombok.extern.slf4j.Slf4j;
import org.chatrooms.exception.ChatException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

/**
 * Consistent error bodies for the REST endpoints: {"error", "message", "timestamp"}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<Map<String, Object>> handleChatException(ChatException ex) {
        HttpStatus status = ex.getCode().status();
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", ex.getMessage(), ex);
        } else {
            log.warn("Request rejected: {} {}", ex.getCode(), ex.getMessage());
        }
        return body(status, ex.getCode().name(), ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.warn("Invalid request body: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "INVALID_PAYLOAD", "Expected a JSON object {\"content\": string}");
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException ex) {
        return body(HttpStatus.FORBIDDEN, "FORBIDDEN", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        // framework errors (unknown route, wrong method...) keep their own status
        if (ex instanceof ErrorResponse er && !er.getStatusCode().is5xxServerError()) {
            HttpStatus status = HttpStatus.valueOf(er.getStatusCode().value());
            return body(status, status.name(), ex.getMessage());
        }
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected server error");
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", message != null ? message : "",
                "timestamp", Instant.now().toString()
        ));
    }
}
