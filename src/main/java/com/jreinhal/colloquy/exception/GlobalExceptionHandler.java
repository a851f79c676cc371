package com.jreinhal.colloquy.exception;

import com.jreinhal.colloquy.dialogs.DialogConfigurationException;
import com.jreinhal.colloquy.dialogs.DialogContextException;
import com.jreinhal.colloquy.dialogs.DialogContextSnapshot;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler({IllegalArgumentException.class, DialogConfigurationException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Rejected turn: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", sanitizeExceptionMessage(ex.getMessage()), "timestamp", Instant.now().toString()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable activity: {}", ex.getMostSpecificCause().getClass().getSimpleName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "Malformed activity", "timestamp", Instant.now().toString()));
    }

    @ExceptionHandler(DialogContextException.class)
    public ResponseEntity<Map<String, Object>> handleDialogContext(DialogContextException ex) {
        DialogContextSnapshot snapshot = ex.getSnapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", sanitizeExceptionMessage(ex.getMessage()));
        if (snapshot != null && snapshot.activeDialog() != null) {
            body.put("activeDialog", snapshot.activeDialog());
        }
        body.put("timestamp", Instant.now().toString());
        if (ex.getCause() != null) {
            // a dialog failed mid-turn; the stack is intact but the turn is lost
            log.error("Dialog failed with context {}", snapshot, ex);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
        }
        log.warn("Dialog stack inconsistency: {} {}", ex.getMessage(), snapshot);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Internal server error", "timestamp", Instant.now().toString()));
    }

    static String sanitizeExceptionMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Invalid request";
        }
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains("at ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 200) {
            return "Invalid request";
        }
        return message;
    }
}
