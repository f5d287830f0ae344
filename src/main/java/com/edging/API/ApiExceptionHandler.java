package com.edging.API;

import com.edging.exception.EdgeDetectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Translates pipeline precondition failures into 400 responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EdgeDetectionException.class)
    public ResponseEntity<Map<String, String>> handlePipelineError(EdgeDetectionException e) {
        logger.warn("Rejected request: {} ({})", e.getMessage(), e.getKind());
        return ResponseEntity.badRequest().body(error(e.getKind().name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadArgument(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error("BAD_REQUEST", e.getMessage()));
    }

    private static Map<String, String> error(String kind, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", kind);
        error.put("message", message);
        return error;
    }
}
