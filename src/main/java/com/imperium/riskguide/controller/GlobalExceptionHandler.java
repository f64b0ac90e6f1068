package com.imperium.riskguide.controller;

import com.imperium.riskguide.common.exception.ResourceNotFoundException;
import com.imperium.riskguide.common.exception.TurnFailedException;
import com.imperium.riskguide.common.exception.TurnTimeoutException;
import com.imperium.riskguide.config.RequestIdSupport;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理，统一返回 {"error": {code, message, requestId, details?}}。
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        FieldError first = ex.getBindingResult().getFieldErrors().stream().findFirst().orElse(null);
        String message = first != null && first.getDefaultMessage() != null ? first.getDefaultMessage() : "Validation failed";
        Map<String, Object> details = first != null ? Map.of("field", first.getField()) : null;
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", message, details);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraint(ConstraintViolationException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", ex.getMessage(), null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", "Malformed request body", null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), null);
    }

    @ExceptionHandler(TurnTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(TurnTimeoutException ex) {
        return error(HttpStatus.GATEWAY_TIMEOUT, "timeout", ex.getMessage(),
                Map.of("session_id", ex.getSessionId()));
    }

    @ExceptionHandler(TurnFailedException.class)
    public ResponseEntity<Map<String, Object>> handleTurnFailed(TurnFailedException ex) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "turn_failed", ex.getMessage(),
                Map.of("session_id", ex.getSessionId()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal server error", null);
    }

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message,
                                                     Map<String, Object> details) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message);
        err.put("requestId", RequestIdSupport.current());
        if (details != null) {
            err.put("details", details);
        }
        return ResponseEntity.status(status).body(Map.of("error", err));
    }
}
