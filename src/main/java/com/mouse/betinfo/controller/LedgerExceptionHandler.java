package com.mouse.betinfo.controller;

import com.mouse.betinfo.exception.EntityNotFoundException;
import com.mouse.betinfo.exception.ImmutabilityViolationException;
import com.mouse.betinfo.exception.IntegrityException;
import com.mouse.betinfo.exception.InvalidTransitionException;
import com.mouse.betinfo.exception.LedgerException;
import com.mouse.betinfo.exception.ReferentialIntegrityException;
import com.mouse.betinfo.exception.UniquenessViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class LedgerExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(EntityNotFoundException ex) {
        log.warn("Entity not found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler({UniquenessViolationException.class,
            ImmutabilityViolationException.class,
            InvalidTransitionException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(LedgerException ex) {
        log.warn("Ledger conflict: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(ReferentialIntegrityException.class)
    public ResponseEntity<Map<String, Object>> handleReference(ReferentialIntegrityException ex) {
        log.warn("Broken reference: {}", ex.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(IntegrityException.class)
    public ResponseEntity<Map<String, Object>> handleIntegrity(IntegrityException ex) {
        log.error("🚨 Integrity failure: {}", ex.getMessage());
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> handleLedger(LedgerException ex) {
        log.error("Ledger error: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, Exception ex) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", status.value());
        response.put("error", ex.getClass().getSimpleName());
        response.put("message", ex.getMessage());
        response.put("timestamp", Instant.now());
        return ResponseEntity.status(status).body(response);
    }
}
