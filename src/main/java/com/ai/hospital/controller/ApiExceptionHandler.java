package com.ai.hospital.controller;

import com.ai.hospital.store.UnmigratableRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Listings have no outcome type of their own; a stored record that cannot be loaded turns
 * into a generic 500 and an operator-facing log entry.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnmigratableRecordException.class)
    public ResponseEntity<Map<String, Object>> handleUnmigratable(UnmigratableRecordException e) {
        log.error("Appointment data needs operator attention: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("success", false, "detail", "Internal error"));
    }
}
