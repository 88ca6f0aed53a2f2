package com.ai.hospital.service;

import com.ai.hospital.dto.ErrorType;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Accept carries the parsed date and time; reject carries the error type and a reason
 * that can be shown to the user as-is.
 */
public record ValidationResult(boolean accepted, ErrorType errorType, String reason, LocalDate date, LocalTime time) {

    public static ValidationResult accept(LocalDate date, LocalTime time) {
        return new ValidationResult(true, null, null, date, time);
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, ErrorType.VALIDATION, reason, null, null);
    }

    public static ValidationResult conflict(String reason) {
        return new ValidationResult(false, ErrorType.CONFLICT, reason, null, null);
    }
}
