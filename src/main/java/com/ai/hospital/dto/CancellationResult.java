package com.ai.hospital.dto;

/**
 * Outcome of a cancellation. {@code patientUserId} is only set for a successful
 * doctor-initiated cancellation, so the caller can notify the patient.
 */
public record CancellationResult(boolean success, String message, ErrorType errorType, String patientUserId) {

    public static CancellationResult success(String message) {
        return new CancellationResult(true, message, null, null);
    }

    public static CancellationResult successNotifying(String message, String patientUserId) {
        return new CancellationResult(true, message, null, patientUserId);
    }

    public static CancellationResult notFound() {
        return new CancellationResult(false, "Appointment not found", ErrorType.NOT_FOUND, null);
    }

    public static CancellationResult unauthorized(String message) {
        return new CancellationResult(false, message, ErrorType.UNAUTHORIZED, null);
    }

    public static CancellationResult invalidState(String message) {
        return new CancellationResult(false, message, ErrorType.STATE, null);
    }

    public static CancellationResult internalError() {
        return new CancellationResult(false, "Cancellation failed due to an internal error. Please try again.", ErrorType.INTERNAL, null);
    }
}
