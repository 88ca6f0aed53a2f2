package com.ai.hospital.dto;

public record BookingResult(boolean success, String message, ErrorType errorType, AppointmentView appointment) {

    public static BookingResult success(AppointmentView appointment, String message) {
        return new BookingResult(true, message, null, appointment);
    }

    public static BookingResult rejected(ErrorType errorType, String message) {
        return new BookingResult(false, message, errorType, null);
    }

    public static BookingResult internalError() {
        return new BookingResult(false, "Booking failed due to an internal error. Please try again.", ErrorType.INTERNAL, null);
    }
}
