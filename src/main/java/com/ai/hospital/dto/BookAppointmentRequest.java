package com.ai.hospital.dto;

/**
 * HTTP body for a booking. The user id comes from the authenticated caller, not the body.
 */
public record BookAppointmentRequest(
        String patientName,
        Integer patientAge,
        String patientGender,
        String department,
        String doctor,
        String date,
        String time
) {
}
