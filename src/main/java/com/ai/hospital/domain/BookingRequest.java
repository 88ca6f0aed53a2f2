package com.ai.hospital.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Raw booking input as received from a caller. Date and time stay textual
 * ({@code YYYY-MM-DD}, {@code HH:MM}) so malformed values are reported by validation.
 */
@Value
@Builder
public class BookingRequest {
    String userId;
    String patientName;
    Integer patientAge;
    String patientGender;
    String department;
    String doctor;
    String date;
    String time;
}
