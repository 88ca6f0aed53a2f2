package com.ai.hospital.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A persisted appointment. The status is always one of the persistable values.
 */
@Value
@Builder(toBuilder = true)
public class AppointmentRecord {

    String id;
    String userId;
    String patientName;
    int patientAge;
    String patientGender;
    String department;
    String doctor;
    LocalDate date;
    LocalTime time;
    @With
    AppointmentStatus status;
    LocalDateTime createdAt;

    public boolean isConfirmed() {
        return status == AppointmentStatus.CONFIRMED;
    }

    public LocalDateTime startsAt() {
        return LocalDateTime.of(date, time);
    }

    public boolean isAt(LocalDate otherDate, LocalTime otherTime) {
        return date.equals(otherDate) && time.equals(otherTime);
    }
}
