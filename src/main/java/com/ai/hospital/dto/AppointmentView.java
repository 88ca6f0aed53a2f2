package com.ai.hospital.dto;

import com.ai.hospital.domain.AppointmentRecord;
import com.ai.hospital.domain.AppointmentStatus;

import java.time.format.DateTimeFormatter;

/**
 * Appointment as handed to callers: textual date/time and a resolved status,
 * which may be the view-only {@code expired}.
 */
public record AppointmentView(
        String id,
        String userId,
        String patientName,
        int patientAge,
        String patientGender,
        String department,
        String doctor,
        String date,
        String time,
        AppointmentStatus status,
        String createdAt
) {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    public static AppointmentView of(AppointmentRecord record, AppointmentStatus viewStatus) {
        return new AppointmentView(
                record.getId(),
                record.getUserId(),
                record.getPatientName(),
                record.getPatientAge(),
                record.getPatientGender(),
                record.getDepartment(),
                record.getDoctor(),
                record.getDate().toString(),
                record.getTime().format(TIME),
                viewStatus,
                record.getCreatedAt() == null ? null : record.getCreatedAt().toString()
        );
    }
}
