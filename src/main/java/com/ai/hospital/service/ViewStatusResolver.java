package com.ai.hospital.service;

import com.ai.hospital.domain.AppointmentRecord;
import com.ai.hospital.domain.AppointmentStatus;

import java.time.LocalDateTime;

/**
 * The single place where the read-time {@code expired} status is derived.
 */
public final class ViewStatusResolver {

    private ViewStatusResolver() {
    }

    public static AppointmentStatus resolveViewStatus(AppointmentRecord record, LocalDateTime now) {
        if (record.isConfirmed() && record.startsAt().isBefore(now)) {
            return AppointmentStatus.EXPIRED;
        }
        return record.getStatus();
    }
}
