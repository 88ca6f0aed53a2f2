package com.ai.hospital.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum AppointmentStatus {

    CONFIRMED("confirmed"),
    CANCELLED("cancelled"),
    CANCELLED_BY_DOCTOR("cancelled_by_doctor"),
    /** View-only: never written to the store. */
    EXPIRED("expired");

    private final String wireValue;

    AppointmentStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isPersistable() {
        return this != EXPIRED;
    }

    public static Optional<AppointmentStatus> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equals(value.trim()))
                .findFirst();
    }

    @JsonCreator
    public static AppointmentStatus parse(String value) {
        return fromWire(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown appointment status: " + value));
    }
}
