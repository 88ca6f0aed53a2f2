package com.ai.hospital.domain;

import java.util.Arrays;
import java.util.Optional;

public enum Gender {

    MALE("Male"),
    FEMALE("Female"),
    OTHER("Other");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Exact, case-sensitive match on the label ("Male", "Female", "Other").
     */
    public static Optional<Gender> fromLabel(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(g -> g.label.equals(value))
                .findFirst();
    }
}
