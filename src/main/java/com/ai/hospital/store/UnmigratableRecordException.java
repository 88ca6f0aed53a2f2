package com.ai.hospital.store;

public class UnmigratableRecordException extends RuntimeException {

    public UnmigratableRecordException(String appointmentId, String problem) {
        super("Stored appointment " + appointmentId + " cannot be loaded: " + problem);
    }
}
