package com.ai.hospital.store;

public class StaleSnapshotException extends RuntimeException {

    public StaleSnapshotException(String expectedVersion, String actualVersion) {
        super("Store moved from version " + expectedVersion + " to " + actualVersion + " since the snapshot was read");
    }

    public StaleSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
