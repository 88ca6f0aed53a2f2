package com.ai.hospital.store;

import com.ai.hospital.domain.AppointmentSnapshot;

/**
 * Durable home of the appointment map and id counter.
 */
public interface AppointmentStore {

    /**
     * Reads the current durable state. An unreadable medium yields an empty, degraded
     * snapshot instead of an exception.
     *
     * @throws UnmigratableRecordException when a stored record is well-formed but cannot be
     *                                     turned into an appointment
     */
    AppointmentSnapshot reload();

    /**
     * Persists every record and the counter of the snapshot as one unit.
     *
     * @throws StaleSnapshotException when another writer committed after the snapshot was read
     * @throws StoreWriteException    when the medium cannot be written; nothing is changed
     */
    void commit(AppointmentSnapshot snapshot);
}
