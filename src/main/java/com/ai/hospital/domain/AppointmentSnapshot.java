package com.ai.hospital.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory copy of the appointment map and id counter, the unit of reload and commit.
 * <p>
 * A snapshot remembers the store version it was read at; the store refuses to commit it
 * once another writer has moved the version on.
 */
public class AppointmentSnapshot {

    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final Map<String, AppointmentRecord> appointments;
    private final Set<String> changedIds = new LinkedHashSet<>();
    private final String baseVersion;
    private final boolean degraded;
    private long counter;
    private LocalDateTime lastUpdated;

    public AppointmentSnapshot(Map<String, AppointmentRecord> appointments,
                               long counter,
                               LocalDateTime lastUpdated,
                               String baseVersion,
                               boolean degraded) {
        this.appointments = new LinkedHashMap<>(appointments);
        this.counter = counter;
        this.lastUpdated = lastUpdated;
        this.baseVersion = baseVersion;
        this.degraded = degraded;
    }

    public static AppointmentSnapshot empty(String baseVersion) {
        return new AppointmentSnapshot(Map.of(), 0, null, baseVersion, false);
    }

    public static AppointmentSnapshot degraded(String baseVersion) {
        return new AppointmentSnapshot(Map.of(), 0, null, baseVersion, true);
    }

    /**
     * Increments the counter and formats {@code APT-yyyyMMdd-NNNN}. Skips any sequence whose id
     * is already taken so a counter behind the records can never produce a duplicate.
     */
    public String nextId(LocalDate today) {
        String id;
        do {
            counter++;
            id = String.format("APT-%s-%04d", today.format(ID_DATE), counter);
        } while (appointments.containsKey(id));
        return id;
    }

    public void put(AppointmentRecord record) {
        if (!record.getStatus().isPersistable())
            throw new IllegalArgumentException("Status " + record.getStatus() + " is view-only");
        appointments.put(record.getId(), record);
        changedIds.add(record.getId());
    }

    public Optional<AppointmentRecord> find(String id) {
        return Optional.ofNullable(appointments.get(id));
    }

    public Collection<AppointmentRecord> records() {
        return Collections.unmodifiableCollection(appointments.values());
    }

    public Map<String, AppointmentRecord> asMap() {
        return Collections.unmodifiableMap(appointments);
    }

    public Set<String> changedIds() {
        return Collections.unmodifiableSet(changedIds);
    }

    public long getCounter() {
        return counter;
    }

    public LocalDateTime getLastUpdated() {
        return lastUpdated;
    }

    public void markCommitted(LocalDateTime at) {
        this.lastUpdated = at;
        changedIds.clear();
    }

    public String getBaseVersion() {
        return baseVersion;
    }

    public boolean isDegraded() {
        return degraded;
    }
}
