package com.ai.hospital.config;

import com.ai.hospital.domain.AppointmentSnapshot;
import com.ai.hospital.service.ScheduleCatalog;
import com.ai.hospital.store.AppointmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Reads the store once at startup so a broken medium shows up in the log before the first
 * request does.
 */
@Component
public class StartupReport {

    private static final Logger log = LoggerFactory.getLogger(StartupReport.class);

    private final ScheduleCatalog catalog;
    private final AppointmentStore store;
    private final SchedulingProperties properties;

    public StartupReport(ScheduleCatalog catalog, AppointmentStore store, SchedulingProperties properties) {
        this.catalog = catalog;
        this.store = store;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void report() {
        AppointmentSnapshot snapshot = store.reload();
        if (snapshot.isDegraded()) {
            log.warn("Appointment store ({}) is degraded; serving with an empty snapshot", properties.getStore().getType());
        }
        log.info("Scheduler ready: store={}, departments={}, appointments={}, counter={}",
                properties.getStore().getType(),
                catalog.departments().size(),
                snapshot.records().size(),
                snapshot.getCounter());
    }
}
