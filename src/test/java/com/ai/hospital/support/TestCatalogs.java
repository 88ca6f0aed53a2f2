package com.ai.hospital.support;

import com.ai.hospital.domain.WeeklySchedule;
import com.ai.hospital.service.ScheduleCatalog;

import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class TestCatalogs {

    public static final String CARDIOLOGY = "Cardiology";
    public static final String GENERAL_MEDICINE = "General Medicine";
    public static final String DR_A = "Dr. A";
    public static final String DR_B = "Dr. B";
    /** On the roster without a schedule of their own. */
    public static final String DR_C = "Dr. C";

    private TestCatalogs() {
    }

    /**
     * Cardiology: Dr. A, Mon-Fri 09:00-17:00. General Medicine: Dr. B, Mon-Sat 08:00-14:00,
     * and Dr. C on default hours.
     */
    public static ScheduleCatalog hospital() {
        Map<String, List<String>> departments = new LinkedHashMap<>();
        departments.put(CARDIOLOGY, List.of(DR_A));
        departments.put(GENERAL_MEDICINE, List.of(DR_B, DR_C));

        Map<String, WeeklySchedule> schedules = new LinkedHashMap<>();
        schedules.put(DR_A, new WeeklySchedule(Set.of(0, 1, 2, 3, 4), LocalTime.of(9, 0), LocalTime.of(17, 0)));
        schedules.put(DR_B, new WeeklySchedule(Set.of(0, 1, 2, 3, 4, 5), LocalTime.of(8, 0), LocalTime.of(14, 0)));
        return new ScheduleCatalog(departments, schedules);
    }
}
