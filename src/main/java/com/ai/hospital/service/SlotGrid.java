package com.ai.hospital.service;

import com.ai.hospital.domain.WeeklySchedule;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The fixed 30-minute grid of bookable times, shared by all doctors.
 */
@Component
public class SlotGrid {

    public static final int SLOT_DURATION_MINUTES = 30;
    public static final LocalTime FIRST_SLOT = LocalTime.of(7, 0);
    public static final LocalTime LAST_SLOT = LocalTime.of(19, 30);

    private static final List<LocalTime> ALL_SLOTS = buildGrid();

    private final ScheduleCatalog catalog;

    public SlotGrid(ScheduleCatalog catalog) {
        this.catalog = catalog;
    }

    private static List<LocalTime> buildGrid() {
        List<LocalTime> slots = new ArrayList<>();
        for (LocalTime t = FIRST_SLOT; !t.isAfter(LAST_SLOT); t = t.plus(SLOT_DURATION_MINUTES, ChronoUnit.MINUTES)) {
            slots.add(t);
        }
        return Collections.unmodifiableList(slots);
    }

    public List<LocalTime> allSlots() {
        return ALL_SLOTS;
    }

    /**
     * Grid points inside the doctor's hours on that date, or an empty list when the doctor
     * does not work that weekday.
     */
    public List<LocalTime> workingSlots(String doctor, LocalDate date) {
        WeeklySchedule schedule = catalog.scheduleFor(doctor);
        if (!schedule.worksOn(date.getDayOfWeek())) {
            return List.of();
        }
        return ALL_SLOTS.stream()
                .filter(schedule::covers)
                .toList();
    }
}
