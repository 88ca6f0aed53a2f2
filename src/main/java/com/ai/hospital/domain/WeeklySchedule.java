package com.ai.hospital.domain;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A doctor's weekly availability template.
 *
 * @param workingDays weekdays encoded 0 = Monday ... 6 = Sunday
 * @param start inclusive
 * @param end exclusive
 */
public record WeeklySchedule(Set<Integer> workingDays, LocalTime start, LocalTime end) {

    public static final WeeklySchedule DEFAULT =
            new WeeklySchedule(Set.of(0, 1, 2, 3, 4), LocalTime.of(9, 0), LocalTime.of(17, 0));

    public WeeklySchedule {
        if (workingDays == null || workingDays.isEmpty())
            throw new IllegalArgumentException("Schedule needs at least one working day");
        if (workingDays.stream().anyMatch(d -> d == null || d < 0 || d > 6))
            throw new IllegalArgumentException("Working days must be between 0 (Monday) and 6 (Sunday): " + workingDays);
        if (start == null || end == null)
            throw new IllegalArgumentException("Schedule start and end are required");
        if (!start.isBefore(end))
            throw new IllegalArgumentException("Schedule start " + start + " must be before end " + end);
        workingDays = Collections.unmodifiableSet(new TreeSet<>(workingDays));
    }

    public boolean worksOn(DayOfWeek dayOfWeek) {
        return workingDays.contains(dayOfWeek.getValue() - 1);
    }

    public boolean covers(LocalTime time) {
        return !time.isBefore(start) && time.isBefore(end);
    }

    public String describeHours() {
        return start + " to " + end;
    }

    public String describeDays() {
        return workingDays.stream()
                .map(d -> DayOfWeek.of(d + 1).name().substring(0, 3))
                .collect(Collectors.joining(", "));
    }
}
