package com.ai.hospital.service;

import com.ai.hospital.domain.WeeklySchedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static registry of departments, their doctors and each doctor's weekly template.
 */
public class ScheduleCatalog {

    private final Map<String, List<String>> departments;
    private final Map<String, WeeklySchedule> schedules;

    public ScheduleCatalog(Map<String, List<String>> departments, Map<String, WeeklySchedule> schedules) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        Map<String, String> departmentByDoctor = new HashMap<>();
        departments.forEach((department, doctors) -> {
            for (String doctor : doctors) {
                String previous = departmentByDoctor.putIfAbsent(doctor, department);
                if (previous != null) {
                    throw new IllegalArgumentException(
                            doctor + " is listed in both " + previous + " and " + department);
                }
            }
            copy.put(department, List.copyOf(doctors));
        });
        for (String doctor : schedules.keySet()) {
            if (!departmentByDoctor.containsKey(doctor)) {
                throw new IllegalArgumentException("Schedule given for " + doctor + " who is in no department");
            }
        }
        this.departments = Collections.unmodifiableMap(copy);
        this.schedules = Map.copyOf(schedules);
    }

    /**
     * Department to doctors, in roster order. The returned map is a copy the caller may modify.
     */
    public Map<String, List<String>> departments() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        departments.forEach((department, doctors) -> copy.put(department, new ArrayList<>(doctors)));
        return copy;
    }

    /**
     * Doctors missing from the registry, or no doctor at all, get {@link WeeklySchedule#DEFAULT}.
     */
    public WeeklySchedule scheduleFor(String doctor) {
        if (doctor == null) return WeeklySchedule.DEFAULT;
        return schedules.getOrDefault(doctor, WeeklySchedule.DEFAULT);
    }

    public boolean hasDepartment(String department) {
        return department != null && departments.containsKey(department);
    }

    public boolean isDoctorInDepartment(String department, String doctor) {
        return doctor != null && hasDepartment(department) && departments.get(department).contains(doctor);
    }
}
