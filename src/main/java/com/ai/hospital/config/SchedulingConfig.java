package com.ai.hospital.config;

import com.ai.hospital.domain.WeeklySchedule;
import com.ai.hospital.service.ScheduleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the roster and the clock from {@link SchedulingProperties}. Invalid schedules stop
 * the application at startup.
 */
@Configuration
@EnableConfigurationProperties(SchedulingProperties.class)
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public Clock schedulingClock(SchedulingProperties properties) {
        ZoneId zone = StringUtils.hasText(properties.getZone())
                ? ZoneId.of(properties.getZone().trim())
                : ZoneId.systemDefault();
        log.info("Scheduling clock zone: {}", zone);
        return Clock.system(zone);
    }

    @Bean
    public ScheduleCatalog scheduleCatalog(SchedulingProperties properties) {
        Map<String, List<String>> departments = new LinkedHashMap<>();
        Map<String, WeeklySchedule> schedules = new LinkedHashMap<>();

        for (SchedulingProperties.Department department : properties.getCatalog().getDepartments()) {
            List<String> doctors = new ArrayList<>();
            for (SchedulingProperties.Doctor doctor : department.getDoctors()) {
                doctors.add(doctor.getName());
                if (doctor.hasSchedule()) {
                    schedules.put(doctor.getName(), toSchedule(doctor));
                }
            }
            if (departments.put(department.getName(), doctors) != null) {
                throw new IllegalStateException("Department listed twice: " + department.getName());
            }
        }

        ScheduleCatalog catalog = new ScheduleCatalog(departments, schedules);
        log.info("Schedule catalog loaded: departments={}, doctors={}, schedules={}",
                departments.size(),
                departments.values().stream().mapToInt(List::size).sum(),
                schedules.size());
        return catalog;
    }

    private static WeeklySchedule toSchedule(SchedulingProperties.Doctor doctor) {
        try {
            return new WeeklySchedule(
                    new HashSet<>(doctor.getDays()),
                    parseTime(doctor.getStart()),
                    parseTime(doctor.getEnd()));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new IllegalStateException("Invalid schedule for " + doctor.getName() + ": " + e.getMessage(), e);
        }
    }

    private static LocalTime parseTime(String value) {
        return value == null ? null : LocalTime.parse(value.trim());
    }
}
