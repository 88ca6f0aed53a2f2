package com.ai.hospital.service;

import com.ai.hospital.domain.AppointmentRecord;
import com.ai.hospital.domain.AppointmentSnapshot;
import com.ai.hospital.domain.BookingRequest;
import com.ai.hospital.domain.Gender;
import com.ai.hospital.domain.WeeklySchedule;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a booking may be made against a given snapshot. Structural checks run
 * before the ones that look at existing appointments, and the first failing check wins.
 */
@Component
public class BookingValidator {

    static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private static final int MIN_NAME_LENGTH = 2;
    private static final int MAX_AGE = 150;

    private final ScheduleCatalog catalog;
    private final SlotGrid slotGrid;

    public BookingValidator(ScheduleCatalog catalog, SlotGrid slotGrid) {
        this.catalog = catalog;
        this.slotGrid = slotGrid;
    }

    public ValidationResult validate(BookingRequest request, AppointmentSnapshot snapshot, LocalDateTime now) {
        String department = request.getDepartment();
        String doctor = request.getDoctor();

        if (!catalog.hasDepartment(department)) {
            return ValidationResult.invalid("Invalid department: " + department);
        }
        if (!catalog.isDoctorInDepartment(department, doctor)) {
            return ValidationResult.invalid(doctor + " is not a doctor in " + department);
        }

        Optional<LocalDate> parsedDate = parseDate(request.getDate());
        if (parsedDate.isEmpty()) {
            return ValidationResult.invalid("Invalid date format (YYYY-MM-DD): " + request.getDate());
        }
        LocalDate date = parsedDate.get();
        List<LocalTime> workingSlots = slotGrid.workingSlots(doctor, date);
        if (workingSlots.isEmpty()) {
            WeeklySchedule schedule = catalog.scheduleFor(doctor);
            return ValidationResult.invalid(doctor + " is not available on " + date
                    + " (works " + schedule.describeDays() + ")");
        }

        Optional<LocalTime> parsedTime = parseTime(request.getTime());
        if (parsedTime.isEmpty() || !workingSlots.contains(parsedTime.get())) {
            WeeklySchedule schedule = catalog.scheduleFor(doctor);
            return ValidationResult.invalid("Invalid time " + request.getTime() + " - " + doctor
                    + " works " + schedule.describeHours() + " in 30-minute slots");
        }
        LocalTime time = parsedTime.get();

        if (date.isBefore(now.toLocalDate())) {
            return ValidationResult.invalid("Cannot book in the past");
        }

        String name = request.getPatientName();
        if (name == null || name.trim().length() < MIN_NAME_LENGTH) {
            return ValidationResult.invalid("Invalid patient name");
        }
        Integer age = request.getPatientAge();
        if (age == null || age < 0 || age > MAX_AGE) {
            return ValidationResult.invalid("Invalid age");
        }
        if (Gender.fromLabel(request.getPatientGender()).isEmpty()) {
            return ValidationResult.invalid("Gender must be Male, Female, or Other");
        }

        String userId = request.getUserId();

        Optional<AppointmentRecord> doctorBusy = snapshot.records().stream()
                .filter(AppointmentRecord::isConfirmed)
                .filter(a -> a.getDoctor().equals(doctor) && a.isAt(date, time))
                .findFirst();
        if (doctorBusy.isPresent()) {
            return ValidationResult.conflict(doctor + " already has an appointment at " + format(time)
                    + " on " + date + ". Please choose a different time.");
        }

        Optional<AppointmentRecord> userBusy = snapshot.records().stream()
                .filter(AppointmentRecord::isConfirmed)
                .filter(a -> a.getUserId().equals(userId) && a.isAt(date, time))
                .findFirst();
        if (userBusy.isPresent()) {
            return ValidationResult.conflict("You already have an appointment with " + userBusy.get().getDoctor()
                    + " at " + format(time) + " on " + date + ". Please choose a different time.");
        }

        Optional<AppointmentRecord> sameDoctorSameDay = snapshot.records().stream()
                .filter(AppointmentRecord::isConfirmed)
                .filter(a -> a.getUserId().equals(userId)
                        && a.getDoctor().equals(doctor)
                        && a.getDate().equals(date))
                .findFirst();
        if (sameDoctorSameDay.isPresent()) {
            return ValidationResult.conflict("You already have an appointment with " + doctor + " at "
                    + format(sameDoctorSameDay.get().getTime()) + " on " + date
                    + ". You can only book one appointment per doctor per day.");
        }

        return ValidationResult.accept(date, time);
    }

    static Optional<LocalDate> parseDate(String value) {
        if (value == null) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(value.trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static Optional<LocalTime> parseTime(String value) {
        if (value == null) return Optional.empty();
        try {
            return Optional.of(LocalTime.parse(value.trim(), TIME_FORMAT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static String format(LocalTime time) {
        return time.format(TIME_FORMAT);
    }
}
