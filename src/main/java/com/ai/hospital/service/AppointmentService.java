package com.ai.hospital.service;

import com.ai.hospital.config.SchedulingProperties;
import com.ai.hospital.domain.AppointmentRecord;
import com.ai.hospital.domain.AppointmentSnapshot;
import com.ai.hospital.domain.AppointmentStatus;
import com.ai.hospital.domain.BookingRequest;
import com.ai.hospital.dto.AppointmentView;
import com.ai.hospital.dto.BookingResult;
import com.ai.hospital.dto.CancellationResult;
import com.ai.hospital.dto.ErrorType;
import com.ai.hospital.store.AppointmentStore;
import com.ai.hospital.store.StaleSnapshotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point for slot discovery, booking, cancellation and appointment listings.
 * <p>
 * Every operation reloads the store first. Mutations hold one lock for the whole
 * reload-validate-commit cycle and start over from a fresh reload when the store reports
 * that another process committed in between.
 */
@Service
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    private static final Comparator<AppointmentRecord> CHRONOLOGICAL =
            Comparator.comparing(AppointmentRecord::getDate).thenComparing(AppointmentRecord::getTime);

    private static final int PAST_WEEK_DAYS = 7;

    private final AppointmentStore store;
    private final ScheduleCatalog catalog;
    private final SlotGrid slotGrid;
    private final BookingValidator validator;
    private final Clock clock;
    private final int maxCommitAttempts;
    private final ReentrantLock mutationLock = new ReentrantLock();

    public AppointmentService(AppointmentStore store,
                              ScheduleCatalog catalog,
                              SlotGrid slotGrid,
                              BookingValidator validator,
                              Clock clock,
                              SchedulingProperties properties) {
        this.store = store;
        this.catalog = catalog;
        this.slotGrid = slotGrid;
        this.validator = validator;
        this.clock = clock;
        this.maxCommitAttempts = properties.getStore().getMaxCommitAttempts();
    }

    // =========================================================
    // DEPARTMENTS
    // =========================================================
    public Map<String, List<String>> departments() {
        return catalog.departments();
    }

    // =========================================================
    // AVAILABLE SLOTS
    // =========================================================
    public List<String> availableSlots(String date, String department, String doctor) {
        if (!StringUtils.hasText(doctor)) {
            log.warn("Slot lookup without a doctor: date={} department={}", date, department);
            return List.of();
        }
        Optional<LocalDate> parsed = BookingValidator.parseDate(date);
        if (parsed.isEmpty()) {
            log.warn("Slot lookup with invalid date: {}", date);
            return List.of();
        }
        LocalDate day = parsed.get();
        LocalDateTime now = now();
        if (day.isBefore(now.toLocalDate())) {
            return List.of();
        }

        AppointmentSnapshot snapshot = store.reload();
        Set<LocalTime> booked = snapshot.records().stream()
                .filter(AppointmentRecord::isConfirmed)
                .filter(a -> a.getDate().equals(day)
                        && a.getDepartment().equals(department)
                        && a.getDoctor().equals(doctor))
                .map(AppointmentRecord::getTime)
                .collect(Collectors.toSet());

        LocalTime cutoff = now.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        boolean today = day.equals(now.toLocalDate());

        return slotGrid.workingSlots(doctor, day).stream()
                .filter(slot -> !booked.contains(slot))
                .filter(slot -> !today || slot.isAfter(cutoff))
                .map(BookingValidator::format)
                .toList();
    }

    // =========================================================
    // BOOK
    // =========================================================
    public BookingResult book(BookingRequest request) {
        if (!StringUtils.hasText(request.getUserId())) {
            return BookingResult.rejected(ErrorType.VALIDATION, "Missing user id");
        }

        BookingResult result = runMutation("book", snapshot -> {
            LocalDateTime now = now();
            ValidationResult validation = validator.validate(request, snapshot, now);
            if (!validation.accepted()) {
                log.warn("Booking rejected: user={} doctor={} date={} time={} reason={}",
                        request.getUserId(), request.getDoctor(), request.getDate(), request.getTime(),
                        validation.reason());
                return Decision.keep(BookingResult.rejected(validation.errorType(), validation.reason()));
            }

            AppointmentRecord record = AppointmentRecord.builder()
                    .id(snapshot.nextId(now.toLocalDate()))
                    .userId(request.getUserId())
                    .patientName(request.getPatientName().trim())
                    .patientAge(request.getPatientAge())
                    .patientGender(request.getPatientGender())
                    .department(request.getDepartment())
                    .doctor(request.getDoctor())
                    .date(validation.date())
                    .time(validation.time())
                    .status(AppointmentStatus.CONFIRMED)
                    .createdAt(now)
                    .build();
            snapshot.put(record);

            List<AppointmentRecord> sameDay = snapshot.records().stream()
                    .filter(AppointmentRecord::isConfirmed)
                    .filter(a -> a.getUserId().equals(record.getUserId())
                            && a.getDate().equals(record.getDate())
                            && !a.getId().equals(record.getId()))
                    .sorted(CHRONOLOGICAL)
                    .toList();

            return Decision.commit(BookingResult.success(view(record, now), confirmationMessage(record, sameDay)));
        }, BookingResult::internalError);

        if (result.success()) {
            AppointmentView a = result.appointment();
            log.info("Booked appointment: id={} patient={} doctor={} date={} time={}",
                    a.id(), a.patientName(), a.doctor(), a.date(), a.time());
        }
        return result;
    }

    private static String confirmationMessage(AppointmentRecord record, List<AppointmentRecord> sameDay) {
        StringBuilder message = new StringBuilder()
                .append("Booked ").append(record.getPatientName())
                .append(" with ").append(record.getDoctor())
                .append(" on ").append(record.getDate())
                .append(" at ").append(BookingValidator.format(record.getTime()));
        if (!sameDay.isEmpty()) {
            message.append(". Note: You also have appointment(s) on this date with ")
                    .append(sameDay.stream()
                            .map(a -> a.getDoctor() + " at " + BookingValidator.format(a.getTime()))
                            .collect(Collectors.joining(", ")));
        }
        return message.toString();
    }

    // =========================================================
    // CANCEL
    // =========================================================

    /**
     * Patient-initiated cancellation. Repeating the cancellation of an appointment the patient
     * already cancelled succeeds without a write; an appointment the doctor cancelled is left
     * as the doctor's cancellation and reported as a state error.
     */
    public CancellationResult cancel(String appointmentId, String userId) {
        CancellationResult result = runMutation("cancel", snapshot -> {
            Optional<AppointmentRecord> found = snapshot.find(appointmentId);
            if (found.isEmpty()) {
                return Decision.keep(CancellationResult.notFound());
            }
            AppointmentRecord appointment = found.get();
            if (!appointment.getUserId().equals(userId)) {
                log.warn("User {} tried to cancel appointment {} owned by another user", userId, appointmentId);
                return Decision.keep(CancellationResult.unauthorized("Unauthorized - this appointment belongs to another patient"));
            }
            switch (appointment.getStatus()) {
                case CANCELLED:
                    return Decision.keep(CancellationResult.success("Appointment " + appointmentId + " is already cancelled"));
                case CANCELLED_BY_DOCTOR:
                    return Decision.keep(CancellationResult.invalidState(
                            "Appointment " + appointmentId + " was already cancelled by " + appointment.getDoctor()));
                default:
                    snapshot.put(appointment.withStatus(AppointmentStatus.CANCELLED));
                    return Decision.commit(CancellationResult.success("Appointment " + appointmentId + " cancelled"));
            }
        }, CancellationResult::internalError);

        if (result.success()) {
            log.info("Cancelled appointment {} for user {}", appointmentId, userId);
        }
        return result;
    }

    public CancellationResult cancelByDoctor(String appointmentId, String doctorName, String reason) {
        CancellationResult result = runMutation("cancelByDoctor", snapshot -> {
            Optional<AppointmentRecord> found = snapshot.find(appointmentId);
            if (found.isEmpty()) {
                return Decision.keep(CancellationResult.notFound());
            }
            AppointmentRecord appointment = found.get();
            if (!appointment.getDoctor().equals(doctorName)) {
                log.warn("{} tried to cancel appointment {} assigned to {}", doctorName, appointmentId, appointment.getDoctor());
                return Decision.keep(CancellationResult.unauthorized("Unauthorized - this appointment is not with you"));
            }
            if (!appointment.isConfirmed()) {
                return Decision.keep(CancellationResult.invalidState(
                        "Cannot cancel - appointment is already " + appointment.getStatus().getWireValue()));
            }

            snapshot.put(appointment.withStatus(AppointmentStatus.CANCELLED_BY_DOCTOR));

            String message = "Appointment " + appointmentId + " with " + appointment.getPatientName()
                    + " on " + appointment.getDate() + " at " + BookingValidator.format(appointment.getTime())
                    + " has been cancelled";
            if (StringUtils.hasText(reason)) {
                message += ". Reason: " + reason.trim();
            }
            return Decision.commit(CancellationResult.successNotifying(message, appointment.getUserId()));
        }, CancellationResult::internalError);

        if (result.success()) {
            log.info("{} cancelled appointment {}; patient {} to be notified", doctorName, appointmentId, result.patientUserId());
        }
        return result;
    }

    // =========================================================
    // LISTINGS
    // =========================================================
    /** Confirmed appointments, past ones shown as expired. Cancellations are left out. */
    public List<AppointmentView> appointmentsForUser(String userId) {
        return query(a -> a.isConfirmed() && a.getUserId().equals(userId), CHRONOLOGICAL);
    }

    public List<AppointmentView> appointmentsForUserOnDate(String userId, String date) {
        Optional<LocalDate> day = BookingValidator.parseDate(date);
        if (day.isEmpty()) {
            return List.of();
        }
        return query(a -> a.isConfirmed()
                && a.getUserId().equals(userId)
                && a.getDate().equals(day.get()), CHRONOLOGICAL);
    }

    public List<AppointmentView> appointmentsForDoctorToday(String doctorName) {
        LocalDate today = now().toLocalDate();
        return query(a -> a.isConfirmed()
                && a.getDoctor().equals(doctorName)
                && a.getDate().equals(today), CHRONOLOGICAL);
    }

    /** Confirmed appointments from today onwards. */
    public List<AppointmentView> appointmentsForDoctorAll(String doctorName) {
        LocalDate today = now().toLocalDate();
        return query(a -> a.isConfirmed()
                && a.getDoctor().equals(doctorName)
                && !a.getDate().isBefore(today), CHRONOLOGICAL);
    }

    /** The last seven days up to and including today, most recent first. */
    public List<AppointmentView> appointmentsForDoctorPastWeek(String doctorName) {
        LocalDate today = now().toLocalDate();
        LocalDate weekAgo = today.minusDays(PAST_WEEK_DAYS);
        return query(a -> a.isConfirmed()
                && a.getDoctor().equals(doctorName)
                && !a.getDate().isBefore(weekAgo)
                && !a.getDate().isAfter(today), CHRONOLOGICAL.reversed());
    }

    public List<AppointmentView> allConfirmedAppointments() {
        return query(AppointmentRecord::isConfirmed, CHRONOLOGICAL);
    }

    private List<AppointmentView> query(Predicate<AppointmentRecord> filter, Comparator<AppointmentRecord> order) {
        LocalDateTime now = now();
        return store.reload().records().stream()
                .filter(filter)
                .sorted(order)
                .map(a -> view(a, now))
                .toList();
    }

    private static AppointmentView view(AppointmentRecord record, LocalDateTime now) {
        return AppointmentView.of(record, ViewStatusResolver.resolveViewStatus(record, now));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    // =========================================================
    // RELOAD / DECIDE / COMMIT
    // =========================================================
    private <T> T runMutation(String operation,
                              Function<AppointmentSnapshot, Decision<T>> decide,
                              Supplier<T> internalError) {
        mutationLock.lock();
        try {
            for (int attempt = 1; attempt <= maxCommitAttempts; attempt++) {
                AppointmentSnapshot snapshot = store.reload();
                Decision<T> decision = decide.apply(snapshot);
                if (!decision.needsCommit()) {
                    return decision.result();
                }
                try {
                    store.commit(snapshot);
                    return decision.result();
                } catch (StaleSnapshotException e) {
                    log.warn("{}: store changed before commit (attempt {}/{}): {}",
                            operation, attempt, maxCommitAttempts, e.getMessage());
                }
            }
            log.error("{}: giving up after {} conflicting commit attempts", operation, maxCommitAttempts);
            return internalError.get();
        } catch (RuntimeException e) {
            log.error("{} failed", operation, e);
            return internalError.get();
        } finally {
            mutationLock.unlock();
        }
    }

    private record Decision<T>(T result, boolean needsCommit) {

        static <T> Decision<T> keep(T result) {
            return new Decision<>(result, false);
        }

        static <T> Decision<T> commit(T result) {
            return new Decision<>(result, true);
        }
    }
}
