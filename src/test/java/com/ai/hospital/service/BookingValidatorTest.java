package com.ai.hospital.service;

import com.ai.hospital.domain.AppointmentRecord;
import com.ai.hospital.domain.AppointmentSnapshot;
import com.ai.hospital.domain.AppointmentStatus;
import com.ai.hospital.domain.BookingRequest;
import com.ai.hospital.dto.ErrorType;
import com.ai.hospital.support.TestCatalogs;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.ai.hospital.support.TestCatalogs.CARDIOLOGY;
import static com.ai.hospital.support.TestCatalogs.DR_A;
import static com.ai.hospital.support.TestCatalogs.DR_B;
import static com.ai.hospital.support.TestCatalogs.GENERAL_MEDICINE;
import static org.assertj.core.api.Assertions.assertThat;

class BookingValidatorTest {

    // Monday 2030-01-07, 10:15
    private static final LocalDateTime NOW = LocalDateTime.of(2030, 1, 7, 10, 15);
    private static final String NEXT_MONDAY = "2030-01-14";

    private final ScheduleCatalog catalog = TestCatalogs.hospital();
    private final BookingValidator validator = new BookingValidator(catalog, new SlotGrid(catalog));

    private static BookingRequest.BookingRequestBuilder request() {
        return BookingRequest.builder()
                .userId("user-1")
                .patientName("Asha Rao")
                .patientAge(34)
                .patientGender("Female")
                .department(CARDIOLOGY)
                .doctor(DR_A)
                .date(NEXT_MONDAY)
                .time("10:00");
    }

    private static AppointmentRecord existing(String id, String userId, String doctor, String date, String time,
                                              AppointmentStatus status) {
        return AppointmentRecord.builder()
                .id(id)
                .userId(userId)
                .patientName("Someone")
                .patientAge(40)
                .patientGender("Male")
                .department(doctor.equals(DR_A) ? CARDIOLOGY : GENERAL_MEDICINE)
                .doctor(doctor)
                .date(LocalDate.parse(date))
                .time(LocalTime.parse(time))
                .status(status)
                .createdAt(NOW.minusDays(1))
                .build();
    }

    private static AppointmentSnapshot snapshotOf(AppointmentRecord... records) {
        Map<String, AppointmentRecord> map = new LinkedHashMap<>();
        for (AppointmentRecord r : records) {
            map.put(r.getId(), r);
        }
        return new AppointmentSnapshot(map, records.length, null, "1", false);
    }

    private ValidationResult validate(BookingRequest request, AppointmentSnapshot snapshot) {
        return validator.validate(request, snapshot, NOW);
    }

    @Test
    void acceptsValidRequestWithParsedDateAndTime() {
        ValidationResult result = validate(request().build(), snapshotOf());

        assertThat(result.accepted()).isTrue();
        assertThat(result.date()).isEqualTo(LocalDate.of(2030, 1, 14));
        assertThat(result.time()).isEqualTo(LocalTime.of(10, 0));
    }

    @Test
    void unknownDepartment() {
        ValidationResult result = validate(request().department("Radiology").build(), snapshotOf());

        assertThat(result.accepted()).isFalse();
        assertThat(result.errorType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(result.reason()).contains("Invalid department");
    }

    @Test
    void missingDepartmentOrDoctor() {
        ValidationResult noDepartment = validate(request().department(null).build(), snapshotOf());
        assertThat(noDepartment.errorType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(noDepartment.reason()).startsWith("Invalid department");

        ValidationResult noDoctor = validate(request().doctor(null).build(), snapshotOf());
        assertThat(noDoctor.errorType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(noDoctor.reason()).endsWith("is not a doctor in Cardiology");
    }

    @Test
    void doctorOutsideDepartment() {
        ValidationResult result = validate(request().doctor(DR_B).build(), snapshotOf());

        assertThat(result.reason()).isEqualTo("Dr. B is not a doctor in Cardiology");
    }

    @Test
    void malformedDate() {
        ValidationResult result = validate(request().date("14/01/2030").build(), snapshotOf());

        assertThat(result.errorType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(result.reason()).contains("YYYY-MM-DD");
    }

    @Test
    void doctorNotWorkingThatDay() {
        ValidationResult result = validate(request().date("2030-01-12").build(), snapshotOf());

        assertThat(result.reason()).startsWith("Dr. A is not available on 2030-01-12");
    }

    @Test
    void timeOutsideWorkingHoursOrOffGrid() {
        assertThat(validate(request().time("08:00").build(), snapshotOf()).reason())
                .contains("works 09:00 to 17:00");
        assertThat(validate(request().time("10:15").build(), snapshotOf()).accepted()).isFalse();
        assertThat(validate(request().time("17:00").build(), snapshotOf()).accepted()).isFalse();
        assertThat(validate(request().time("ten").build(), snapshotOf()).errorType()).isEqualTo(ErrorType.VALIDATION);
    }

    @Test
    void pastDate() {
        ValidationResult result = validate(request().date("2029-12-31").build(), snapshotOf());

        assertThat(result.reason()).isEqualTo("Cannot book in the past");
    }

    @Test
    void todayIsNotThePast() {
        ValidationResult result = validate(request().date("2030-01-07").time("16:00").build(), snapshotOf());

        assertThat(result.accepted()).isTrue();
    }

    @Test
    void patientFields() {
        assertThat(validate(request().patientName(" A ").build(), snapshotOf()).reason()).isEqualTo("Invalid patient name");
        assertThat(validate(request().patientName(null).build(), snapshotOf()).reason()).isEqualTo("Invalid patient name");
        assertThat(validate(request().patientAge(-1).build(), snapshotOf()).reason()).isEqualTo("Invalid age");
        assertThat(validate(request().patientAge(151).build(), snapshotOf()).reason()).isEqualTo("Invalid age");
        assertThat(validate(request().patientAge(null).build(), snapshotOf()).reason()).isEqualTo("Invalid age");
        assertThat(validate(request().patientAge(150).build(), snapshotOf()).accepted()).isTrue();
        assertThat(validate(request().patientAge(0).build(), snapshotOf()).accepted()).isTrue();
        assertThat(validate(request().patientGender("female").build(), snapshotOf()).reason())
                .isEqualTo("Gender must be Male, Female, or Other");
    }

    @Test
    void structuralChecksWinOverConflicts() {
        AppointmentSnapshot busy = snapshotOf(existing("APT-1", "user-2", DR_A, NEXT_MONDAY, "10:00", AppointmentStatus.CONFIRMED));

        ValidationResult result = validate(request().patientAge(200).build(), busy);

        assertThat(result.errorType()).isEqualTo(ErrorType.VALIDATION);
    }

    @Test
    void doctorSlotConflict() {
        AppointmentSnapshot busy = snapshotOf(existing("APT-1", "user-2", DR_A, NEXT_MONDAY, "10:00", AppointmentStatus.CONFIRMED));

        ValidationResult result = validate(request().build(), busy);

        assertThat(result.errorType()).isEqualTo(ErrorType.CONFLICT);
        assertThat(result.reason()).isEqualTo("Dr. A already has an appointment at 10:00 on 2030-01-14. Please choose a different time.");
    }

    @Test
    void cancelledAppointmentsDoNotConflict() {
        AppointmentSnapshot released = snapshotOf(
                existing("APT-1", "user-2", DR_A, NEXT_MONDAY, "10:00", AppointmentStatus.CANCELLED),
                existing("APT-2", "user-1", DR_A, NEXT_MONDAY, "11:00", AppointmentStatus.CANCELLED_BY_DOCTOR));

        assertThat(validate(request().build(), released).accepted()).isTrue();
    }

    @Test
    void userAlreadyBusyAtThatTime() {
        AppointmentSnapshot busy = snapshotOf(existing("APT-1", "user-1", DR_B, NEXT_MONDAY, "10:00", AppointmentStatus.CONFIRMED));

        ValidationResult result = validate(request().build(), busy);

        assertThat(result.errorType()).isEqualTo(ErrorType.CONFLICT);
        assertThat(result.reason()).startsWith("You already have an appointment with Dr. B at 10:00");
    }

    @Test
    void oneAppointmentPerDoctorPerDay() {
        AppointmentSnapshot booked = snapshotOf(existing("APT-1", "user-1", DR_A, NEXT_MONDAY, "14:00", AppointmentStatus.CONFIRMED));

        ValidationResult result = validate(request().build(), booked);

        assertThat(result.errorType()).isEqualTo(ErrorType.CONFLICT);
        assertThat(result.reason()).contains("at 14:00").contains("one appointment per doctor per day");
    }

    @Test
    void otherDoctorsSameDayAreAllowed() {
        AppointmentSnapshot booked = snapshotOf(existing("APT-1", "user-1", DR_B, NEXT_MONDAY, "09:00", AppointmentStatus.CONFIRMED));

        assertThat(validate(request().build(), booked).accepted()).isTrue();
    }
}
