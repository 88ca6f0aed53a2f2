package com.ai.hospital.store;

import com.ai.hospital.domain.AppointmentRecord;
import com.ai.hospital.domain.AppointmentStatus;
import com.ai.hospital.domain.Gender;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * One appointment as it appears in the JSON document. Older documents may lack the patient
 * fields; those are filled with defaults when the record is read.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredAppointment {

    static final String DEFAULT_PATIENT_NAME = "Unknown";
    static final int DEFAULT_PATIENT_AGE = 0;
    static final String DEFAULT_PATIENT_GENDER = Gender.OTHER.getLabel();

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    private String id;

    @JsonProperty("user_id")
    private String userId;

    /** Pre-patient-fields documents stored the booking user's display name here. */
    @JsonProperty("user_name")
    private String userName;

    @JsonProperty("patient_name")
    private String patientName;

    @JsonProperty("patient_age")
    private Integer patientAge;

    @JsonProperty("patient_gender")
    private String patientGender;

    private String department;
    private String doctor;
    private String date;
    private String time;
    private String status;

    @JsonProperty("created_at")
    private String createdAt;

    static StoredAppointment from(AppointmentRecord r) {
        StoredAppointment s = new StoredAppointment();
        s.id = r.getId();
        s.userId = r.getUserId();
        s.patientName = r.getPatientName();
        s.patientAge = r.getPatientAge();
        s.patientGender = r.getPatientGender();
        s.department = r.getDepartment();
        s.doctor = r.getDoctor();
        s.date = r.getDate().toString();
        s.time = r.getTime().format(TIME);
        s.status = r.getStatus().getWireValue();
        s.createdAt = r.getCreatedAt() == null ? null : r.getCreatedAt().toString();
        return s;
    }

    AppointmentRecord toRecord(String key) {
        String recordId = id != null ? id : key;
        require(recordId, userId, "user_id");
        require(recordId, department, "department");
        require(recordId, doctor, "doctor");
        require(recordId, date, "date");
        require(recordId, time, "time");

        AppointmentStatus parsedStatus = status == null
                ? AppointmentStatus.CONFIRMED
                : AppointmentStatus.fromWire(status)
                        .filter(AppointmentStatus::isPersistable)
                        .orElseThrow(() -> new UnmigratableRecordException(recordId, "unknown status " + status));

        try {
            return AppointmentRecord.builder()
                    .id(recordId)
                    .userId(userId)
                    .patientName(patientName != null ? patientName
                            : userName != null ? userName : DEFAULT_PATIENT_NAME)
                    .patientAge(patientAge != null ? patientAge : DEFAULT_PATIENT_AGE)
                    .patientGender(patientGender != null ? patientGender : DEFAULT_PATIENT_GENDER)
                    .department(department)
                    .doctor(doctor)
                    .date(LocalDate.parse(date))
                    .time(LocalTime.parse(time, TIME))
                    .status(parsedStatus)
                    .createdAt(createdAt == null ? null : LocalDateTime.parse(createdAt))
                    .build();
        } catch (DateTimeParseException e) {
            throw new UnmigratableRecordException(recordId, e.getMessage());
        }
    }

    private static void require(String recordId, String value, String field) {
        if (value == null || value.isBlank()) {
            throw new UnmigratableRecordException(recordId, "missing " + field);
        }
    }
}
