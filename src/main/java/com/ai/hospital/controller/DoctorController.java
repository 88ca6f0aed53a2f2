package com.ai.hospital.controller;

import com.ai.hospital.dto.AppointmentView;
import com.ai.hospital.dto.CancellationResult;
import com.ai.hospital.dto.DoctorCancelRequest;
import com.ai.hospital.service.AppointmentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Staff-facing endpoints. {@code X-Doctor-Name} carries the signed-in doctor's roster name.
 */
@RestController
@RequestMapping("/appointments/doctor")
public class DoctorController {

    static final String DOCTOR_HEADER = "X-Doctor-Name";

    private final AppointmentService appointmentService;

    public DoctorController(AppointmentService appointmentService) {
        this.appointmentService = appointmentService;
    }

    @GetMapping("/today")
    public Map<String, Object> today(@RequestHeader(DOCTOR_HEADER) String doctor) {
        return listing(doctor, appointmentService.appointmentsForDoctorToday(doctor));
    }

    @GetMapping("/all")
    public Map<String, Object> upcoming(@RequestHeader(DOCTOR_HEADER) String doctor) {
        return listing(doctor, appointmentService.appointmentsForDoctorAll(doctor));
    }

    @GetMapping("/past-week")
    public Map<String, Object> pastWeek(@RequestHeader(DOCTOR_HEADER) String doctor) {
        return listing(doctor, appointmentService.appointmentsForDoctorPastWeek(doctor));
    }

    @PostMapping("/{appointmentId}/cancel")
    public ResponseEntity<CancellationResult> cancel(@RequestHeader(DOCTOR_HEADER) String doctor,
                                                     @PathVariable String appointmentId,
                                                     @RequestBody(required = false) DoctorCancelRequest body) {
        String reason = body != null ? body.reason() : null;
        CancellationResult result = appointmentService.cancelByDoctor(appointmentId, doctor, reason);
        return ResponseEntity.status(OutcomeStatus.of(result.success(), result.errorType())).body(result);
    }

    private static Map<String, Object> listing(String doctor, List<AppointmentView> appointments) {
        return Map.of(
                "doctor", doctor,
                "appointments", appointments,
                "count", appointments.size());
    }
}
