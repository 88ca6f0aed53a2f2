package com.ai.hospital.controller;

import com.ai.hospital.domain.BookingRequest;
import com.ai.hospital.dto.AppointmentView;
import com.ai.hospital.dto.BookAppointmentRequest;
import com.ai.hospital.dto.BookingResult;
import com.ai.hospital.dto.CancellationResult;
import com.ai.hospital.service.AppointmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Patient-facing endpoints. The caller's identity is resolved upstream and passed in
 * {@code X-User-Id}.
 */
@RestController
@RequestMapping("/appointments")
public class AppointmentController {

    private static final Logger log = LoggerFactory.getLogger(AppointmentController.class);

    static final String USER_HEADER = "X-User-Id";

    private final AppointmentService appointmentService;

    public AppointmentController(AppointmentService appointmentService) {
        this.appointmentService = appointmentService;
    }

    @GetMapping("/departments")
    public Map<String, Object> departments() {
        return Map.of("departments", appointmentService.departments());
    }

    @GetMapping("/slots")
    public Map<String, Object> slots(@RequestParam String date,
                                     @RequestParam String department,
                                     @RequestParam String doctor) {
        List<String> slots = appointmentService.availableSlots(date, department, doctor);
        return Map.of(
                "date", date,
                "department", department,
                "doctor", doctor,
                "available_slots", slots);
    }

    @PostMapping("/book")
    public ResponseEntity<BookingResult> book(@RequestHeader(USER_HEADER) String userId,
                                              @RequestBody BookAppointmentRequest body) {
        BookingRequest request = BookingRequest.builder()
                .userId(userId)
                .patientName(body.patientName())
                .patientAge(body.patientAge())
                .patientGender(body.patientGender())
                .department(body.department())
                .doctor(body.doctor())
                .date(body.date())
                .time(body.time())
                .build();
        BookingResult result = appointmentService.book(request);
        return ResponseEntity.status(OutcomeStatus.of(result.success(), result.errorType())).body(result);
    }

    @GetMapping("/my")
    public Map<String, List<AppointmentView>> myAppointments(@RequestHeader(USER_HEADER) String userId) {
        return Map.of("appointments", appointmentService.appointmentsForUser(userId));
    }

    @GetMapping("/my/{date}")
    public Map<String, List<AppointmentView>> myAppointmentsOn(@RequestHeader(USER_HEADER) String userId,
                                                               @PathVariable String date) {
        return Map.of("appointments", appointmentService.appointmentsForUserOnDate(userId, date));
    }

    @DeleteMapping("/{appointmentId}")
    public ResponseEntity<CancellationResult> cancel(@RequestHeader(USER_HEADER) String userId,
                                                     @PathVariable String appointmentId) {
        CancellationResult result = appointmentService.cancel(appointmentId, userId);
        if (!result.success()) {
            log.info("Cancel {} by {} refused: {}", appointmentId, userId, result.message());
        }
        return ResponseEntity.status(OutcomeStatus.of(result.success(), result.errorType())).body(result);
    }
}
