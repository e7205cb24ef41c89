package com.clinicbooking.bookingservice.controller;

import com.clinicbooking.bookingservice.dto.AppointmentDto;
import com.clinicbooking.bookingservice.dto.AppointmentRequest;
import com.clinicbooking.bookingservice.dto.BookingLineRequest;
import com.clinicbooking.bookingservice.dto.CancelRequest;
import com.clinicbooking.bookingservice.dto.ReplaceServicesRequest;
import com.clinicbooking.bookingservice.dto.RescheduleRequest;
import com.clinicbooking.bookingservice.dto.StatusChangeRequest;
import com.clinicbooking.bookingservice.service.BookingLine;
import com.clinicbooking.bookingservice.service.BookingOrchestrator;
import com.clinicbooking.bookingservice.service.SlotGenerator;
import com.clinicbooking.bookingservice.service.TimeSlot;
import com.clinicbooking.bookingservice.util.BookingTimeUtils;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Availability and appointment endpoints. The caller identifies itself with the
 * {@code X-Actor} header, which ends up in the audit log.
 */
@RestController
@RequestMapping("/api")
public class AppointmentController {

    static final String ACTOR_HEADER = "X-Actor";

    private final BookingOrchestrator bookingOrchestrator;
    private final SlotGenerator slotGenerator;

    public AppointmentController(BookingOrchestrator bookingOrchestrator, SlotGenerator slotGenerator) {
        this.bookingOrchestrator = bookingOrchestrator;
        this.slotGenerator = slotGenerator;
    }

    @GetMapping("/businesses/{businessId}/available-slots")
    public ResponseEntity<List<TimeSlot>> getAvailableSlots(@PathVariable Long businessId,
                                                            @RequestParam("service") Long serviceId,
                                                            @RequestParam String date,
                                                            @RequestParam(name = "staff", required = false) Long staffId) {
        List<TimeSlot> slots = slotGenerator
                .generateForBusiness(businessId, serviceId, BookingTimeUtils.parseDate("date", date), staffId)
                .orElseThrow();
        return ResponseEntity.ok(slots);
    }

    @PostMapping("/businesses/{businessId}/appointments")
    public ResponseEntity<AppointmentDto> createAppointment(@PathVariable Long businessId,
                                                            @Valid @RequestBody AppointmentRequest request,
                                                            @RequestHeader(value = ACTOR_HEADER, defaultValue = "system") String actor) {
        AppointmentDto created = bookingOrchestrator.createAppointment(
                        businessId,
                        toLines(request.getServices()),
                        request.getClientName(),
                        request.getClientPhone(),
                        request.getNotes(),
                        actor)
                .map(AppointmentDto::from)
                .orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/appointments/{appointmentId}")
    public ResponseEntity<AppointmentDto> getAppointment(@PathVariable Long appointmentId) {
        return ResponseEntity.ok(bookingOrchestrator.getAppointment(appointmentId)
                .map(AppointmentDto::from)
                .orElseThrow());
    }

    @PostMapping("/appointments/{appointmentId}/reschedule")
    public ResponseEntity<AppointmentDto> reschedule(@PathVariable Long appointmentId,
                                                     @Valid @RequestBody RescheduleRequest request,
                                                     @RequestHeader(value = ACTOR_HEADER, defaultValue = "system") String actor) {
        return ResponseEntity.ok(bookingOrchestrator.rescheduleAppointment(
                        appointmentId,
                        BookingTimeUtils.parseDateTime("new_start_time", request.getNewStartTime()),
                        request.getReason(),
                        actor)
                .map(AppointmentDto::from)
                .orElseThrow());
    }

    @PostMapping("/appointments/{appointmentId}/status")
    public ResponseEntity<AppointmentDto> changeStatus(@PathVariable Long appointmentId,
                                                       @Valid @RequestBody StatusChangeRequest request,
                                                       @RequestHeader(value = ACTOR_HEADER, defaultValue = "system") String actor) {
        return ResponseEntity.ok(bookingOrchestrator.changeAppointmentStatus(appointmentId, request.getStatus(), actor)
                .map(AppointmentDto::from)
                .orElseThrow());
    }

    @PostMapping("/appointments/{appointmentId}/cancel")
    public ResponseEntity<AppointmentDto> cancel(@PathVariable Long appointmentId,
                                                 @RequestBody(required = false) CancelRequest request,
                                                 @RequestHeader(value = ACTOR_HEADER, defaultValue = "system") String actor) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(bookingOrchestrator.cancelAppointment(appointmentId, reason, actor)
                .map(AppointmentDto::from)
                .orElseThrow());
    }

    @PutMapping("/appointments/{appointmentId}/services")
    public ResponseEntity<AppointmentDto> replaceServices(@PathVariable Long appointmentId,
                                                          @Valid @RequestBody ReplaceServicesRequest request,
                                                          @RequestHeader(value = ACTOR_HEADER, defaultValue = "system") String actor) {
        return ResponseEntity.ok(bookingOrchestrator.replaceServices(appointmentId, toLines(request.getServices()), actor)
                .map(AppointmentDto::from)
                .orElseThrow());
    }

    private static List<BookingLine> toLines(List<BookingLineRequest> requests) {
        return requests.stream()
                .map(line -> new BookingLine(
                        line.getServiceId(),
                        line.getStaffId(),
                        BookingTimeUtils.parseDateTime("start_time", line.getStartTime())))
                .toList();
    }
}
