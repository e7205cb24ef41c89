package com.clinicbooking.bookingservice.controller;

import com.clinicbooking.bookingservice.dto.BulkScheduleRequest;
import com.clinicbooking.bookingservice.dto.StaffCalendarDto;
import com.clinicbooking.bookingservice.dto.WorkingScheduleDto;
import com.clinicbooking.bookingservice.dto.WorkingScheduleRequest;
import com.clinicbooking.bookingservice.service.ScheduleService;
import com.clinicbooking.bookingservice.util.BookingTimeUtils;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ScheduleController {

    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @PostMapping("/businesses/{businessId}/schedules")
    public ResponseEntity<WorkingScheduleDto> createSchedule(@PathVariable Long businessId,
                                                             @Valid @RequestBody WorkingScheduleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scheduleService.createSchedule(businessId, request));
    }

    @PostMapping("/businesses/{businessId}/schedules/bulk")
    public ResponseEntity<List<WorkingScheduleDto>> createSchedules(@PathVariable Long businessId,
                                                                    @Valid @RequestBody BulkScheduleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(scheduleService.createSchedules(businessId, request.getSchedules()));
    }

    @DeleteMapping("/schedules/{scheduleId}")
    public ResponseEntity<Void> deleteSchedule(@PathVariable Long scheduleId) {
        scheduleService.deleteSchedule(scheduleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/staff/{staffId}/calendar")
    public ResponseEntity<StaffCalendarDto> getCalendar(@PathVariable Long staffId,
                                                        @RequestParam String from,
                                                        @RequestParam String to) {
        return ResponseEntity.ok(scheduleService.getStaffCalendar(staffId,
                BookingTimeUtils.parseDate("from", from),
                BookingTimeUtils.parseDate("to", to)));
    }
}
