package com.clinicbooking.bookingservice.dto;

import com.clinicbooking.bookingservice.model.AppointmentStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Working windows and booked services of one staff member over a date range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StaffCalendarDto {

    @JsonProperty("staff_id")
    private Long staffId;

    @JsonProperty("staff_name")
    private String staffName;

    private LocalDate from;
    private LocalDate to;

    private List<WorkingScheduleDto> schedules;

    private List<Entry> bookings;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {

        @JsonProperty("appointment_id")
        private Long appointmentId;

        @JsonProperty("client_name")
        private String clientName;

        private AppointmentStatus status;

        @JsonProperty("service_name")
        private String serviceName;

        @JsonProperty("start_time")
        private LocalDateTime startTime;

        @JsonProperty("end_time")
        private LocalDateTime endTime;
    }
}
