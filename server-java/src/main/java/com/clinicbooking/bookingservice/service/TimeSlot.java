package com.clinicbooking.bookingservice.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record TimeSlot(LocalDateTime start,
                       LocalDateTime end,
                       @JsonProperty("staff_id") Long staffId,
                       @JsonProperty("staff_name") String staffName,
                       String label) {
}
