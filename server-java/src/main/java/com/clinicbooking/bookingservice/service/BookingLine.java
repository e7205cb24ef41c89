package com.clinicbooking.bookingservice.service;

import java.time.LocalDateTime;

/**
 * One requested (service, staff, start) unit of an appointment.
 */
public record BookingLine(Long serviceId, Long staffId, LocalDateTime start) {
}
