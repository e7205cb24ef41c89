package com.clinicbooking.bookingservice.event;

import java.time.LocalDateTime;

public record AppointmentEvent(Type type,
                               Long appointmentId,
                               Long businessId,
                               String actor,
                               String details,
                               LocalDateTime occurredAt) {

    public enum Type {
        CREATED,
        RESCHEDULED,
        STATUS_CHANGED,
        CANCELLED,
        SERVICES_REPLACED
    }
}
