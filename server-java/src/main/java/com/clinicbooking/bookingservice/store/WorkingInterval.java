package com.clinicbooking.bookingservice.store;

import java.time.LocalTime;

/**
 * Half-open working window [start, end) on a single calendar date.
 */
public record WorkingInterval(LocalTime start, LocalTime end) {

    public boolean contains(LocalTime from, LocalTime to) {
        return !start.isAfter(from) && !end.isBefore(to);
    }
}
