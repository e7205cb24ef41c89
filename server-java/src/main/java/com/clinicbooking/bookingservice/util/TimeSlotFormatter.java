package com.clinicbooking.bookingservice.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Display labels for slots, e.g. {@code 09:00 AM - 09:30 AM}.
 */
public final class TimeSlotFormatter {

    private static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("hh:mm a", Locale.US);

    private TimeSlotFormatter() {
    }

    public static String format(LocalDateTime start, LocalDateTime end) {
        return start.format(LABEL) + " - " + end.format(LABEL);
    }
}
