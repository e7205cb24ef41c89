package com.clinicbooking.bookingservice.util;

import com.clinicbooking.bookingservice.service.BookingRejectedException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parsing helpers for the date and time strings clients send.
 */
public final class BookingTimeUtils {

    private static final DateTimeFormatter[] DATE_TIME_FORMATS = new DateTimeFormatter[] {
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
    };

    private BookingTimeUtils() {
    }

    public static LocalDateTime parseDateTime(String field, String value) {
        requirePresent(field, value);
        for (DateTimeFormatter formatter : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(value.trim(), formatter);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        throw BookingRejectedException.invalidRequest(
                "Invalid " + field + ": '" + value + "' (expected e.g. 2024-06-10T09:00)");
    }

    public static LocalDate parseDate(String field, String value) {
        requirePresent(field, value);
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw BookingRejectedException.invalidRequest(
                    "Invalid " + field + ": '" + value + "' (expected e.g. 2024-06-10)");
        }
    }

    public static LocalTime parseTime(String field, String value) {
        requirePresent(field, value);
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw BookingRejectedException.invalidRequest(
                    "Invalid " + field + ": '" + value + "' (expected e.g. 09:00)");
        }
    }

    private static void requirePresent(String field, String value) {
        if (value == null || value.isBlank()) {
            throw BookingRejectedException.invalidRequest(field + " is required.");
        }
    }
}
