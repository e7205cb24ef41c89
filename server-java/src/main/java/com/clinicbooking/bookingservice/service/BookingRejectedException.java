package com.clinicbooking.bookingservice.service;

import lombok.Getter;

/**
 * Business-rule rejection. Thrown inside a transaction callback so the unit of work rolls
 * back, and by the catalog and schedule services directly to the web layer.
 */
@Getter
public class BookingRejectedException extends RuntimeException {

    private final BookingErrorCode code;

    public BookingRejectedException(BookingErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static BookingRejectedException notFound(String message) {
        return new BookingRejectedException(BookingErrorCode.NOT_FOUND, message);
    }

    public static BookingRejectedException invalidRequest(String message) {
        return new BookingRejectedException(BookingErrorCode.INVALID_REQUEST, message);
    }
}
