package com.clinicbooking.bookingservice.service;

public enum BookingErrorCode {
    PAST_DATE,
    INVALID_RANGE,
    OUTSIDE_WORKING_HOURS,
    DOUBLE_BOOKING,
    INVALID_TRANSITION,
    TERMINAL_STATE,
    NOT_FOUND,
    SCHEDULE_OVERLAP,
    SCHEDULE_IN_USE,
    GAP_TOO_LARGE,
    INVALID_REQUEST,
    STORAGE_FAILURE;

    public boolean isRetryable() {
        return this == STORAGE_FAILURE;
    }
}
