package com.clinicbooking.bookingservice.service;

public record ValidationResult(BookingErrorCode errorCode, String message) {

    private static final ValidationResult OK = new ValidationResult(null, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult rejected(BookingErrorCode errorCode, String message) {
        return new ValidationResult(errorCode, message);
    }

    public boolean isOk() {
        return errorCode == null;
    }

    public void throwIfRejected() {
        if (!isOk()) {
            throw new BookingRejectedException(errorCode, message);
        }
    }
}
