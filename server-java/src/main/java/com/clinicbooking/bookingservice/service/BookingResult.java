package com.clinicbooking.bookingservice.service;

import java.util.function.Function;

/**
 * Outcome of a booking operation: either a value or an error code with a message.
 */
public record BookingResult<T>(T value, BookingErrorCode errorCode, String message) {

    public static <T> BookingResult<T> success(T value) {
        return new BookingResult<>(value, null, null);
    }

    public static <T> BookingResult<T> failure(BookingErrorCode errorCode, String message) {
        return new BookingResult<>(null, errorCode, message);
    }

    public static <T> BookingResult<T> failure(BookingRejectedException e) {
        return failure(e.getCode(), e.getMessage());
    }

    public boolean isSuccess() {
        return errorCode == null;
    }

    public boolean isRetryable() {
        return errorCode != null && errorCode.isRetryable();
    }

    public <R> BookingResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(errorCode, message);
    }

    /**
     * Unwraps the value, rethrowing the failure as a {@link BookingRejectedException}.
     */
    public T orElseThrow() {
        if (!isSuccess()) {
            throw new BookingRejectedException(errorCode, message);
        }
        return value;
    }
}
