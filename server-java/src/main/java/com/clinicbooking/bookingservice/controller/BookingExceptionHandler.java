package com.clinicbooking.bookingservice.controller;

import com.clinicbooking.bookingservice.service.BookingErrorCode;
import com.clinicbooking.bookingservice.service.BookingRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class BookingExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(BookingExceptionHandler.class);

    @ExceptionHandler(BookingRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleRejection(BookingRejectedException e) {
        return body(statusFor(e.getCode()), e.getCode().name(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(BookingExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return body(HttpStatus.BAD_REQUEST, BookingErrorCode.INVALID_REQUEST.name(),
                message.isEmpty() ? "Invalid request body." : message);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<Map<String, Object>> handleUnreadableRequest(Exception e) {
        return body(HttpStatus.BAD_REQUEST, BookingErrorCode.INVALID_REQUEST.name(), e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        logger.error("[BookingExceptionHandler] Unhandled exception", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error.");
    }

    static HttpStatus statusFor(BookingErrorCode code) {
        return switch (code) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DOUBLE_BOOKING, SCHEDULE_OVERLAP, SCHEDULE_IN_USE, TERMINAL_STATE, INVALID_TRANSITION -> HttpStatus.CONFLICT;
            case STORAGE_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("status", status.value());
        return ResponseEntity.status(status).body(response);
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }
}
