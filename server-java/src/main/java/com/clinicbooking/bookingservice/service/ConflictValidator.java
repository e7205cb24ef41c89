package com.clinicbooking.bookingservice.service;

import com.clinicbooking.bookingservice.model.BookedService;
import com.clinicbooking.bookingservice.store.BookingLedger;
import com.clinicbooking.bookingservice.store.WorkingScheduleStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;

/**
 * Decides whether a staff member can take a proposed [start, end) range. Checks run in a
 * fixed order and the first failure wins:
 * <ol>
 *     <li>start in the past: {@code PAST_DATE}</li>
 *     <li>start not before end: {@code INVALID_RANGE}</li>
 *     <li>range not inside one working interval of the start date: {@code OUTSIDE_WORKING_HOURS}</li>
 *     <li>overlap with another active booking of the staff member: {@code DOUBLE_BOOKING}</li>
 * </ol>
 * Read-only; callers run it inside the transaction that performs the write.
 */
@Component
public class ConflictValidator {

    private final WorkingScheduleStore workingScheduleStore;
    private final BookingLedger bookingLedger;
    private final Clock clock;

    public ConflictValidator(WorkingScheduleStore workingScheduleStore,
                             BookingLedger bookingLedger,
                             Clock clock) {
        this.workingScheduleStore = workingScheduleStore;
        this.bookingLedger = bookingLedger;
        this.clock = clock;
    }

    public ValidationResult validate(Long staffId, LocalDateTime start, LocalDateTime end) {
        return validate(staffId, start, end, List.of());
    }

    public ValidationResult validate(Long staffId, LocalDateTime start, LocalDateTime end, Long excludedId) {
        return validate(staffId, start, end, excludedId == null ? List.of() : List.of(excludedId));
    }

    public ValidationResult validate(Long staffId,
                                     LocalDateTime start,
                                     LocalDateTime end,
                                     Collection<Long> excludedIds) {
        if (start == null || end == null) {
            return ValidationResult.rejected(BookingErrorCode.INVALID_RANGE, "Start and end time are required.");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (start.isBefore(now)) {
            return ValidationResult.rejected(BookingErrorCode.PAST_DATE,
                    "Cannot book an appointment in the past: " + start);
        }
        if (!start.isBefore(end)) {
            return ValidationResult.rejected(BookingErrorCode.INVALID_RANGE,
                    "Start time must be before end time.");
        }
        if (!withinWorkingHours(staffId, start, end)) {
            return ValidationResult.rejected(BookingErrorCode.OUTSIDE_WORKING_HOURS,
                    String.format("Staff member %d is not working between %s and %s.", staffId, start, end));
        }
        List<BookedService> conflicts = bookingLedger.findActiveOverlapping(staffId, start, end, excludedIds);
        if (!conflicts.isEmpty()) {
            BookedService first = conflicts.get(0);
            return ValidationResult.rejected(BookingErrorCode.DOUBLE_BOOKING,
                    String.format("Staff member %d is already booked from %s to %s.",
                            staffId, first.getStartTime(), first.getEndTime()));
        }
        return ValidationResult.ok();
    }

    private boolean withinWorkingHours(Long staffId, LocalDateTime start, LocalDateTime end) {
        // no booking may cross midnight
        if (!start.toLocalDate().equals(end.toLocalDate())) {
            return false;
        }
        LocalTime from = start.toLocalTime();
        LocalTime to = end.toLocalTime();
        return workingScheduleStore.findFor(staffId, start.toLocalDate()).stream()
                .anyMatch(interval -> interval.contains(from, to));
    }
}
