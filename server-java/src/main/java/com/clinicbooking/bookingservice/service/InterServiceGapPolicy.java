package com.clinicbooking.bookingservice.service;

import com.clinicbooking.bookingservice.model.BookedService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * Optional limit on the idle time between consecutive services of one appointment.
 * Disabled when the configured limit is zero or negative.
 */
@Component
public class InterServiceGapPolicy {

    private final Duration maxGap;

    public InterServiceGapPolicy(@Value("${booking.policy.max-service-gap-minutes:0}") long maxGapMinutes) {
        this.maxGap = maxGapMinutes > 0 ? Duration.ofMinutes(maxGapMinutes) : null;
    }

    public boolean isEnabled() {
        return maxGap != null;
    }

    public ValidationResult check(List<BookedService> services) {
        if (!isEnabled() || services.size() < 2) {
            return ValidationResult.ok();
        }
        List<BookedService> ordered = services.stream()
                .sorted(Comparator.comparing(BookedService::getStartTime))
                .toList();
        for (int i = 1; i < ordered.size(); i++) {
            Duration gap = Duration.between(ordered.get(i - 1).getEndTime(), ordered.get(i).getStartTime());
            if (gap.compareTo(maxGap) > 0) {
                return ValidationResult.rejected(BookingErrorCode.GAP_TOO_LARGE,
                        String.format("Gap of %d minutes between services exceeds the allowed %d minutes.",
                                gap.toMinutes(), maxGap.toMinutes()));
            }
        }
        return ValidationResult.ok();
    }
}
