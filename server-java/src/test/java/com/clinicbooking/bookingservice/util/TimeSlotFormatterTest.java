package com.clinicbooking.bookingservice.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class TimeSlotFormatterTest {

    @Test
    void formatsTwelveHourLabels() {
        assertThat(TimeSlotFormatter.format(
                LocalDateTime.of(2024, 6, 10, 9, 0),
                LocalDateTime.of(2024, 6, 10, 9, 30)))
                .isEqualTo("09:00 AM - 09:30 AM");
        assertThat(TimeSlotFormatter.format(
                LocalDateTime.of(2024, 6, 10, 11, 45),
                LocalDateTime.of(2024, 6, 10, 13, 15)))
                .isEqualTo("11:45 AM - 01:15 PM");
    }
}
