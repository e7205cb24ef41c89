package com.clinicbooking.bookingservice.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class AppointmentTest {

    @Test
    void totalPriceIsTheSumOfBookedServicePrices() {
        Appointment appointment = new Appointment();
        appointment.addService(booked("45.00", LocalDateTime.of(2024, 6, 10, 9, 0)));
        appointment.addService(booked("30.50", LocalDateTime.of(2024, 6, 10, 9, 30)));

        assertThat(appointment.recalculateTotalPrice()).isEqualByComparingTo("75.50");
        assertThat(appointment.getTotalPrice()).isEqualByComparingTo("75.50");

        appointment.clearServices();
        assertThat(appointment.recalculateTotalPrice()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void bookedServiceCopiesDurationAndPriceFromTheOffering() {
        ServiceOffering offering = new ServiceOffering();
        offering.setId(3L);
        offering.setName("Massage");
        offering.setDurationMinutes(45);
        offering.setPrice(new BigDecimal("60.00"));

        BookedService booked = BookedService.of(offering, 8L, LocalDateTime.of(2024, 6, 10, 13, 0));

        assertThat(booked.getEndTime()).isEqualTo(LocalDateTime.of(2024, 6, 10, 13, 45));
        assertThat(booked.getPrice()).isEqualByComparingTo("60.00");
        assertThat(booked.getServiceName()).isEqualTo("Massage");
        assertThat(booked.overlaps(LocalDateTime.of(2024, 6, 10, 13, 45), LocalDateTime.of(2024, 6, 10, 14, 0))).isFalse();
        assertThat(booked.overlaps(LocalDateTime.of(2024, 6, 10, 13, 30), LocalDateTime.of(2024, 6, 10, 14, 0))).isTrue();
    }

    private static BookedService booked(String price, LocalDateTime start) {
        BookedService service = new BookedService();
        service.setStartTime(start);
        service.setEndTime(start.plusMinutes(30));
        service.setPrice(new BigDecimal(price));
        return service;
    }
}
