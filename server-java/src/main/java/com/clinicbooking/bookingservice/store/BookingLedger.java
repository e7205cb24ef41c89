package com.clinicbooking.bookingservice.store;

import com.clinicbooking.bookingservice.model.Appointment;
import com.clinicbooking.bookingservice.model.BookedService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of appointments and their booked service units. All methods are expected
 * to run inside the caller's transaction.
 */
public interface BookingLedger {

    /**
     * Booked services of the staff member whose parent appointment is active and whose
     * range overlaps [start, end), ignoring the ids in {@code excludedIds}.
     */
    List<BookedService> findActiveOverlapping(Long staffId,
                                              LocalDateTime start,
                                              LocalDateTime end,
                                              Collection<Long> excludedIds);

    Optional<Appointment> findAppointment(Long appointmentId);

    Appointment save(Appointment appointment);

    void deleteServices(Collection<BookedService> services);

    /**
     * Bumps the versioned guard row of (staff, date), creating it on first use.
     */
    void touchGuard(Long staffId, LocalDate date);

    void flush();
}
