package com.clinicbooking.bookingservice.store;

import com.clinicbooking.bookingservice.model.Appointment;
import com.clinicbooking.bookingservice.model.AppointmentStatus;
import com.clinicbooking.bookingservice.model.BookedService;
import com.clinicbooking.bookingservice.model.BookingGuard;
import com.clinicbooking.bookingservice.repository.appointment.AppointmentRepository;
import com.clinicbooking.bookingservice.repository.appointment.BookedServiceRepository;
import com.clinicbooking.bookingservice.repository.schedule.BookingGuardRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Component
public class JpaBookingLedger implements BookingLedger {

    private static final Logger logger = LoggerFactory.getLogger(JpaBookingLedger.class);

    // JPQL "NOT IN ()" is not portable, so an id that can never exist stands in for "nothing excluded"
    private static final List<Long> NO_EXCLUSIONS = List.of(-1L);

    private final AppointmentRepository appointmentRepository;
    private final BookedServiceRepository bookedServiceRepository;
    private final BookingGuardRepository bookingGuardRepository;
    private final Clock clock;

    public JpaBookingLedger(AppointmentRepository appointmentRepository,
                            BookedServiceRepository bookedServiceRepository,
                            BookingGuardRepository bookingGuardRepository,
                            Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.bookedServiceRepository = bookedServiceRepository;
        this.bookingGuardRepository = bookingGuardRepository;
        this.clock = clock;
    }

    @Override
    public List<BookedService> findActiveOverlapping(Long staffId,
                                                     LocalDateTime start,
                                                     LocalDateTime end,
                                                     Collection<Long> excludedIds) {
        List<Long> excluded = excludedIds == null ? List.of() : excludedIds.stream()
                .filter(Objects::nonNull)
                .toList();
        return bookedServiceRepository.findActiveOverlapping(
                staffId,
                start,
                end,
                excluded.isEmpty() ? NO_EXCLUSIONS : excluded,
                AppointmentStatus.ACTIVE);
    }

    @Override
    public Optional<Appointment> findAppointment(Long appointmentId) {
        if (appointmentId == null) {
            return Optional.empty();
        }
        return appointmentRepository.findById(appointmentId);
    }

    @Override
    public Appointment save(Appointment appointment) {
        return appointmentRepository.save(appointment);
    }

    @Override
    public void deleteServices(Collection<BookedService> services) {
        bookedServiceRepository.deleteAll(services);
    }

    @Override
    public void touchGuard(Long staffId, LocalDate date) {
        BookingGuard guard = bookingGuardRepository.findByStaffIdAndGuardDate(staffId, date)
                .orElseGet(() -> new BookingGuard(staffId, date));
        guard.touch(LocalDateTime.now(clock));
        bookingGuardRepository.saveAndFlush(guard);
        logger.debug("[JpaBookingLedger] Guard touched for staff {} on {} (writes: {})",
                staffId, date, guard.getWriteCount());
    }

    @Override
    public void flush() {
        appointmentRepository.flush();
    }
}
