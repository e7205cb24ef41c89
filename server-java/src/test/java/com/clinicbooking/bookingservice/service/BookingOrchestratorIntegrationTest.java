package com.clinicbooking.bookingservice.service;

import com.clinicbooking.bookingservice.dto.BusinessDto;
import com.clinicbooking.bookingservice.dto.BusinessRequest;
import com.clinicbooking.bookingservice.dto.ServiceOfferingRequest;
import com.clinicbooking.bookingservice.dto.WorkingScheduleRequest;
import com.clinicbooking.bookingservice.dto.StaffRequest;
import com.clinicbooking.bookingservice.event.AppointmentEvent;
import com.clinicbooking.bookingservice.event.AppointmentNotifier;
import com.clinicbooking.bookingservice.model.Appointment;
import com.clinicbooking.bookingservice.model.AppointmentStatus;
import com.clinicbooking.bookingservice.model.BookedService;
import com.clinicbooking.bookingservice.repository.BusinessRepository;
import com.clinicbooking.bookingservice.repository.ServiceOfferingRepository;
import com.clinicbooking.bookingservice.repository.UserRepository;
import com.clinicbooking.bookingservice.repository.appointment.AppointmentRepository;
import com.clinicbooking.bookingservice.repository.schedule.BookingGuardRepository;
import com.clinicbooking.bookingservice.repository.schedule.WorkingScheduleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@SpringBootTest
class BookingOrchestratorIntegrationTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 10);

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(Instant.parse("2024-06-01T08:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private BookingOrchestrator bookingOrchestrator;

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private ScheduleService scheduleService;

    @Autowired
    private SlotGenerator slotGenerator;

    @Autowired
    private AppointmentRepository appointmentRepository;

    @Autowired
    private WorkingScheduleRepository workingScheduleRepository;

    @Autowired
    private BookingGuardRepository bookingGuardRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ServiceOfferingRepository serviceOfferingRepository;

    @Autowired
    private BusinessRepository businessRepository;

    @MockBean
    private AppointmentNotifier appointmentNotifier;

    private Long businessId;
    private Long serviceId;
    private Long staffId;

    @BeforeEach
    void cleanDatabase() {
        appointmentRepository.deleteAll();
        bookingGuardRepository.deleteAll();
        workingScheduleRepository.deleteAll();
        userRepository.deleteAll();
        serviceOfferingRepository.deleteAll();
        businessRepository.deleteAll();

        BusinessDto business = catalogService.createBusiness(new BusinessRequest("Downtown Clinic", "Main St 1", "555-0100"));
        businessId = business.getId();
        serviceId = catalogService.createService(businessId,
                new ServiceOfferingRequest("Consultation", null, 30, new BigDecimal("50.00"), null, null)).getId();
        staffId = catalogService.createStaff(businessId, new StaffRequest("anna@clinic.example", "Anna", null)).getId();
        scheduleService.createSchedule(businessId, new WorkingScheduleRequest(staffId, DAY.toString(), "09:00", "12:00"));
    }

    @Test
    void concurrentBookingsOfSameSlotLetExactlyOneWin() throws Exception {
        int writers = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        List<Future<BookingResult<Appointment>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                String client = "Client " + i;
                Callable<BookingResult<Appointment>> task = () -> {
                    start.await();
                    return bookingOrchestrator.createAppointment(
                            businessId, staffId, serviceId, DAY.atTime(9, 0), client, "", null, client);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            List<BookingResult<Appointment>> results = new ArrayList<>();
            for (Future<BookingResult<Appointment>> future : futures) {
                results.add(future.get(60, TimeUnit.SECONDS));
            }

            assertThat(results).filteredOn(BookingResult::isSuccess).hasSize(1);
            assertThat(results).filteredOn(result -> !result.isSuccess())
                    .extracting(BookingResult::errorCode)
                    .containsOnly(BookingErrorCode.DOUBLE_BOOKING);
            assertThat(appointmentRepository.count()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void committedBookingIsAnnouncedAndRejectedOneIsNot() {
        BookingResult<Appointment> first = bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(9, 0), "Jane", "", null, "frontdesk");
        BookingResult<Appointment> second = bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(9, 15), "John", "", null, "frontdesk");

        assertThat(first.isSuccess()).isTrue();
        assertThat(second.errorCode()).isEqualTo(BookingErrorCode.DOUBLE_BOOKING);
        verify(appointmentNotifier, times(1)).notify(any(AppointmentEvent.class));
    }

    @Test
    void cancellationFreesTheSlot() {
        Appointment booked = bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(10, 0), "Jane", "", null, "frontdesk").orElseThrow();

        assertThat(bookingOrchestrator.cancelAppointment(booked.getId(), "moved away", "client").isSuccess()).isTrue();
        BookingResult<Appointment> rebooked = bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(10, 0), "John", "", null, "frontdesk");

        assertThat(rebooked.isSuccess()).isTrue();
        Appointment cancelled = bookingOrchestrator.getAppointment(booked.getId()).orElseThrow();
        assertThat(cancelled.getStatus()).isEqualTo(AppointmentStatus.CANCELLED);
        assertThat(cancelled.getCancellationReason()).isEqualTo("moved away");
    }

    @Test
    void collidingRescheduleKeepsOriginalTime() {
        Appointment first = bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(9, 0), "Jane", "", null, "frontdesk").orElseThrow();
        bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(10, 0), "John", "", null, "frontdesk").orElseThrow();

        BookingResult<Appointment> moved = bookingOrchestrator.rescheduleAppointment(first.getId(), DAY.atTime(10, 0), null, "frontdesk");

        assertThat(moved.errorCode()).isEqualTo(BookingErrorCode.DOUBLE_BOOKING);
        Appointment reloaded = bookingOrchestrator.getAppointment(first.getId()).orElseThrow();
        assertThat(reloaded.getFirstService()).map(BookedService::getStartTime).contains(DAY.atTime(9, 0));
    }

    @Test
    void rescheduleMayOverlapItsOwnPreviousSlot() {
        Appointment booked = bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(9, 0), "Jane", "", null, "frontdesk").orElseThrow();

        BookingResult<Appointment> moved = bookingOrchestrator.rescheduleAppointment(booked.getId(), DAY.atTime(9, 15), "late", "client");

        assertThat(moved.isSuccess()).isTrue();
        Appointment reloaded = bookingOrchestrator.getAppointment(booked.getId()).orElseThrow();
        assertThat(reloaded.getServices()).singleElement()
                .satisfies(service -> {
                    assertThat(service.getStartTime()).isEqualTo(DAY.atTime(9, 15));
                    assertThat(service.getEndTime()).isEqualTo(DAY.atTime(9, 45));
                });
    }

    @Test
    void bookedTimeDisappearsFromAvailableSlots() {
        bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(9, 0), "Jane", "", null, "frontdesk").orElseThrow();

        List<TimeSlot> slots = slotGenerator.generateForBusiness(businessId, serviceId, DAY, null).orElseThrow();

        assertThat(slots).extracting(TimeSlot::start).containsExactly(
                DAY.atTime(9, 30), DAY.atTime(10, 0), DAY.atTime(10, 30), DAY.atTime(11, 0), DAY.atTime(11, 30));
        assertThat(slots).extracting(TimeSlot::staffName).containsOnly("Anna");
    }

    @Test
    void overlappingSchedulesAreRejectedAsAWholeBatch() {
        assertThatThrownBy(() -> scheduleService.createSchedule(businessId,
                new WorkingScheduleRequest(staffId, DAY.toString(), "11:00", "14:00")))
                .isInstanceOf(BookingRejectedException.class)
                .extracting("code")
                .isEqualTo(BookingErrorCode.SCHEDULE_OVERLAP);

        LocalDate nextDay = DAY.plusDays(1);
        assertThatThrownBy(() -> scheduleService.createSchedules(businessId, List.of(
                new WorkingScheduleRequest(staffId, nextDay.toString(), "09:00", "12:00"),
                new WorkingScheduleRequest(staffId, nextDay.toString(), "11:00", "15:00"))))
                .isInstanceOf(BookingRejectedException.class)
                .extracting("code")
                .isEqualTo(BookingErrorCode.SCHEDULE_OVERLAP);
        assertThat(workingScheduleRepository.findByStaffIdAndWorkDateOrderByStartTimeAsc(staffId, nextDay)).isEmpty();
    }

    @Test
    void deletingStaffKeepsBookingHistory() {
        Appointment booked = bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(9, 0), "Jane", "", null, "frontdesk").orElseThrow();

        catalogService.deleteStaff(staffId);

        Appointment reloaded = bookingOrchestrator.getAppointment(booked.getId()).orElseThrow();
        assertThat(reloaded.getServices()).singleElement()
                .satisfies(service -> assertThat(service.getStaffId()).isNull());
        assertThat(workingScheduleRepository.findByStaffIdAndWorkDateOrderByStartTimeAsc(staffId, DAY)).isEmpty();
        assertThat(bookingOrchestrator.rescheduleAppointment(booked.getId(), DAY.atTime(10, 0), null, "x").errorCode())
                .isEqualTo(BookingErrorCode.NOT_FOUND);
    }

    @Test
    void serviceDurationBoundsAreEnforced() {
        assertThatThrownBy(() -> catalogService.createService(businessId,
                new ServiceOfferingRequest("Too short", null, 14, BigDecimal.ONE, null, null)))
                .isInstanceOf(BookingRejectedException.class);
        assertThat(catalogService.createService(businessId,
                new ServiceOfferingRequest("Full day", null, 480, BigDecimal.ONE, null, null)).getDurationMinutes())
                .isEqualTo(480);
    }

    @Test
    void outsideWorkingHoursIsRejected() {
        BookingResult<Appointment> result = bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(11, 45), "Jane", "", null, "frontdesk");

        assertThat(result.errorCode()).isEqualTo(BookingErrorCode.OUTSIDE_WORKING_HOURS);
        verify(appointmentNotifier, never()).notify(any(AppointmentEvent.class));
    }

    @Test
    void scheduleHoldingActiveBookingCannotBeDeletedUntilCancelled() {
        Appointment booked = bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(9, 0), "Jane", "", null, "frontdesk").orElseThrow();
        Long scheduleId = workingScheduleRepository.findByStaffIdAndWorkDateOrderByStartTimeAsc(staffId, DAY)
                .get(0).getId();

        assertThatThrownBy(() -> scheduleService.deleteSchedule(scheduleId))
                .isInstanceOf(BookingRejectedException.class)
                .extracting("code")
                .isEqualTo(BookingErrorCode.SCHEDULE_IN_USE);
        assertThat(workingScheduleRepository.findById(scheduleId)).isPresent();

        bookingOrchestrator.cancelAppointment(booked.getId(), null, "frontdesk").orElseThrow();
        scheduleService.deleteSchedule(scheduleId);

        assertThat(workingScheduleRepository.findById(scheduleId)).isEmpty();
    }

    @Test
    void writeTimestampsComeFromTheBusinessClock() {
        Appointment booked = bookingOrchestrator.createAppointment(
                businessId, staffId, serviceId, DAY.atTime(9, 0), "Jane", "", null, "frontdesk").orElseThrow();

        Appointment reloaded = bookingOrchestrator.getAppointment(booked.getId()).orElseThrow();
        assertThat(reloaded.getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 6, 1, 8, 0));
        assertThat(reloaded.getUpdatedAt()).isEqualTo(LocalDateTime.of(2024, 6, 1, 8, 0));
        assertThat(businessRepository.findById(businessId).orElseThrow().getCreatedAt())
                .isEqualTo(LocalDateTime.of(2024, 6, 1, 8, 0));
    }
}
