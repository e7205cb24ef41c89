package com.clinicbooking.bookingservice.service;

import com.clinicbooking.bookingservice.model.BookedService;
import com.clinicbooking.bookingservice.model.ServiceOffering;
import com.clinicbooking.bookingservice.model.User;
import com.clinicbooking.bookingservice.repository.ServiceOfferingRepository;
import com.clinicbooking.bookingservice.repository.UserRepository;
import com.clinicbooking.bookingservice.store.BookingLedger;
import com.clinicbooking.bookingservice.store.WorkingInterval;
import com.clinicbooking.bookingservice.store.WorkingScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SlotGeneratorTest {

    private static final Long BUSINESS_ID = 1L;
    private static final LocalDate DAY = LocalDate.of(2024, 6, 10);

    @Mock
    private WorkingScheduleStore workingScheduleStore;

    @Mock
    private BookingLedger bookingLedger;

    @Mock
    private ServiceOfferingRepository serviceOfferingRepository;

    @Mock
    private UserRepository userRepository;

    private SlotGenerator slotGenerator;
    private User staff;

    @BeforeEach
    void setUp() {
        slotGenerator = generatorAt("2024-06-01T08:00:00Z");
        staff = staff(20L, "Anna");
        when(bookingLedger.findActiveOverlapping(anyLong(), any(), any(), any())).thenReturn(List.of());
        when(workingScheduleStore.findFor(20L, DAY)).thenReturn(List.of(
                new WorkingInterval(LocalTime.of(9, 0), LocalTime.of(12, 0))));
    }

    @Test
    void emitsThirtyMinuteStepsUpToTheLastStartThatFits() {
        List<TimeSlot> slots = slotGenerator.generate(staff, service(30), DAY);

        assertThat(slots).extracting(slot -> slot.start().toLocalTime()).containsExactly(
                LocalTime.of(9, 0), LocalTime.of(9, 30), LocalTime.of(10, 0),
                LocalTime.of(10, 30), LocalTime.of(11, 0), LocalTime.of(11, 30));
        assertThat(slots.get(5).end()).isEqualTo(DAY.atTime(12, 0));
        assertThat(slots.get(0).label()).isEqualTo("09:00 AM - 09:30 AM");
        assertThat(slots.get(0).staffName()).isEqualTo("Anna");
    }

    @Test
    void longerServicesStillStepByThirtyMinutesAndMayOverlap() {
        BookedService booked = new BookedService();
        booked.setStartTime(DAY.atTime(10, 0));
        booked.setEndTime(DAY.atTime(10, 30));
        when(bookingLedger.findActiveOverlapping(eq(20L), any(), any(), any())).thenReturn(List.of(booked));

        List<TimeSlot> slots = slotGenerator.generate(staff, service(60), DAY);

        assertThat(slots).extracting(slot -> slot.start().toLocalTime()).containsExactly(
                LocalTime.of(9, 0), LocalTime.of(10, 30), LocalTime.of(11, 0));
    }

    @Test
    void walksEachWorkingIntervalSeparately() {
        when(workingScheduleStore.findFor(20L, DAY)).thenReturn(List.of(
                new WorkingInterval(LocalTime.of(14, 0), LocalTime.of(15, 0)),
                new WorkingInterval(LocalTime.of(9, 0), LocalTime.of(10, 0))));

        List<TimeSlot> slots = slotGenerator.generate(staff, service(45), DAY);

        assertThat(slots).extracting(TimeSlot::start).containsExactly(DAY.atTime(9, 0), DAY.atTime(14, 0));
    }

    @Test
    void skipsSlotsThatAlreadyStarted() {
        slotGenerator = generatorAt("2024-06-10T10:10:00Z");

        List<TimeSlot> slots = slotGenerator.generate(staff, service(30), DAY);

        assertThat(slots).extracting(slot -> slot.start().toLocalTime()).containsExactly(
                LocalTime.of(10, 30), LocalTime.of(11, 0), LocalTime.of(11, 30));
    }

    @Test
    void noScheduleMeansNoSlots() {
        assertThat(slotGenerator.generate(staff, service(30), DAY.plusDays(1))).isEmpty();
    }

    @Test
    void businessSlotsAreOrderedByStartThenStaffName() {
        User zoe = staff(21L, "Zoe");
        User adam = staff(22L, "Adam");
        ServiceOffering service = service(30);
        when(serviceOfferingRepository.findByIdAndBusinessId(10L, BUSINESS_ID)).thenReturn(Optional.of(service));
        when(userRepository.findByBusinessIdAndRoleAndActiveTrue(BUSINESS_ID, User.ROLE_STAFF)).thenReturn(List.of(zoe, adam));
        List<WorkingInterval> morning = List.of(new WorkingInterval(LocalTime.of(9, 0), LocalTime.of(10, 0)));
        when(workingScheduleStore.findFor(21L, DAY)).thenReturn(morning);
        when(workingScheduleStore.findFor(22L, DAY)).thenReturn(morning);

        BookingResult<List<TimeSlot>> result = slotGenerator.generateForBusiness(BUSINESS_ID, 10L, DAY, null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).extracting(slot -> slot.start().toLocalTime(), TimeSlot::staffName).containsExactly(
                tuple(LocalTime.of(9, 0), "Adam"),
                tuple(LocalTime.of(9, 0), "Zoe"),
                tuple(LocalTime.of(9, 30), "Adam"),
                tuple(LocalTime.of(9, 30), "Zoe"));
    }

    @Test
    void businessSlotsCanBeNarrowedToOneStaffMember() {
        when(serviceOfferingRepository.findByIdAndBusinessId(10L, BUSINESS_ID)).thenReturn(Optional.of(service(30)));
        when(userRepository.findByBusinessIdAndRoleAndActiveTrue(BUSINESS_ID, User.ROLE_STAFF)).thenReturn(List.of(staff));

        assertThat(slotGenerator.generateForBusiness(BUSINESS_ID, 10L, DAY, 20L).value()).hasSize(6);
        assertThat(slotGenerator.generateForBusiness(BUSINESS_ID, 10L, DAY, 99L).errorCode())
                .isEqualTo(BookingErrorCode.NOT_FOUND);
    }

    @Test
    void unknownServiceOrStaffIsNotFound() {
        when(userRepository.findById(20L)).thenReturn(Optional.of(staff));
        when(serviceOfferingRepository.findByIdAndBusinessId(77L, BUSINESS_ID)).thenReturn(Optional.empty());

        assertThat(slotGenerator.getAvailableSlots(20L, 77L, DAY).errorCode()).isEqualTo(BookingErrorCode.NOT_FOUND);
        assertThat(slotGenerator.getAvailableSlots(404L, 10L, DAY).errorCode()).isEqualTo(BookingErrorCode.NOT_FOUND);
        assertThat(slotGenerator.generateForBusiness(BUSINESS_ID, 77L, DAY, null).errorCode())
                .isEqualTo(BookingErrorCode.NOT_FOUND);
    }

    @Test
    void availableSlotsForSingleStaffMember() {
        when(userRepository.findById(20L)).thenReturn(Optional.of(staff));
        when(serviceOfferingRepository.findByIdAndBusinessId(10L, BUSINESS_ID)).thenReturn(Optional.of(service(30)));

        BookingResult<List<TimeSlot>> result = slotGenerator.getAvailableSlots(20L, 10L, DAY);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).hasSize(6);
        assertThat(result.value()).noneMatch(slot -> slot.start().equals(LocalDateTime.of(DAY, LocalTime.NOON)));
    }

    private SlotGenerator generatorAt(String instant) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        return new SlotGenerator(workingScheduleStore, bookingLedger, serviceOfferingRepository, userRepository, clock);
    }

    private static User staff(Long id, String name) {
        User user = new User();
        user.setId(id);
        user.setName(name);
        user.setEmail(name.toLowerCase() + "@clinic.example");
        user.setRole(User.ROLE_STAFF);
        user.setBusinessId(BUSINESS_ID);
        user.setActive(true);
        return user;
    }

    private static ServiceOffering service(int minutes) {
        ServiceOffering service = new ServiceOffering();
        service.setId(10L);
        service.setBusinessId(BUSINESS_ID);
        service.setName("Service " + minutes);
        service.setDurationMinutes(minutes);
        service.setPrice(new BigDecimal("50.00"));
        return service;
    }
}
