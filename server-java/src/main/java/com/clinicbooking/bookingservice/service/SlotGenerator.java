package com.clinicbooking.bookingservice.service;

import com.clinicbooking.bookingservice.model.BookedService;
import com.clinicbooking.bookingservice.model.ServiceOffering;
import com.clinicbooking.bookingservice.model.User;
import com.clinicbooking.bookingservice.repository.ServiceOfferingRepository;
import com.clinicbooking.bookingservice.repository.UserRepository;
import com.clinicbooking.bookingservice.store.BookingLedger;
import com.clinicbooking.bookingservice.store.WorkingInterval;
import com.clinicbooking.bookingservice.store.WorkingScheduleStore;
import com.clinicbooking.bookingservice.util.TimeSlotFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Produces bookable candidate slots for a service. The cursor walks each working interval
 * in fixed 30 minute steps; a candidate is emitted when it ends inside the interval and does
 * not overlap an active booking of the staff member. Candidates may overlap each other.
 */
@Service
public class SlotGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SlotGenerator.class);

    public static final Duration SLOT_STEP = Duration.ofMinutes(30);

    private final WorkingScheduleStore workingScheduleStore;
    private final BookingLedger bookingLedger;
    private final ServiceOfferingRepository serviceOfferingRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    public SlotGenerator(WorkingScheduleStore workingScheduleStore,
                         BookingLedger bookingLedger,
                         ServiceOfferingRepository serviceOfferingRepository,
                         UserRepository userRepository,
                         Clock clock) {
        this.workingScheduleStore = workingScheduleStore;
        this.bookingLedger = bookingLedger;
        this.serviceOfferingRepository = serviceOfferingRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Transactional(value = "bookingTransactionManager", readOnly = true)
    public BookingResult<List<TimeSlot>> getAvailableSlots(Long staffId, Long serviceId, LocalDate date) {
        if (date == null) {
            return BookingResult.failure(BookingErrorCode.INVALID_REQUEST, "A date is required.");
        }
        User staff = userRepository.findById(staffId == null ? -1L : staffId)
                .filter(User::isBookable)
                .orElse(null);
        if (staff == null) {
            return BookingResult.failure(BookingErrorCode.NOT_FOUND, "Staff member not found: " + staffId);
        }
        ServiceOffering service = serviceOfferingRepository.findByIdAndBusinessId(serviceId, staff.getBusinessId())
                .orElse(null);
        if (service == null) {
            return BookingResult.failure(BookingErrorCode.NOT_FOUND, "Service not found: " + serviceId);
        }
        return BookingResult.success(generate(staff, service, date));
    }

    /**
     * Slots across every bookable staff member of the business (or only {@code staffId} when
     * given), ordered by start time and then staff display name.
     */
    @Transactional(value = "bookingTransactionManager", readOnly = true)
    public BookingResult<List<TimeSlot>> generateForBusiness(Long businessId, Long serviceId, LocalDate date, Long staffId) {
        if (date == null) {
            return BookingResult.failure(BookingErrorCode.INVALID_REQUEST, "A date is required.");
        }
        ServiceOffering service = serviceOfferingRepository.findByIdAndBusinessId(serviceId, businessId).orElse(null);
        if (service == null) {
            return BookingResult.failure(BookingErrorCode.NOT_FOUND, "Service not found: " + serviceId);
        }

        List<User> staffMembers = userRepository.findByBusinessIdAndRoleAndActiveTrue(businessId, User.ROLE_STAFF);
        if (staffId != null) {
            staffMembers = staffMembers.stream().filter(staff -> staffId.equals(staff.getId())).toList();
            if (staffMembers.isEmpty()) {
                return BookingResult.failure(BookingErrorCode.NOT_FOUND, "Staff member not found: " + staffId);
            }
        }

        List<TimeSlot> slots = new ArrayList<>();
        for (User staff : staffMembers) {
            slots.addAll(generate(staff, service, date));
        }
        slots.sort(Comparator.comparing(TimeSlot::start)
                .thenComparing(TimeSlot::staffName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)));
        logger.debug("[SlotGenerator] {} slots for service {} on {} across {} staff",
                slots.size(), serviceId, date, staffMembers.size());
        return BookingResult.success(slots);
    }

    public List<TimeSlot> generate(User staff, ServiceOffering service, LocalDate date) {
        List<WorkingInterval> intervals = workingScheduleStore.findFor(staff.getId(), date);
        if (intervals.isEmpty()) {
            return List.of();
        }
        Duration duration = service.getDuration();
        LocalDateTime now = LocalDateTime.now(clock);
        List<BookedService> booked = bookingLedger.findActiveOverlapping(
                staff.getId(), date.atStartOfDay(), date.plusDays(1).atStartOfDay(), List.of());

        List<TimeSlot> slots = new ArrayList<>();
        intervals.stream()
                .sorted(Comparator.comparing(WorkingInterval::start))
                .forEach(interval -> {
                    LocalDateTime intervalEnd = date.atTime(interval.end());
                    for (LocalDateTime cursor = date.atTime(interval.start());
                         cursor.isBefore(intervalEnd);
                         cursor = cursor.plus(SLOT_STEP)) {
                        LocalDateTime candidateEnd = cursor.plus(duration);
                        if (candidateEnd.isAfter(intervalEnd) || cursor.isBefore(now)) {
                            continue;
                        }
                        if (overlapsAny(booked, cursor, candidateEnd)) {
                            continue;
                        }
                        slots.add(new TimeSlot(cursor, candidateEnd, staff.getId(), staff.getDisplayName(),
                                TimeSlotFormatter.format(cursor, candidateEnd)));
                    }
                });
        return slots;
    }

    private static boolean overlapsAny(List<BookedService> booked, LocalDateTime start, LocalDateTime end) {
        return booked.stream().anyMatch(existing -> existing.overlaps(start, end));
    }
}
