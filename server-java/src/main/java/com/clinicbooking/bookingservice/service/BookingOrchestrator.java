package com.clinicbooking.bookingservice.service;

import com.clinicbooking.bookingservice.event.AppointmentEvent;
import com.clinicbooking.bookingservice.model.Appointment;
import com.clinicbooking.bookingservice.model.AppointmentStatus;
import com.clinicbooking.bookingservice.model.BookedService;
import com.clinicbooking.bookingservice.model.ServiceOffering;
import com.clinicbooking.bookingservice.model.User;
import com.clinicbooking.bookingservice.repository.BusinessRepository;
import com.clinicbooking.bookingservice.repository.ServiceOfferingRepository;
import com.clinicbooking.bookingservice.repository.UserRepository;
import com.clinicbooking.bookingservice.store.BookingLedger;
import jakarta.persistence.OptimisticLockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Transactional entry point for appointment writes. Every operation runs as one unit of
 * work on the booking transaction manager: guard rows of the affected staff-days are
 * bumped, the conflict validator runs against the ledger, and only then are changes
 * written. Business-rule rejections roll the unit back and come back as a failed
 * {@link BookingResult}; lock and optimistic-version failures are retried with exponential
 * backoff so the loser of a race re-reads the ledger.
 */
@Service
public class BookingOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(BookingOrchestrator.class);

    private static final String DEFAULT_CLIENT_NAME = "Anonymous";

    private final BookingLedger bookingLedger;
    private final ConflictValidator conflictValidator;
    private final InterServiceGapPolicy gapPolicy;
    private final BusinessRepository businessRepository;
    private final ServiceOfferingRepository serviceOfferingRepository;
    private final UserRepository userRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final TransactionTemplate bookingTxTemplate;
    private final int maxAttempts;
    private final long baseDelayMs;

    public BookingOrchestrator(BookingLedger bookingLedger,
                               ConflictValidator conflictValidator,
                               InterServiceGapPolicy gapPolicy,
                               BusinessRepository businessRepository,
                               ServiceOfferingRepository serviceOfferingRepository,
                               UserRepository userRepository,
                               ApplicationEventPublisher eventPublisher,
                               Clock clock,
                               @Qualifier("bookingTransactionManager") PlatformTransactionManager bookingTransactionManager,
                               @Value("${booking.retry.max-attempts:5}") int maxAttempts,
                               @Value("${booking.retry.base-delay-ms:50}") long baseDelayMs) {
        this.bookingLedger = bookingLedger;
        this.conflictValidator = conflictValidator;
        this.gapPolicy = gapPolicy;
        this.businessRepository = businessRepository;
        this.serviceOfferingRepository = serviceOfferingRepository;
        this.userRepository = userRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.bookingTxTemplate = new TransactionTemplate(bookingTransactionManager);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
    }

    public BookingResult<Appointment> createAppointment(Long businessId,
                                                        Long staffId,
                                                        Long serviceId,
                                                        LocalDateTime start,
                                                        String clientName,
                                                        String clientPhone,
                                                        String notes,
                                                        String actor) {
        return createAppointment(businessId, List.of(new BookingLine(serviceId, staffId, start)),
                clientName, clientPhone, notes, actor);
    }

    public BookingResult<Appointment> createAppointment(Long businessId,
                                                        List<BookingLine> lines,
                                                        String clientName,
                                                        String clientPhone,
                                                        String notes,
                                                        String actor) {
        return execute("createAppointment", () -> {
            if (businessId == null || !businessRepository.existsById(businessId)) {
                throw BookingRejectedException.notFound("Business not found: " + businessId);
            }
            List<BookedService> services = resolveLines(businessId, lines);
            guard(services);
            validate(services, List.of());

            Appointment appointment = new Appointment();
            appointment.setBusinessId(businessId);
            appointment.setClientName(clientName == null || clientName.isBlank() ? DEFAULT_CLIENT_NAME : clientName.trim());
            appointment.setClientPhone(clientPhone == null ? "" : clientPhone.trim());
            appointment.setNotes(notes);
            appointment.setStatus(AppointmentStatus.PENDING);
            services.forEach(appointment::addService);
            appointment.recalculateTotalPrice();
            appointment.stamp(LocalDateTime.now(clock));

            Appointment saved = bookingLedger.save(appointment);
            bookingLedger.flush();
            publish(AppointmentEvent.Type.CREATED, saved, actor,
                    String.format("%d service(s) starting %s, total %s",
                            services.size(), saved.getFirstService().map(BookedService::getStartTime).orElse(null),
                            saved.getTotalPrice()));
            return saved;
        });
    }

    public BookingResult<Appointment> getAppointment(Long appointmentId) {
        return execute("getAppointment", () -> loadAppointment(appointmentId));
    }

    /**
     * Moves every booked service of the appointment by the same offset so that the earliest
     * one starts at {@code newStart}. Either all services move or none does.
     */
    public BookingResult<Appointment> rescheduleAppointment(Long appointmentId,
                                                            LocalDateTime newStart,
                                                            String reason,
                                                            String actor) {
        return execute("rescheduleAppointment", () -> {
            Appointment appointment = loadAppointment(appointmentId);
            requireMutable(appointment);
            if (newStart == null) {
                throw BookingRejectedException.invalidRequest("A new start time is required.");
            }
            BookedService first = appointment.getFirstService()
                    .orElseThrow(() -> BookingRejectedException.invalidRequest(
                            "Appointment " + appointmentId + " has no services to reschedule."));
            for (BookedService service : appointment.getServices()) {
                if (service.getStaffId() == null) {
                    throw BookingRejectedException.notFound(
                            "Staff member of booked service " + service.getId() + " no longer exists.");
                }
            }

            LocalDateTime previousStart = first.getStartTime();
            Duration delta = Duration.between(previousStart, newStart);
            List<BookedService> shifted = appointment.getServices().stream()
                    .map(service -> shiftedCopy(service, delta))
                    .toList();
            guard(shifted);
            validate(shifted, appointment.getServiceIds());

            appointment.getServices().forEach(service -> service.shiftBy(delta));
            appointment.recalculateTotalPrice();
            appointment.stamp(LocalDateTime.now(clock));
            Appointment saved = bookingLedger.save(appointment);
            bookingLedger.flush();
            publish(AppointmentEvent.Type.RESCHEDULED, saved, actor,
                    String.format("moved from %s to %s%s", previousStart, newStart, reasonSuffix(reason)));
            return saved;
        });
    }

    public BookingResult<Appointment> changeAppointmentStatus(Long appointmentId,
                                                              AppointmentStatus newStatus,
                                                              String actor) {
        return execute("changeAppointmentStatus", () -> transition(appointmentId, newStatus, null, actor));
    }

    /**
     * Cancels the appointment and records the reason. The staff time is free for the next
     * booking as soon as this commits.
     */
    public BookingResult<Appointment> cancelAppointment(Long appointmentId, String reason, String actor) {
        return execute("cancelAppointment",
                () -> transition(appointmentId, AppointmentStatus.CANCELLED, reason, actor));
    }

    /**
     * Deletes the appointment's booked services and books {@code lines} in their place as a
     * single unit, validated against the ledger without the rows being replaced.
     */
    public BookingResult<Appointment> replaceServices(Long appointmentId, List<BookingLine> lines, String actor) {
        return execute("replaceServices", () -> {
            Appointment appointment = loadAppointment(appointmentId);
            requireMutable(appointment);
            List<BookedService> replacements = resolveLines(appointment.getBusinessId(), lines);
            guard(replacements);
            validate(replacements, appointment.getServiceIds());

            List<BookedService> previous = new ArrayList<>(appointment.getServices());
            BookingLineSummary before = BookingLineSummary.of(previous);
            appointment.clearServices();
            bookingLedger.deleteServices(previous);
            replacements.forEach(appointment::addService);
            appointment.recalculateTotalPrice();
            appointment.stamp(LocalDateTime.now(clock));

            Appointment saved = bookingLedger.save(appointment);
            bookingLedger.flush();
            publish(AppointmentEvent.Type.SERVICES_REPLACED, saved, actor,
                    String.format("%s replaced by %s, total %s",
                            before, BookingLineSummary.of(replacements), saved.getTotalPrice()));
            return saved;
        });
    }

    private Appointment transition(Long appointmentId, AppointmentStatus target, String reason, String actor) {
        Appointment appointment = loadAppointment(appointmentId);
        if (target == null) {
            throw BookingRejectedException.invalidRequest("A target status is required.");
        }
        AppointmentStatus current = appointment.getStatus();
        if (current.isTerminal()) {
            throw new BookingRejectedException(BookingErrorCode.TERMINAL_STATE,
                    String.format("Appointment %d is %s and can no longer change.", appointmentId, current));
        }
        if (!current.canTransitionTo(target)) {
            throw new BookingRejectedException(BookingErrorCode.INVALID_TRANSITION,
                    String.format("Appointment %d cannot move from %s to %s.", appointmentId, current, target));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        appointment.setStatus(target);
        if (target == AppointmentStatus.CANCELLED) {
            appointment.setCancelledAt(now);
            appointment.setCancellationReason(reason);
        }
        appointment.stamp(now);
        Appointment saved = bookingLedger.save(appointment);
        bookingLedger.flush();
        if (target == AppointmentStatus.CANCELLED) {
            publish(AppointmentEvent.Type.CANCELLED, saved, actor, "from " + current + reasonSuffix(reason));
        } else {
            publish(AppointmentEvent.Type.STATUS_CHANGED, saved, actor, current + " -> " + target);
        }
        return saved;
    }

    private Appointment loadAppointment(Long appointmentId) {
        return bookingLedger.findAppointment(appointmentId)
                .orElseThrow(() -> BookingRejectedException.notFound("Appointment not found: " + appointmentId));
    }

    private static void requireMutable(Appointment appointment) {
        if (appointment.getStatus().isTerminal()) {
            throw new BookingRejectedException(BookingErrorCode.TERMINAL_STATE,
                    String.format("Appointment %d is %s and can no longer change.",
                            appointment.getId(), appointment.getStatus()));
        }
    }

    private List<BookedService> resolveLines(Long businessId, List<BookingLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw BookingRejectedException.invalidRequest("At least one service is required.");
        }
        List<BookedService> services = new ArrayList<>();
        for (BookingLine line : lines) {
            if (line == null || line.serviceId() == null || line.staffId() == null || line.start() == null) {
                throw BookingRejectedException.invalidRequest("Each service line needs a service, a staff member and a start time.");
            }
            ServiceOffering offering = serviceOfferingRepository.findByIdAndBusinessId(line.serviceId(), businessId)
                    .orElseThrow(() -> BookingRejectedException.notFound("Service not found: " + line.serviceId()));
            User staff = userRepository.findById(line.staffId())
                    .filter(User::isBookable)
                    .filter(user -> businessId.equals(user.getBusinessId()))
                    .orElseThrow(() -> BookingRejectedException.notFound("Staff member not found: " + line.staffId()));
            services.add(BookedService.of(offering, staff.getId(), line.start()));
        }
        return services;
    }

    /**
     * Bumps one guard row per affected (staff, date), in staff then date order so concurrent
     * writers always contend in the same sequence.
     */
    private void guard(List<BookedService> services) {
        Map<Long, TreeSet<LocalDate>> staffDays = new TreeMap<>();
        for (BookedService service : services) {
            if (service.getStaffId() == null) {
                continue;
            }
            staffDays.computeIfAbsent(service.getStaffId(), id -> new TreeSet<>())
                    .add(service.getStartTime().toLocalDate());
        }
        staffDays.forEach((staffId, dates) -> dates.forEach(date -> bookingLedger.touchGuard(staffId, date)));
    }

    private void validate(List<BookedService> services, List<Long> excludedIds) {
        for (BookedService service : services) {
            conflictValidator.validate(service.getStaffId(), service.getStartTime(), service.getEndTime(), excludedIds)
                    .throwIfRejected();
        }
        List<BookedService> ordered = services.stream()
                .sorted(Comparator.comparing(BookedService::getStartTime))
                .toList();
        for (int i = 1; i < ordered.size(); i++) {
            BookedService previous = ordered.get(i - 1);
            BookedService next = ordered.get(i);
            if (next.getStartTime().isBefore(previous.getEndTime())) {
                throw new BookingRejectedException(BookingErrorCode.DOUBLE_BOOKING,
                        String.format("Services of one appointment cannot overlap (%s at %s and %s at %s).",
                                previous.getServiceName(), previous.getStartTime(),
                                next.getServiceName(), next.getStartTime()));
            }
        }
        gapPolicy.check(ordered).throwIfRejected();
    }

    private static BookedService shiftedCopy(BookedService service, Duration delta) {
        BookedService copy = new BookedService();
        copy.setServiceId(service.getServiceId());
        copy.setServiceName(service.getServiceName());
        copy.setStaffId(service.getStaffId());
        copy.setStartTime(service.getStartTime().plus(delta));
        copy.setEndTime(service.getEndTime().plus(delta));
        copy.setPrice(service.getPrice());
        return copy;
    }

    private void publish(AppointmentEvent.Type type, Appointment appointment, String actor, String details) {
        eventPublisher.publishEvent(new AppointmentEvent(type, appointment.getId(), appointment.getBusinessId(),
                actor == null || actor.isBlank() ? "system" : actor, details, LocalDateTime.now(clock)));
    }

    private static String reasonSuffix(String reason) {
        return reason == null || reason.isBlank() ? "" : "; reason: " + reason;
    }

    private <T> BookingResult<T> execute(String operation, Supplier<T> work) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                T value = bookingTxTemplate.execute(status -> work.get());
                return BookingResult.success(value);
            } catch (BookingRejectedException e) {
                logger.info("[BookingOrchestrator] {} rejected: {} - {}", operation, e.getCode(), e.getMessage());
                return BookingResult.failure(e);
            } catch (RuntimeException e) {
                if (!isTransient(e)) {
                    logger.error("[BookingOrchestrator] {} failed with an unexpected storage error", operation, e);
                    return BookingResult.failure(BookingErrorCode.STORAGE_FAILURE,
                            "The booking could not be stored. Please try again.");
                }
                if (attempt >= maxAttempts) {
                    logger.error("[BookingOrchestrator] {} gave up after {} attempts", operation, attempt, e);
                    return BookingResult.failure(BookingErrorCode.STORAGE_FAILURE,
                            "The booking store is busy. Please try again.");
                }
                long delay = baseDelayMs * (1L << Math.min(attempt - 1, 10));
                logger.warn("[BookingOrchestrator] {} hit a concurrent write ({}), retrying {}/{} after {}ms",
                        operation, e.getClass().getSimpleName(), attempt, maxAttempts, delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("[BookingOrchestrator] {} interrupted while waiting to retry", operation);
                    return BookingResult.failure(BookingErrorCode.STORAGE_FAILURE,
                            "The booking was interrupted. Please try again.");
                }
            }
        }
    }

    static boolean isTransient(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof ConcurrencyFailureException
                    || current instanceof DataIntegrityViolationException
                    || current instanceof OptimisticLockException) {
                return true;
            }
            String message = current.getMessage() == null ? "" : current.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains("database is locked") || message.contains("sqlite_busy")) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private record BookingLineSummary(List<String> lines) {

        static BookingLineSummary of(List<BookedService> services) {
            return new BookingLineSummary(services.stream()
                    .map(service -> service.getServiceName() + "@" + service.getStartTime())
                    .toList());
        }

        @Override
        public String toString() {
            return lines.toString();
        }
    }
}
