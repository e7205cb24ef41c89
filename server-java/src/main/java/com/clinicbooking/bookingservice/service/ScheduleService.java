package com.clinicbooking.bookingservice.service;

import com.clinicbooking.bookingservice.dto.StaffCalendarDto;
import com.clinicbooking.bookingservice.dto.WorkingScheduleDto;
import com.clinicbooking.bookingservice.dto.WorkingScheduleRequest;
import com.clinicbooking.bookingservice.model.AppointmentStatus;
import com.clinicbooking.bookingservice.model.BookedService;
import com.clinicbooking.bookingservice.model.User;
import com.clinicbooking.bookingservice.model.WorkingSchedule;
import com.clinicbooking.bookingservice.repository.BusinessRepository;
import com.clinicbooking.bookingservice.repository.UserRepository;
import com.clinicbooking.bookingservice.repository.appointment.BookedServiceRepository;
import com.clinicbooking.bookingservice.repository.schedule.WorkingScheduleRepository;
import com.clinicbooking.bookingservice.util.BookingTimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@Service
public class ScheduleService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    private final WorkingScheduleRepository workingScheduleRepository;
    private final BookedServiceRepository bookedServiceRepository;
    private final BusinessRepository businessRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    public ScheduleService(WorkingScheduleRepository workingScheduleRepository,
                           BookedServiceRepository bookedServiceRepository,
                           BusinessRepository businessRepository,
                           UserRepository userRepository,
                           Clock clock) {
        this.workingScheduleRepository = workingScheduleRepository;
        this.bookedServiceRepository = bookedServiceRepository;
        this.businessRepository = businessRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Transactional("bookingTransactionManager")
    public WorkingScheduleDto createSchedule(Long businessId, WorkingScheduleRequest request) {
        requireBusiness(businessId);
        return WorkingScheduleDto.from(createInternal(businessId, request));
    }

    /**
     * Creates every schedule or none of them. Rows of the same batch are checked against
     * each other as well as against stored rows.
     */
    @Transactional("bookingTransactionManager")
    public List<WorkingScheduleDto> createSchedules(Long businessId, List<WorkingScheduleRequest> requests) {
        requireBusiness(businessId);
        if (requests == null || requests.isEmpty()) {
            throw BookingRejectedException.invalidRequest("At least one schedule is required.");
        }
        List<WorkingScheduleDto> created = new ArrayList<>();
        for (WorkingScheduleRequest request : requests) {
            created.add(WorkingScheduleDto.from(createInternal(businessId, request)));
        }
        logger.info("[ScheduleService] Created {} schedules for business {}", created.size(), businessId);
        return created;
    }

    /**
     * Deletes a schedule that no pending, confirmed or in-progress booking still falls inside.
     */
    @Transactional("bookingTransactionManager")
    public void deleteSchedule(Long scheduleId) {
        WorkingSchedule schedule = workingScheduleRepository.findById(scheduleId)
                .orElseThrow(() -> BookingRejectedException.notFound("Schedule not found: " + scheduleId));
        LocalDateTime start = schedule.getWorkDate().atTime(schedule.getStartTime());
        LocalDateTime end = schedule.getWorkDate().atTime(schedule.getEndTime());
        if (bookedServiceRepository.existsActiveOverlapping(schedule.getStaffId(), start, end, AppointmentStatus.ACTIVE)) {
            throw new BookingRejectedException(BookingErrorCode.SCHEDULE_IN_USE,
                    String.format("Schedule %d of staff member %d still has active bookings between %s and %s.",
                            scheduleId, schedule.getStaffId(), start, end));
        }
        workingScheduleRepository.delete(schedule);
        logger.info("[ScheduleService] Deleted schedule {} of staff {} on {}",
                scheduleId, schedule.getStaffId(), schedule.getWorkDate());
    }

    @Transactional(value = "bookingTransactionManager", readOnly = true)
    public StaffCalendarDto getStaffCalendar(Long staffId, LocalDate from, LocalDate to) {
        User staff = userRepository.findById(staffId)
                .filter(User::isStaff)
                .orElseThrow(() -> BookingRejectedException.notFound("Staff member not found: " + staffId));
        if (from == null || to == null) {
            throw BookingRejectedException.invalidRequest("Both from and to dates are required.");
        }
        if (to.isBefore(from)) {
            throw new BookingRejectedException(BookingErrorCode.INVALID_RANGE, "The from date must not be after the to date.");
        }

        List<WorkingScheduleDto> schedules = workingScheduleRepository
                .findByStaffIdAndWorkDateBetweenOrderByWorkDateAscStartTimeAsc(staffId, from, to).stream()
                .map(WorkingScheduleDto::from)
                .toList();
        List<StaffCalendarDto.Entry> bookings = bookedServiceRepository
                .findForStaffBetween(staffId, from.atStartOfDay(), to.plusDays(1).atStartOfDay()).stream()
                .map(ScheduleService::toEntry)
                .toList();

        return StaffCalendarDto.builder()
                .staffId(staff.getId())
                .staffName(staff.getDisplayName())
                .from(from)
                .to(to)
                .schedules(schedules)
                .bookings(bookings)
                .build();
    }

    private WorkingSchedule createInternal(Long businessId, WorkingScheduleRequest request) {
        if (request == null || request.getStaffId() == null) {
            throw BookingRejectedException.invalidRequest("A staff member is required.");
        }
        User staff = userRepository.findById(request.getStaffId())
                .filter(User::isStaff)
                .filter(user -> businessId.equals(user.getBusinessId()))
                .orElseThrow(() -> BookingRejectedException.notFound("Staff member not found: " + request.getStaffId()));

        LocalDate date = BookingTimeUtils.parseDate("date", request.getDate());
        LocalTime start = BookingTimeUtils.parseTime("start_time", request.getStartTime());
        LocalTime end = BookingTimeUtils.parseTime("end_time", request.getEndTime());

        if (!start.isBefore(end)) {
            throw new BookingRejectedException(BookingErrorCode.INVALID_RANGE, "Start time must be before end time.");
        }
        if (date.isBefore(LocalDate.now(clock))) {
            throw new BookingRejectedException(BookingErrorCode.PAST_DATE, "Cannot create a schedule in the past: " + date);
        }
        if (workingScheduleRepository.existsOverlap(staff.getId(), date, start, end)) {
            throw new BookingRejectedException(BookingErrorCode.SCHEDULE_OVERLAP,
                    String.format("Staff member %d already has a schedule overlapping %s %s-%s.",
                            staff.getId(), date, start, end));
        }

        WorkingSchedule schedule = new WorkingSchedule();
        schedule.setBusinessId(businessId);
        schedule.setStaffId(staff.getId());
        schedule.setWorkDate(date);
        schedule.setStartTime(start);
        schedule.setEndTime(end);
        schedule.setCreatedAt(LocalDateTime.now(clock));
        return workingScheduleRepository.save(schedule);
    }

    private void requireBusiness(Long businessId) {
        if (businessId == null || !businessRepository.existsById(businessId)) {
            throw BookingRejectedException.notFound("Business not found: " + businessId);
        }
    }

    private static StaffCalendarDto.Entry toEntry(BookedService service) {
        return StaffCalendarDto.Entry.builder()
                .appointmentId(service.getAppointment().getId())
                .clientName(service.getAppointment().getClientName())
                .status(service.getAppointment().getStatus())
                .serviceName(service.getServiceName())
                .startTime(service.getStartTime())
                .endTime(service.getEndTime())
                .build();
    }
}
