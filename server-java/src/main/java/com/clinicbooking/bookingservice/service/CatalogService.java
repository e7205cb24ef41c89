package com.clinicbooking.bookingservice.service;

import com.clinicbooking.bookingservice.dto.BusinessDto;
import com.clinicbooking.bookingservice.dto.BusinessRequest;
import com.clinicbooking.bookingservice.dto.ServiceOfferingDto;
import com.clinicbooking.bookingservice.dto.ServiceOfferingRequest;
import com.clinicbooking.bookingservice.dto.StaffDto;
import com.clinicbooking.bookingservice.dto.StaffRequest;
import com.clinicbooking.bookingservice.model.Business;
import com.clinicbooking.bookingservice.model.PriceType;
import com.clinicbooking.bookingservice.model.ServiceColor;
import com.clinicbooking.bookingservice.model.ServiceOffering;
import com.clinicbooking.bookingservice.model.User;
import com.clinicbooking.bookingservice.repository.BusinessRepository;
import com.clinicbooking.bookingservice.repository.ServiceOfferingRepository;
import com.clinicbooking.bookingservice.repository.UserRepository;
import com.clinicbooking.bookingservice.repository.appointment.AppointmentRepository;
import com.clinicbooking.bookingservice.repository.appointment.BookedServiceRepository;
import com.clinicbooking.bookingservice.repository.schedule.BookingGuardRepository;
import com.clinicbooking.bookingservice.repository.schedule.WorkingScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Business, service and staff maintenance. Thin CRUD around the booking core; the only
 * rules here are the catalog invariants (unique service names, duration bounds, frozen
 * durations once booked) and the cascade behaviour of deletes.
 */
@Service
public class CatalogService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogService.class);

    private final BusinessRepository businessRepository;
    private final ServiceOfferingRepository serviceOfferingRepository;
    private final UserRepository userRepository;
    private final WorkingScheduleRepository workingScheduleRepository;
    private final AppointmentRepository appointmentRepository;
    private final BookedServiceRepository bookedServiceRepository;
    private final BookingGuardRepository bookingGuardRepository;
    private final Clock clock;

    public CatalogService(BusinessRepository businessRepository,
                          ServiceOfferingRepository serviceOfferingRepository,
                          UserRepository userRepository,
                          WorkingScheduleRepository workingScheduleRepository,
                          AppointmentRepository appointmentRepository,
                          BookedServiceRepository bookedServiceRepository,
                          BookingGuardRepository bookingGuardRepository,
                          Clock clock) {
        this.businessRepository = businessRepository;
        this.serviceOfferingRepository = serviceOfferingRepository;
        this.userRepository = userRepository;
        this.workingScheduleRepository = workingScheduleRepository;
        this.appointmentRepository = appointmentRepository;
        this.bookedServiceRepository = bookedServiceRepository;
        this.bookingGuardRepository = bookingGuardRepository;
        this.clock = clock;
    }

    @Transactional("bookingTransactionManager")
    public BusinessDto createBusiness(BusinessRequest request) {
        Business business = new Business();
        applyDisplayFields(business, request);
        business.setCreatedAt(LocalDateTime.now(clock));
        Business saved = businessRepository.save(business);
        logger.info("[CatalogService] Created business {} ({})", saved.getId(), saved.getName());
        return BusinessDto.from(saved);
    }

    @Transactional("bookingTransactionManager")
    public BusinessDto updateBusiness(Long businessId, BusinessRequest request) {
        Business business = findBusiness(businessId);
        applyDisplayFields(business, request);
        return BusinessDto.from(businessRepository.save(business));
    }

    /**
     * Removes the business with its appointments, schedules, staff and services.
     */
    @Transactional("bookingTransactionManager")
    public void deleteBusiness(Long businessId) {
        Business business = findBusiness(businessId);
        List<Long> staffIds = userRepository.findByBusinessId(businessId).stream()
                .map(User::getId)
                .toList();

        appointmentRepository.deleteAll(appointmentRepository.findByBusinessId(businessId));
        workingScheduleRepository.deleteByBusinessId(businessId);
        if (!staffIds.isEmpty()) {
            bookingGuardRepository.deleteByStaffIdIn(staffIds);
        }
        userRepository.deleteByBusinessId(businessId);
        serviceOfferingRepository.deleteByBusinessId(businessId);
        businessRepository.delete(business);
        logger.info("[CatalogService] Deleted business {} with {} staff members", businessId, staffIds.size());
    }

    @Transactional(value = "bookingTransactionManager", readOnly = true)
    public List<ServiceOfferingDto> listServices(Long businessId) {
        findBusiness(businessId);
        return serviceOfferingRepository.findByBusinessIdOrderByNameAsc(businessId).stream()
                .map(ServiceOfferingDto::from)
                .toList();
    }

    @Transactional("bookingTransactionManager")
    public ServiceOfferingDto createService(Long businessId, ServiceOfferingRequest request) {
        findBusiness(businessId);
        String name = requireName(request.getName());
        if (serviceOfferingRepository.existsByBusinessIdAndName(businessId, name)) {
            throw BookingRejectedException.invalidRequest("A service named '" + name + "' already exists.");
        }

        ServiceOffering service = new ServiceOffering();
        service.setBusinessId(businessId);
        service.setName(name);
        applyServiceFields(service, request);
        service.stamp(LocalDateTime.now(clock));
        return ServiceOfferingDto.from(serviceOfferingRepository.save(service));
    }

    @Transactional("bookingTransactionManager")
    public ServiceOfferingDto updateService(Long serviceId, ServiceOfferingRequest request) {
        ServiceOffering service = serviceOfferingRepository.findById(serviceId)
                .orElseThrow(() -> BookingRejectedException.notFound("Service not found: " + serviceId));
        String name = requireName(request.getName());
        if (serviceOfferingRepository.existsByBusinessIdAndNameAndIdNot(service.getBusinessId(), name, serviceId)) {
            throw BookingRejectedException.invalidRequest("A service named '" + name + "' already exists.");
        }
        if (!Objects.equals(service.getDurationMinutes(), request.getDurationMinutes())
                && bookedServiceRepository.existsByServiceId(serviceId)) {
            throw BookingRejectedException.invalidRequest(
                    "The duration of service " + serviceId + " cannot change once it has been booked.");
        }

        service.setName(name);
        applyServiceFields(service, request);
        service.stamp(LocalDateTime.now(clock));
        return ServiceOfferingDto.from(serviceOfferingRepository.save(service));
    }

    @Transactional("bookingTransactionManager")
    public StaffDto createStaff(Long businessId, StaffRequest request) {
        findBusiness(businessId);
        String email = request.getEmail() == null ? "" : request.getEmail().trim().toLowerCase(Locale.ROOT);
        if (email.isEmpty()) {
            throw BookingRejectedException.invalidRequest("An e-mail address is required.");
        }
        if (userRepository.existsByEmail(email)) {
            throw BookingRejectedException.invalidRequest("A user with e-mail " + email + " already exists.");
        }

        User staff = new User();
        staff.setEmail(email);
        staff.setName(request.getName());
        staff.setPhone(request.getPhone());
        staff.setRole(User.ROLE_STAFF);
        staff.setBusinessId(businessId);
        staff.setActive(true);
        staff.setCreatedAt(LocalDateTime.now(clock));
        return StaffDto.from(userRepository.save(staff));
    }

    /**
     * Deletes the staff member. Booked services keep their history with the staff reference
     * cleared; schedules and guard rows go with the staff member.
     */
    @Transactional("bookingTransactionManager")
    public void deleteStaff(Long staffId) {
        User staff = userRepository.findById(staffId)
                .filter(User::isStaff)
                .orElseThrow(() -> BookingRejectedException.notFound("Staff member not found: " + staffId));
        int detached = bookedServiceRepository.detachStaff(staffId);
        workingScheduleRepository.deleteByStaffId(staffId);
        bookingGuardRepository.deleteByStaffId(staffId);
        userRepository.delete(staff);
        logger.info("[CatalogService] Deleted staff {} and detached {} booked services", staffId, detached);
    }

    private Business findBusiness(Long businessId) {
        if (businessId == null) {
            throw BookingRejectedException.notFound("Business not found: null");
        }
        return businessRepository.findById(businessId)
                .orElseThrow(() -> BookingRejectedException.notFound("Business not found: " + businessId));
    }

    private static void applyDisplayFields(Business business, BusinessRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw BookingRejectedException.invalidRequest("A business name is required.");
        }
        business.setName(request.getName().trim());
        business.setAddress(request.getAddress() == null ? "" : request.getAddress().trim());
        business.setPhone(request.getPhone() == null ? "" : request.getPhone().trim());
    }

    private static void applyServiceFields(ServiceOffering service, ServiceOfferingRequest request) {
        Integer minutes = request.getDurationMinutes();
        if (minutes == null || !ServiceOffering.isDurationAllowed(Duration.ofMinutes(minutes))) {
            throw BookingRejectedException.invalidRequest(String.format(
                    "Service duration must be between %d and %d minutes.",
                    ServiceOffering.MIN_DURATION.toMinutes(), ServiceOffering.MAX_DURATION.toMinutes()));
        }
        BigDecimal price = request.getPrice() == null ? BigDecimal.ZERO : request.getPrice();
        if (price.signum() < 0) {
            throw BookingRejectedException.invalidRequest("Service price cannot be negative.");
        }
        service.setDescription(request.getDescription());
        service.setDurationMinutes(minutes);
        service.setPrice(price.setScale(2, RoundingMode.HALF_UP));
        service.setPriceType(request.getPriceType() == null ? PriceType.FIXED : request.getPriceType());
        service.setColor(request.getColor() == null ? ServiceColor.BLUE : request.getColor());
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw BookingRejectedException.invalidRequest("A service name is required.");
        }
        return name.trim();
    }
}
