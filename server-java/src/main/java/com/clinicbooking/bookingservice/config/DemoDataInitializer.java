package com.clinicbooking.bookingservice.config;

import com.clinicbooking.bookingservice.dto.BusinessDto;
import com.clinicbooking.bookingservice.dto.BusinessRequest;
import com.clinicbooking.bookingservice.dto.ServiceOfferingRequest;
import com.clinicbooking.bookingservice.dto.StaffDto;
import com.clinicbooking.bookingservice.dto.StaffRequest;
import com.clinicbooking.bookingservice.dto.WorkingScheduleRequest;
import com.clinicbooking.bookingservice.model.PriceType;
import com.clinicbooking.bookingservice.model.ServiceColor;
import com.clinicbooking.bookingservice.repository.BusinessRepository;
import com.clinicbooking.bookingservice.service.CatalogService;
import com.clinicbooking.bookingservice.service.ScheduleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Seeds one demo clinic with two services, two staff members and a week of schedules.
 * Runs only when {@code booking.demo-data.enabled=true} and the store has no businesses yet.
 */
@Component
@ConditionalOnProperty(name = "booking.demo-data.enabled", havingValue = "true")
public class DemoDataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(DemoDataInitializer.class);

    private static final int SEEDED_DAYS = 7;

    private final BusinessRepository businessRepository;
    private final CatalogService catalogService;
    private final ScheduleService scheduleService;
    private final Clock clock;

    public DemoDataInitializer(BusinessRepository businessRepository,
                               CatalogService catalogService,
                               ScheduleService scheduleService,
                               Clock clock) {
        this.businessRepository = businessRepository;
        this.catalogService = catalogService;
        this.scheduleService = scheduleService;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        if (businessRepository.count() > 0) {
            logger.info("[DemoDataInitializer] Businesses already present, skipping demo data");
            return;
        }
        BusinessDto clinic = catalogService.createBusiness(
                new BusinessRequest("Riverside Clinic", "12 River Road", "555-0100"));
        catalogService.createService(clinic.getId(), new ServiceOfferingRequest(
                "Consultation", "Initial consultation", 30, new BigDecimal("45.00"), PriceType.FIXED, ServiceColor.BLUE));
        catalogService.createService(clinic.getId(), new ServiceOfferingRequest(
                "Physiotherapy", "Treatment session", 60, new BigDecimal("80.00"), PriceType.VARIABLE, ServiceColor.GREEN));

        StaffDto anna = catalogService.createStaff(clinic.getId(),
                new StaffRequest("anna@riverside.example", "Anna Berg", "555-0101"));
        StaffDto omar = catalogService.createStaff(clinic.getId(),
                new StaffRequest("omar@riverside.example", "Omar Haddad", "555-0102"));

        List<WorkingScheduleRequest> schedules = new ArrayList<>();
        LocalDate today = LocalDate.now(clock);
        for (int day = 0; day < SEEDED_DAYS; day++) {
            String date = today.plusDays(day).toString();
            schedules.add(new WorkingScheduleRequest(anna.getId(), date, "09:00", "12:00"));
            schedules.add(new WorkingScheduleRequest(anna.getId(), date, "13:00", "17:00"));
            schedules.add(new WorkingScheduleRequest(omar.getId(), date, "10:00", "18:00"));
        }
        scheduleService.createSchedules(clinic.getId(), schedules);
        logger.info("[DemoDataInitializer] Seeded business {} with {} schedules", clinic.getId(), schedules.size());
    }
}
