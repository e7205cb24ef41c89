package com.clinicbooking.bookingservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * One (service, staff, time range) unit of an appointment. Start, end and price are
 * frozen copies taken at booking time.
 */
@Entity
@Table(
        name = "appointment_services",
        indexes = {
                @Index(name = "idx_booked_staff_start", columnList = "staff_id, start_time"),
                @Index(name = "idx_booked_appointment", columnList = "appointment_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class BookedService {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "appointment_id", nullable = false)
    private Appointment appointment;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "service_name", nullable = false, length = 100)
    private String serviceName;

    // null once the staff member has been deleted
    @Column(name = "staff_id")
    private Long staffId;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    public static BookedService of(ServiceOffering offering, Long staffId, LocalDateTime start) {
        BookedService booked = new BookedService();
        booked.setServiceId(offering.getId());
        booked.setServiceName(offering.getName());
        booked.setStaffId(staffId);
        booked.setStartTime(start);
        booked.setEndTime(start.plus(offering.getDuration()));
        booked.setPrice(offering.getPrice());
        return booked;
    }

    public boolean overlaps(LocalDateTime otherStart, LocalDateTime otherEnd) {
        return startTime.isBefore(otherEnd) && endTime.isAfter(otherStart);
    }

    public void shiftBy(Duration delta) {
        startTime = startTime.plus(delta);
        endTime = endTime.plus(delta);
    }
}
