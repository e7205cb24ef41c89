package com.clinicbooking.bookingservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Entity
@Table(
        name = "appointments",
        indexes = {
                @Index(name = "idx_appointment_business", columnList = "business_id"),
                @Index(name = "idx_appointment_status", columnList = "status")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class Appointment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private Long businessId;

    @Column(name = "client_name", nullable = false, length = 100)
    private String clientName = "Anonymous";

    @Column(name = "client_phone", nullable = false, length = 20)
    private String clientPhone = "";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AppointmentStatus status = AppointmentStatus.PENDING;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "cancellation_reason", columnDefinition = "TEXT")
    private String cancellationReason;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    // derived; see recalculateTotalPrice()
    @Column(name = "total_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalPrice = BigDecimal.ZERO;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @ToString.Exclude
    @OneToMany(mappedBy = "appointment", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("startTime ASC")
    private List<BookedService> services = new ArrayList<>();

    /**
     * Records a write at {@code now}; the first call also sets the creation time.
     */
    public void stamp(LocalDateTime now) {
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PrePersist
    public void onCreate() {
        if (createdAt == null || updatedAt == null) {
            stamp(LocalDateTime.now());
        }
    }

    public void addService(BookedService service) {
        services.add(service);
        service.setAppointment(this);
    }

    public void clearServices() {
        services.clear();
    }

    public BigDecimal recalculateTotalPrice() {
        totalPrice = services.stream()
                .map(BookedService::getPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return totalPrice;
    }

    public Optional<BookedService> getFirstService() {
        return services.stream().min(Comparator.comparing(BookedService::getStartTime));
    }

    public List<Long> getServiceIds() {
        return services.stream()
                .map(BookedService::getId)
                .filter(java.util.Objects::nonNull)
                .toList();
    }
}
