package com.clinicbooking.bookingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A bookable service of one business. The duration is stored in whole minutes and is
 * the width used both for slot generation and for the end time of new bookings.
 */
@Entity
@Table(
        name = "services",
        uniqueConstraints = @UniqueConstraint(name = "uk_service_business_name", columnNames = {"business_id", "name"})
)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServiceOffering {

    public static final Duration MIN_DURATION = Duration.ofMinutes(15);
    public static final Duration MAX_DURATION = Duration.ofHours(8);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private Long businessId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(name = "price_type", nullable = false, length = 10)
    private PriceType priceType = PriceType.FIXED;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private ServiceColor color = ServiceColor.BLUE;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

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

    public Duration getDuration() {
        return durationMinutes == null ? Duration.ZERO : Duration.ofMinutes(durationMinutes);
    }

    public static boolean isDurationAllowed(Duration duration) {
        return duration != null
                && duration.compareTo(MIN_DURATION) >= 0
                && duration.compareTo(MAX_DURATION) <= 0;
    }
}
