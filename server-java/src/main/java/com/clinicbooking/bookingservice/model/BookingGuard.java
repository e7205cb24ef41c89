package com.clinicbooking.bookingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Versioned marker row per staff member and date. Every transaction that books time for
 * the staff member on that date updates it, so two transactions racing on the same
 * staff-day cannot both commit.
 */
@Entity
@Table(
        name = "booking_guards",
        uniqueConstraints = @UniqueConstraint(name = "uk_guard_staff_date", columnNames = {"staff_id", "guard_date"})
)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookingGuard {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "staff_id", nullable = false)
    private Long staffId;

    @Column(name = "guard_date", nullable = false)
    private LocalDate guardDate;

    @Column(name = "write_count", nullable = false)
    private Long writeCount = 0L;

    @Column(name = "touched_at", nullable = false)
    private LocalDateTime touchedAt;

    @Version
    private Long version;

    public BookingGuard(Long staffId, LocalDate guardDate) {
        this.staffId = staffId;
        this.guardDate = guardDate;
    }

    public void touch(LocalDateTime now) {
        writeCount = writeCount == null ? 1L : writeCount + 1;
        touchedAt = now;
    }
}
