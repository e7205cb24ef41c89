package com.clinicbooking.bookingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class User {

    public static final String ROLE_STAFF = "STAFF";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String email;

    @Column(nullable = true)
    private String name;

    @Column(nullable = true, length = 20)
    private String phone;

    @Column(nullable = false, length = 20)
    private String role = ROLE_STAFF;

    @Column(name = "business_id")
    private Long businessId;

    @Column(nullable = false)
    private Boolean active = Boolean.TRUE;

    @Column(name = "created_at", nullable = true)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public boolean isStaff() {
        return ROLE_STAFF.equals(role);
    }

    public boolean isBookable() {
        return isStaff() && Boolean.TRUE.equals(active);
    }

    /** Name shown next to slots; falls back to the e-mail like the admin screens do. */
    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : email;
    }
}
