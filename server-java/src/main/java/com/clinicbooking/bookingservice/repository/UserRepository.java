package com.clinicbooking.bookingservice.repository;

import com.clinicbooking.bookingservice.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    List<User> findByBusinessIdAndRoleAndActiveTrue(Long businessId, String role);

    List<User> findByBusinessId(Long businessId);

    void deleteByBusinessId(Long businessId);
}
