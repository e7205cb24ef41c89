package com.clinicbooking.bookingservice.repository;

import com.clinicbooking.bookingservice.model.Business;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BusinessRepository extends JpaRepository<Business, Long> {
}
