package com.clinicbooking.bookingservice.repository.schedule;

import com.clinicbooking.bookingservice.model.BookingGuard;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;

@Repository
public interface BookingGuardRepository extends JpaRepository<BookingGuard, Long> {

    Optional<BookingGuard> findByStaffIdAndGuardDate(Long staffId, LocalDate guardDate);

    void deleteByStaffId(Long staffId);

    void deleteByStaffIdIn(Collection<Long> staffIds);
}
