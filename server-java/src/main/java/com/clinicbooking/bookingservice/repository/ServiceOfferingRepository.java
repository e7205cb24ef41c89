package com.clinicbooking.bookingservice.repository;

import com.clinicbooking.bookingservice.model.ServiceOffering;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ServiceOfferingRepository extends JpaRepository<ServiceOffering, Long> {

    List<ServiceOffering> findByBusinessIdOrderByNameAsc(Long businessId);

    Optional<ServiceOffering> findByIdAndBusinessId(Long id, Long businessId);

    boolean existsByBusinessIdAndName(Long businessId, String name);

    boolean existsByBusinessIdAndNameAndIdNot(Long businessId, String name, Long id);

    void deleteByBusinessId(Long businessId);
}
