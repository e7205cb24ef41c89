package com.clinicbooking.bookingservice.repository.appointment;

import com.clinicbooking.bookingservice.model.AppointmentStatus;
import com.clinicbooking.bookingservice.model.BookedService;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface BookedServiceRepository extends JpaRepository<BookedService, Long> {

    @Query("SELECT s FROM BookedService s " +
            "WHERE s.staffId = :staffId AND s.id NOT IN :excludedIds " +
            "AND s.appointment.status IN :statuses " +
            "AND s.startTime < :end AND s.endTime > :start " +
            "ORDER BY s.startTime ASC")
    List<BookedService> findActiveOverlapping(@Param("staffId") Long staffId,
                                              @Param("start") LocalDateTime start,
                                              @Param("end") LocalDateTime end,
                                              @Param("excludedIds") Collection<Long> excludedIds,
                                              @Param("statuses") Collection<AppointmentStatus> statuses);

    @Query("SELECT CASE WHEN COUNT(s) > 0 THEN true ELSE false END FROM BookedService s " +
            "WHERE s.staffId = :staffId AND s.appointment.status IN :statuses " +
            "AND s.startTime < :end AND s.endTime > :start")
    boolean existsActiveOverlapping(@Param("staffId") Long staffId,
                                    @Param("start") LocalDateTime start,
                                    @Param("end") LocalDateTime end,
                                    @Param("statuses") Collection<AppointmentStatus> statuses);

    @Query("SELECT s FROM BookedService s " +
            "WHERE s.staffId = :staffId AND s.startTime < :end AND s.endTime > :start " +
            "ORDER BY s.startTime ASC")
    List<BookedService> findForStaffBetween(@Param("staffId") Long staffId,
                                            @Param("start") LocalDateTime start,
                                            @Param("end") LocalDateTime end);

    boolean existsByServiceId(Long serviceId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BookedService s SET s.staffId = null WHERE s.staffId = :staffId")
    int detachStaff(@Param("staffId") Long staffId);
}
