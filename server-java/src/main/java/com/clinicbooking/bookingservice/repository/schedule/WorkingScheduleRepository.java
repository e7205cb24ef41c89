package com.clinicbooking.bookingservice.repository.schedule;

import com.clinicbooking.bookingservice.model.WorkingSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Repository
public interface WorkingScheduleRepository extends JpaRepository<WorkingSchedule, Long> {

    List<WorkingSchedule> findByStaffIdAndWorkDateOrderByStartTimeAsc(Long staffId, LocalDate workDate);

    List<WorkingSchedule> findByStaffIdAndWorkDateBetweenOrderByWorkDateAscStartTimeAsc(Long staffId,
                                                                                        LocalDate from,
                                                                                        LocalDate to);

    @Query("SELECT CASE WHEN COUNT(w) > 0 THEN true ELSE false END FROM WorkingSchedule w " +
            "WHERE w.staffId = :staffId AND w.workDate = :workDate " +
            "AND w.startTime < :endTime AND w.endTime > :startTime")
    boolean existsOverlap(@Param("staffId") Long staffId,
                          @Param("workDate") LocalDate workDate,
                          @Param("startTime") LocalTime startTime,
                          @Param("endTime") LocalTime endTime);

    void deleteByStaffId(Long staffId);

    void deleteByBusinessId(Long businessId);
}
