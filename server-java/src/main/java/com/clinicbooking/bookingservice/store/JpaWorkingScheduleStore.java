package com.clinicbooking.bookingservice.store;

import com.clinicbooking.bookingservice.repository.schedule.WorkingScheduleRepository;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

@Component
public class JpaWorkingScheduleStore implements WorkingScheduleStore {

    private final WorkingScheduleRepository workingScheduleRepository;

    public JpaWorkingScheduleStore(WorkingScheduleRepository workingScheduleRepository) {
        this.workingScheduleRepository = workingScheduleRepository;
    }

    @Override
    public List<WorkingInterval> findFor(Long staffId, LocalDate date) {
        if (staffId == null || date == null) {
            return List.of();
        }
        return workingScheduleRepository.findByStaffIdAndWorkDateOrderByStartTimeAsc(staffId, date).stream()
                .map(row -> new WorkingInterval(row.getStartTime(), row.getEndTime()))
                .toList();
    }
}
