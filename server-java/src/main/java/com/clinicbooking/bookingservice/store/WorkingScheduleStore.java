package com.clinicbooking.bookingservice.store;

import java.time.LocalDate;
import java.util.List;

/**
 * Read access to the bookable working windows of a staff member.
 */
public interface WorkingScheduleStore {

    /**
     * @return the intervals for the staff member on the date, ordered by start; empty when
     * the staff member does not work that day
     */
    List<WorkingInterval> findFor(Long staffId, LocalDate date);
}
