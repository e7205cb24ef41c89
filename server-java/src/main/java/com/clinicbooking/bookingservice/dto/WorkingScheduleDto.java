package com.clinicbooking.bookingservice.dto;

import com.clinicbooking.bookingservice.model.WorkingSchedule;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkingScheduleDto {

    private Long id;

    @JsonProperty("business_id")
    private Long businessId;

    @JsonProperty("staff_id")
    private Long staffId;

    private LocalDate date;

    @JsonProperty("start_time")
    private LocalTime startTime;

    @JsonProperty("end_time")
    private LocalTime endTime;

    public static WorkingScheduleDto from(WorkingSchedule schedule) {
        return WorkingScheduleDto.builder()
                .id(schedule.getId())
                .businessId(schedule.getBusinessId())
                .staffId(schedule.getStaffId())
                .date(schedule.getWorkDate())
                .startTime(schedule.getStartTime())
                .endTime(schedule.getEndTime())
                .build();
    }
}
