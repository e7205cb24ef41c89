package com.clinicbooking.bookingservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkScheduleRequest {

    @NotEmpty
    @Valid
    private List<WorkingScheduleRequest> schedules;
}
