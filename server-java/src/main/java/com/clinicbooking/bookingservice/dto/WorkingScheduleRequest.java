package com.clinicbooking.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkingScheduleRequest {

    @NotNull
    @JsonProperty("staff_id")
    private Long staffId;

    /** yyyy-MM-dd */
    @NotBlank
    private String date;

    /** HH:mm */
    @NotBlank
    @JsonProperty("start_time")
    private String startTime;

    @NotBlank
    @JsonProperty("end_time")
    private String endTime;
}
