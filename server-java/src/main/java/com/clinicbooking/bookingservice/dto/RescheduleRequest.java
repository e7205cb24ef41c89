package com.clinicbooking.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RescheduleRequest {

    @NotBlank
    @JsonProperty("new_start_time")
    private String newStartTime;

    private String reason;
}
