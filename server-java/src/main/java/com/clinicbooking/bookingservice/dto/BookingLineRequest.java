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
public class BookingLineRequest {

    @NotNull
    @JsonProperty("service_id")
    private Long serviceId;

    @NotNull
    @JsonProperty("staff_id")
    private Long staffId;

    @NotBlank
    @JsonProperty("start_time")
    private String startTime;
}
