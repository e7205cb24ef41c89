package com.clinicbooking.bookingservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentRequest {

    @Size(max = 100)
    @JsonProperty("client_name")
    private String clientName;

    @Size(max = 20)
    @JsonProperty("client_phone")
    private String clientPhone;

    private String notes;

    @NotEmpty
    @Valid
    private List<BookingLineRequest> services;
}
