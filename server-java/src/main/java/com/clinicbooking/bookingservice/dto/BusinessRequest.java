package com.clinicbooking.bookingservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BusinessRequest {

    @NotBlank
    @Size(max = 100)
    private String name;

    @NotBlank
    private String address;

    @NotBlank
    @Size(max = 20)
    private String phone;
}
