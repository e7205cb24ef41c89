package com.clinicbooking.bookingservice.dto;

import com.clinicbooking.bookingservice.model.PriceType;
import com.clinicbooking.bookingservice.model.ServiceColor;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServiceOfferingRequest {

    @NotBlank
    @Size(max = 100)
    private String name;

    private String description;

    @NotNull
    @JsonProperty("duration_minutes")
    private Integer durationMinutes;

    @NotNull
    @DecimalMin("0.00")
    @Digits(integer = 8, fraction = 2)
    private BigDecimal price;

    @JsonProperty("price_type")
    private PriceType priceType;

    private ServiceColor color;
}
