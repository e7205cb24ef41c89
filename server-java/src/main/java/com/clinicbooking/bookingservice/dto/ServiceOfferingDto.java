package com.clinicbooking.bookingservice.dto;

import com.clinicbooking.bookingservice.model.PriceType;
import com.clinicbooking.bookingservice.model.ServiceColor;
import com.clinicbooking.bookingservice.model.ServiceOffering;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceOfferingDto {

    private Long id;

    @JsonProperty("business_id")
    private Long businessId;

    private String name;
    private String description;

    @JsonProperty("duration_minutes")
    private Integer durationMinutes;

    private BigDecimal price;

    @JsonProperty("price_type")
    private PriceType priceType;

    private ServiceColor color;

    public static ServiceOfferingDto from(ServiceOffering service) {
        return ServiceOfferingDto.builder()
                .id(service.getId())
                .businessId(service.getBusinessId())
                .name(service.getName())
                .description(service.getDescription())
                .durationMinutes(service.getDurationMinutes())
                .price(service.getPrice())
                .priceType(service.getPriceType())
                .color(service.getColor())
                .build();
    }
}
