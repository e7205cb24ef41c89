package com.clinicbooking.bookingservice.dto;

import com.clinicbooking.bookingservice.model.Business;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessDto {

    private Long id;
    private String name;
    private String address;
    private String phone;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static BusinessDto from(Business business) {
        return BusinessDto.builder()
                .id(business.getId())
                .name(business.getName())
                .address(business.getAddress())
                .phone(business.getPhone())
                .createdAt(business.getCreatedAt())
                .build();
    }
}
