package com.clinicbooking.bookingservice.dto;

import com.clinicbooking.bookingservice.model.User;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StaffDto {

    private Long id;

    @JsonProperty("business_id")
    private Long businessId;

    private String email;
    private String name;
    private String phone;
    private String role;
    private boolean active;

    public static StaffDto from(User user) {
        return StaffDto.builder()
                .id(user.getId())
                .businessId(user.getBusinessId())
                .email(user.getEmail())
                .name(user.getName())
                .phone(user.getPhone())
                .role(user.getRole())
                .active(Boolean.TRUE.equals(user.getActive()))
                .build();
    }
}
