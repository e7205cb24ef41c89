package com.clinicbooking.bookingservice.dto;

import com.clinicbooking.bookingservice.model.BookedService;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookedServiceDto {

    private Long id;

    @JsonProperty("service_id")
    private Long serviceId;

    @JsonProperty("service_name")
    private String serviceName;

    @JsonProperty("staff_id")
    private Long staffId;

    @JsonProperty("start_time")
    private LocalDateTime startTime;

    @JsonProperty("end_time")
    private LocalDateTime endTime;

    private BigDecimal price;

    public static BookedServiceDto from(BookedService service) {
        return BookedServiceDto.builder()
                .id(service.getId())
                .serviceId(service.getServiceId())
                .serviceName(service.getServiceName())
                .staffId(service.getStaffId())
                .startTime(service.getStartTime())
                .endTime(service.getEndTime())
                .price(service.getPrice())
                .build();
    }
}
