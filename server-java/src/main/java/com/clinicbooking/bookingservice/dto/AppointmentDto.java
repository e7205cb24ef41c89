package com.clinicbooking.bookingservice.dto;

import com.clinicbooking.bookingservice.model.Appointment;
import com.clinicbooking.bookingservice.model.AppointmentStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentDto {

    private Long id;

    @JsonProperty("business_id")
    private Long businessId;

    @JsonProperty("client_name")
    private String clientName;

    @JsonProperty("client_phone")
    private String clientPhone;

    private AppointmentStatus status;
    private String notes;

    @JsonProperty("cancellation_reason")
    private String cancellationReason;

    @JsonProperty("cancelled_at")
    private LocalDateTime cancelledAt;

    @JsonProperty("total_price")
    private BigDecimal totalPrice;

    private List<BookedServiceDto> services;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static AppointmentDto from(Appointment appointment) {
        return AppointmentDto.builder()
                .id(appointment.getId())
                .businessId(appointment.getBusinessId())
                .clientName(appointment.getClientName())
                .clientPhone(appointment.getClientPhone())
                .status(appointment.getStatus())
                .notes(appointment.getNotes())
                .cancellationReason(appointment.getCancellationReason())
                .cancelledAt(appointment.getCancelledAt())
                .totalPrice(appointment.getTotalPrice())
                .services(appointment.getServices().stream().map(BookedServiceDto::from).toList())
                .createdAt(appointment.getCreatedAt())
                .updatedAt(appointment.getUpdatedAt())
                .build();
    }
}
