package com.clinicbooking.bookingservice.dto;

import com.clinicbooking.bookingservice.model.AppointmentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeRequest {

    @NotNull
    private AppointmentStatus status;
}
