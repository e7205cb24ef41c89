package com.clinicbooking.bookingservice.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAppointmentNotifier implements AppointmentNotifier {

    private static final Logger logger = LoggerFactory.getLogger(LoggingAppointmentNotifier.class);

    @Override
    public void notify(AppointmentEvent event) {
        logger.info("[LoggingAppointmentNotifier] Appointment {} {} (business {})",
                event.appointmentId(), event.type(), event.businessId());
    }
}
