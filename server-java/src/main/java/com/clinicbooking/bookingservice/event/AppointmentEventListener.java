package com.clinicbooking.bookingservice.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Audit trail and notification hook for committed appointment changes. Rolled back units
 * of work never reach this listener.
 */
@Component
public class AppointmentEventListener {

    private static final Logger logger = LoggerFactory.getLogger(AppointmentEventListener.class);
    private static final Logger audit = LoggerFactory.getLogger("booking.audit");

    private final AppointmentNotifier appointmentNotifier;

    public AppointmentEventListener(AppointmentNotifier appointmentNotifier) {
        this.appointmentNotifier = appointmentNotifier;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAppointmentEvent(AppointmentEvent event) {
        audit.info("appointment={} business={} type={} actor={} at={} details={}",
                event.appointmentId(), event.businessId(), event.type(), event.actor(),
                event.occurredAt(), event.details());
        try {
            appointmentNotifier.notify(event);
        } catch (RuntimeException e) {
            logger.warn("[AppointmentEventListener] Notification failed for appointment {} ({}): {}",
                    event.appointmentId(), event.type(), e.getMessage(), e);
        }
    }
}
