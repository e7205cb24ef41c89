package com.clinicbooking.bookingservice.event;

/**
 * Delivers appointment notifications to clients or staff. Invoked after the booking has
 * committed; implementations may throw and the booking still stands.
 */
public interface AppointmentNotifier {

    void notify(AppointmentEvent event);
}
