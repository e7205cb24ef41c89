package com.clinicbooking.bookingservice.event;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AppointmentEventListenerTest {

    @Mock
    private AppointmentNotifier appointmentNotifier;

    private final AppointmentEvent event = new AppointmentEvent(AppointmentEvent.Type.CREATED, 7L, 1L,
            "frontdesk", "1 service(s)", LocalDateTime.of(2024, 6, 1, 8, 0));

    @Test
    void forwardsCommittedEventsToNotifier() {
        new AppointmentEventListener(appointmentNotifier).onAppointmentEvent(event);

        verify(appointmentNotifier).notify(event);
    }

    @Test
    void notifierFailureDoesNotPropagate() {
        doThrow(new IllegalStateException("smtp down")).when(appointmentNotifier).notify(event);

        assertThatCode(() -> new AppointmentEventListener(appointmentNotifier).onAppointmentEvent(event))
                .doesNotThrowAnyException();
        verify(appointmentNotifier).notify(event);
    }
}
