package com.openguide.notification.consumer;

import com.openguide.notification.domain.model.Notification;
import com.openguide.notification.domain.repository.NotificationRepository;
import com.openguide.notification.service.NotificationService;
import com.openguide.notification.service.NotificationTemplates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TripNotificationConsumerTest {

    @Mock
    private NotificationRepository notificationRepository;
    @Mock
    private NotificationService notificationService;

    private TripNotificationConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new TripNotificationConsumer(notificationRepository, notificationService, new NotificationTemplates());
    }

    @Test
    @DisplayName("New event is rendered, stored once and handed to delivery")
    void storesAndDelivers() {
        // given
        TripNotificationMessage message = message("payment_required", Map.of("amount", 90, "currency", "usd"));
        when(notificationRepository.existsByEventId(message.getEventId().toString())).thenReturn(false);
        when(notificationRepository.save(any(Notification.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // when
        consumer.handle(message);

        // then
        ArgumentCaptor<Notification> saved = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(saved.capture());
        Notification notification = saved.getValue();
        assertThat(notification.getEventId()).isEqualTo(message.getEventId().toString());
        assertThat(notification.getUserId()).isEqualTo(70L);
        assertThat(notification.getTripId()).isEqualTo(message.getTripId().toString());
        assertThat(notification.getStatus()).isEqualTo(Notification.NotificationStatus.PENDING);
        assertThat(notification.getTitle()).isEqualTo("Payment required");
        assertThat(notification.getBody()).contains("90 USD");
        verify(notificationService).deliver(notification);
    }

    @Test
    @DisplayName("Redelivered event is skipped")
    void redeliverySkipped() {
        TripNotificationMessage message = message("trip_confirmed", Map.of());
        when(notificationRepository.existsByEventId(message.getEventId().toString())).thenReturn(true);

        consumer.handle(message);

        verify(notificationRepository, never()).save(any());
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("Concurrent duplicate losing on the unique index is not delivered twice")
    void concurrentDuplicate() {
        TripNotificationMessage message = message("incoming_call", Map.of());
        when(notificationRepository.existsByEventId(message.getEventId().toString())).thenReturn(false);
        when(notificationRepository.save(any(Notification.class))).thenThrow(new DuplicateKeyException("eventId"));

        consumer.handle(message);

        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("Message without a recipient is dropped")
    void missingRecipient() {
        TripNotificationMessage message = message("trip_started", Map.of());
        message.setRecipientUserId(null);

        consumer.handle(message);

        verifyNoInteractions(notificationRepository, notificationService);
    }

    private static TripNotificationMessage message(String type, Map<String, Object> payload) {
        return TripNotificationMessage.builder()
                .eventId(UUID.randomUUID())
                .tripId(UUID.randomUUID())
                .type(type)
                .recipientUserId(70L)
                .payload(payload)
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }
}
