package com.openguide.trip.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openguide.trip.client.DirectoryGateway;
import com.openguide.trip.domain.model.AuditRecord;
import com.openguide.trip.domain.model.OutboxEvent;
import com.openguide.trip.domain.model.OutboxEventKind;
import com.openguide.trip.domain.model.PaymentStatus;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripStatus;
import com.openguide.trip.domain.repository.AuditRecordRepository;
import com.openguide.trip.domain.repository.OutboxEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Appends through {@link TripEventOutbox} and replays the stored row through {@link OutboxDispatcher}.
 */
@ExtendWith(MockitoExtension.class)
class TripEventOutboxTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final UUID TRIP_ID = UUID.fromString("6f1c2b7e-9a1d-4f3e-8b2a-0c5d7e9f1a2b");

    @Mock
    private OutboxEventRepository outboxEventRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private TripNotificationPublisher notificationPublisher;
    @Mock
    private AuditRecordRepository auditRecordRepository;
    @Mock
    private TripStatusEmitter statusEmitter;
    @Mock
    private DirectoryGateway directoryGateway;

    private TripEventOutbox outbox;
    private OutboxDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        outbox = new TripEventOutbox(outboxEventRepository, objectMapper, eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
        dispatcher = new OutboxDispatcher(objectMapper, notificationPublisher, auditRecordRepository, statusEmitter,
                directoryGateway);
        lenient().when(outboxEventRepository.save(any(OutboxEvent.class))).thenAnswer(invocation -> {
            OutboxEvent event = invocation.getArgument(0);
            event.setId(UUID.randomUUID());
            return event;
        });
    }

    @Test
    @DisplayName("Notification row carries the recipient and reaches the publisher intact")
    void notificationRoundTrip() throws Exception {
        // when
        outbox.notify(trip(), TripNotificationType.GUIDE_SELECTED, 70L, Map.of("touristId", 1L));

        // then
        OutboxEvent row = savedRow();
        assertThat(row.getKind()).isEqualTo(OutboxEventKind.NOTIFICATION);
        assertThat(row.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PENDING);
        assertThat(row.getNextAttemptAt()).isEqualTo(NOW);
        verify(eventPublisher).publishEvent(new OutboxEventAppended(row.getId()));

        dispatcher.dispatch(row);
        ArgumentCaptor<TripNotificationEvent> published = ArgumentCaptor.forClass(TripNotificationEvent.class);
        verify(notificationPublisher).publish(published.capture());
        assertThat(published.getValue().getRecipientUserId()).isEqualTo(70L);
        assertThat(published.getValue().getType()).isEqualTo(TripNotificationType.GUIDE_SELECTED.wireName());
        assertThat(published.getValue().getTimestamp()).isEqualTo(NOW);
        assertThat(published.getValue().getPayload())
                .containsEntry("status", "awaiting_call")
                .containsEntry("tripId", TRIP_ID.toString());
    }

    @Test
    @DisplayName("Notification without a recipient is not queued")
    void notificationWithoutRecipient() {
        outbox.notify(trip(), TripNotificationType.TRIP_CANCELLED, null, Map.of());

        verify(outboxEventRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Status change row is broadcast with the payment status")
    void statusChangeRoundTrip() throws Exception {
        outbox.statusChanged(trip());

        dispatcher.dispatch(savedRow());

        ArgumentCaptor<Map<String, Object>> extra = ArgumentCaptor.forClass(Map.class);
        verify(statusEmitter).emitStatusChange(eq(TRIP_ID), eq("awaiting_call"), extra.capture());
        assertThat(extra.getValue()).containsEntry("paymentStatus", "unpaid");
    }

    @Test
    @DisplayName("Audit row becomes an audit record with JSON details")
    void auditRoundTrip() throws Exception {
        outbox.audit(1L, "select_guide", trip(), Map.of("guideId", 7));

        dispatcher.dispatch(savedRow());

        ArgumentCaptor<AuditRecord> record = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditRecordRepository).save(record.capture());
        assertThat(record.getValue().getAction()).isEqualTo("select_guide");
        assertThat(record.getValue().getResourceId()).isEqualTo(TRIP_ID.toString());
        assertThat(record.getValue().getDetails()).isEqualTo("{\"guideId\":7}");
    }

    @Test
    @DisplayName("Guide stats rows go to the directory")
    void guideStatsRoundTrip() throws Exception {
        outbox.guideRated(7L, TRIP_ID, 5);

        dispatcher.dispatch(savedRow());

        verify(directoryGateway).submitGuideRating(7L, TRIP_ID, 5);
    }

    private OutboxEvent savedRow() {
        ArgumentCaptor<OutboxEvent> saved = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(saved.capture());
        return saved.getValue();
    }

    private static Trip trip() {
        return Trip.builder()
                .id(TRIP_ID)
                .touristId(1L)
                .selectedGuideId(7L)
                .provinceId(5L)
                .startAt(NOW.plusSeconds(86_400))
                .currency("usd")
                .paymentStatus(PaymentStatus.UNPAID)
                .status(TripStatus.AWAITING_CALL)
                .build();
    }
}
