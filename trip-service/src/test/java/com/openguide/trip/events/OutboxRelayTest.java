package com.openguide.trip.events;

import com.openguide.trip.domain.model.OutboxEvent;
import com.openguide.trip.domain.model.OutboxEvent.OutboxStatus;
import com.openguide.trip.domain.model.OutboxEventKind;
import com.openguide.trip.domain.repository.OutboxEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutboxRelayTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant STALE_BEFORE = NOW.minusSeconds(120);

    @Mock
    private OutboxEventRepository outboxEventRepository;
    @Mock
    private OutboxDispatcher dispatcher;

    private OutboxRelay relay;

    @BeforeEach
    void setUp() {
        relay = new OutboxRelay(outboxEventRepository, dispatcher, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(relay, "enabled", true);
        ReflectionTestUtils.setField(relay, "batchSize", 50);
        ReflectionTestUtils.setField(relay, "maxAttempts", 8);
        ReflectionTestUtils.setField(relay, "retryBackoffSeconds", 30L);
        ReflectionTestUtils.setField(relay, "claimTimeoutSeconds", 120L);
    }

    @Test
    @DisplayName("Claimed event is dispatched and marked delivered")
    void deliversClaimedEvent() throws Exception {
        // given
        OutboxEvent event = event(1);
        when(outboxEventRepository.claim(event.getId(), OutboxStatus.PENDING, OutboxStatus.PROCESSING, NOW, STALE_BEFORE))
                .thenReturn(1);
        when(outboxEventRepository.findById(event.getId())).thenReturn(Optional.of(event));

        // when
        boolean delivered = relay.deliver(event.getId());

        // then
        assertThat(delivered).isTrue();
        verify(dispatcher).dispatch(event);
        verify(outboxEventRepository).markDelivered(event.getId(), OutboxStatus.DELIVERED, NOW);
    }

    @Test
    @DisplayName("Event owned by another relay is left alone")
    void notClaimable() throws Exception {
        UUID id = UUID.randomUUID();
        when(outboxEventRepository.claim(id, OutboxStatus.PENDING, OutboxStatus.PROCESSING, NOW, STALE_BEFORE))
                .thenReturn(0);

        assertThat(relay.deliver(id)).isFalse();
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    @DisplayName("Failed attempt goes back to pending with exponential backoff")
    void failedAttemptRetried() throws Exception {
        // given
        OutboxEvent event = event(3);
        when(outboxEventRepository.claim(event.getId(), OutboxStatus.PENDING, OutboxStatus.PROCESSING, NOW, STALE_BEFORE))
                .thenReturn(1);
        when(outboxEventRepository.findById(event.getId())).thenReturn(Optional.of(event));
        doThrow(new IllegalStateException("broker down")).when(dispatcher).dispatch(event);

        // when
        boolean delivered = relay.deliver(event.getId());

        // then 30s x 2^(3-1)
        assertThat(delivered).isFalse();
        verify(outboxEventRepository).markAttemptFailed(eq(event.getId()), eq(OutboxStatus.PENDING),
                eq(NOW.plusSeconds(120)), eq("IllegalStateException: broker down"));
        verify(outboxEventRepository, never()).markDelivered(any(), any(), any());
    }

    @Test
    @DisplayName("Event is parked as failed once attempts are exhausted")
    void attemptsExhausted() throws Exception {
        OutboxEvent event = event(8);
        when(outboxEventRepository.claim(event.getId(), OutboxStatus.PENDING, OutboxStatus.PROCESSING, NOW, STALE_BEFORE))
                .thenReturn(1);
        when(outboxEventRepository.findById(event.getId())).thenReturn(Optional.of(event));
        doThrow(new IllegalStateException("still down")).when(dispatcher).dispatch(event);

        relay.deliver(event.getId());

        verify(outboxEventRepository).markAttemptFailed(eq(event.getId()), eq(OutboxStatus.FAILED), any(), anyString());
    }

    @Test
    @DisplayName("Backoff doubles per attempt and is capped at one hour")
    void backoff() {
        assertThat(relay.backoff(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(relay.backoff(2)).isEqualTo(Duration.ofSeconds(60));
        assertThat(relay.backoff(5)).isEqualTo(Duration.ofSeconds(480));
        assertThat(relay.backoff(20)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("Sweep delivers every due event and keeps going past failures")
    void sweep() throws Exception {
        // given
        OutboxEvent first = event(1);
        OutboxEvent second = event(1);
        when(outboxEventRepository.findDispatchableIds(eq(OutboxStatus.PENDING), eq(OutboxStatus.PROCESSING),
                eq(NOW), eq(STALE_BEFORE), any(Pageable.class))).thenReturn(List.of(first.getId(), second.getId()));
        when(outboxEventRepository.claim(any(), eq(OutboxStatus.PENDING), eq(OutboxStatus.PROCESSING), eq(NOW), eq(STALE_BEFORE)))
                .thenReturn(1);
        when(outboxEventRepository.findById(first.getId())).thenReturn(Optional.of(first));
        when(outboxEventRepository.findById(second.getId())).thenReturn(Optional.of(second));
        doThrow(new IllegalStateException("boom")).when(dispatcher).dispatch(first);

        // when
        relay.relayPending();

        // then
        verify(dispatcher).dispatch(second);
        verify(outboxEventRepository).markDelivered(second.getId(), OutboxStatus.DELIVERED, NOW);
    }

    @Test
    @DisplayName("Disabled relay does not touch the outbox")
    void disabled() {
        ReflectionTestUtils.setField(relay, "enabled", false);

        relay.relayPending();
        relay.onAppended(new OutboxEventAppended(UUID.randomUUID()));

        verifyNoInteractions(outboxEventRepository, dispatcher);
    }

    private static OutboxEvent event(int attempts) {
        return OutboxEvent.builder()
                .id(UUID.randomUUID())
                .tripId(UUID.randomUUID())
                .kind(OutboxEventKind.AUDIT)
                .eventType("select_guide")
                .payload("{}")
                .status(OutboxStatus.PROCESSING)
                .attempts(attempts)
                .nextAttemptAt(NOW)
                .createdAt(NOW)
                .build();
    }
}
