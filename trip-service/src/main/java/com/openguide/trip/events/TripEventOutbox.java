package com.openguide.trip.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openguide.trip.domain.model.OutboxEvent;
import com.openguide.trip.domain.model.OutboxEventKind;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Appends trip side effects (notifications, audit, real-time status, guide stats) to the outbox inside the
 * caller's transaction. A payload that cannot be serialized is logged and skipped; it never fails the trip write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TripEventOutbox {

    static final String RESOURCE_TRIP = "trip";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void notify(Trip trip, TripNotificationType type, Long recipientUserId, Map<String, Object> payload) {
        if (recipientUserId == null) {
            log.warn("Skipping {} notification for trip {}: no recipient", type, trip.getId());
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tripId", trip.getId());
        body.put("status", trip.getStatus().getValue());
        body.putAll(payload);
        TripNotificationEvent event = TripNotificationEvent.builder()
                .eventId(UUID.randomUUID())
                .tripId(trip.getId())
                .type(type.wireName())
                .recipientUserId(recipientUserId)
                .payload(body)
                .timestamp(clock.instant())
                .build();
        append(OutboxEventKind.NOTIFICATION, trip.getId(), type.wireName(), event);
    }

    public void audit(Long actorId, String action, Trip trip, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .actorId(actorId)
                .action(action)
                .resourceType(RESOURCE_TRIP)
                .resourceId(String.valueOf(trip.getId()))
                .details(details)
                .occurredAt(clock.instant())
                .build();
        append(OutboxEventKind.AUDIT, trip.getId(), action, entry);
    }

    /** Queues a {@code trip_status_updated} broadcast carrying the trip's current status. */
    public void statusChanged(Trip trip) {
        Map<String, Object> extra = new LinkedHashMap<>();
        if (trip.getPaymentStatus() != null) {
            extra.put("paymentStatus", trip.getPaymentStatus().getValue());
        }
        putIfPresent(extra, "confirmedAt", trip.getConfirmedAt());
        putIfPresent(extra, "cancelledAt", trip.getCancelledAt());
        if (trip.getCancelledBy() != null) {
            extra.put("cancelledBy", trip.getCancelledBy().getValue());
        }
        TripStatusChange change = TripStatusChange.builder()
                .tripId(trip.getId())
                .status(trip.getStatus().getValue())
                .extraFields(extra)
                .build();
        append(OutboxEventKind.STATUS_CHANGE, trip.getId(), TripStatusEmitter.EVENT_NAME, change);
    }

    public void guideTripCompleted(Long guideId, UUID tripId) {
        append(OutboxEventKind.GUIDE_TRIP_COMPLETED, tripId, "guide_trip_completed",
                GuideStatsUpdate.builder().guideId(guideId).tripId(tripId).build());
    }

    public void guideRated(Long guideId, UUID tripId, int rating) {
        append(OutboxEventKind.GUIDE_RATED, tripId, "guide_rated",
                GuideStatsUpdate.builder().guideId(guideId).tripId(tripId).rating(rating).build());
    }

    private void append(OutboxEventKind kind, UUID tripId, String eventType, Object body) {
        try {
            Instant now = clock.instant();
            OutboxEvent event = outboxEventRepository.save(OutboxEvent.builder()
                    .tripId(tripId)
                    .kind(kind)
                    .eventType(eventType)
                    .payload(objectMapper.writeValueAsString(body))
                    .status(OutboxEvent.OutboxStatus.PENDING)
                    .attempts(0)
                    .nextAttemptAt(now)
                    .createdAt(now)
                    .build());
            eventPublisher.publishEvent(new OutboxEventAppended(event.getId()));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {} {} for trip {} (non-fatal)", kind, eventType, tripId, e);
        }
    }

    private static void putIfPresent(Map<String, Object> target, String key, Instant value) {
        if (value != null) {
            target.put(key, value.toString());
        }
    }
}
