package com.openguide.trip.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openguide.trip.client.DirectoryGateway;
import com.openguide.trip.domain.model.AuditRecord;
import com.openguide.trip.domain.model.OutboxEvent;
import com.openguide.trip.domain.repository.AuditRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Delivers one outbox row to its sink. Throws when the sink fails so the relay can retry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxDispatcher {

    private final ObjectMapper objectMapper;
    private final TripNotificationPublisher notificationPublisher;
    private final AuditRecordRepository auditRecordRepository;
    private final TripStatusEmitter statusEmitter;
    private final DirectoryGateway directoryGateway;

    public void dispatch(OutboxEvent event) throws JsonProcessingException {
        switch (event.getKind()) {
            case NOTIFICATION -> notificationPublisher.publish(read(event, TripNotificationEvent.class));
            case AUDIT -> recordAudit(read(event, AuditEntry.class));
            case STATUS_CHANGE -> {
                TripStatusChange change = read(event, TripStatusChange.class);
                statusEmitter.emitStatusChange(change.getTripId(), change.getStatus(), change.getExtraFields());
            }
            case GUIDE_TRIP_COMPLETED -> directoryGateway.incrementGuideTripCount(read(event, GuideStatsUpdate.class).getGuideId());
            case GUIDE_RATED -> {
                GuideStatsUpdate update = read(event, GuideStatsUpdate.class);
                directoryGateway.submitGuideRating(update.getGuideId(), update.getTripId(), update.getRating());
            }
        }
    }

    private void recordAudit(AuditEntry entry) throws JsonProcessingException {
        auditRecordRepository.save(AuditRecord.builder()
                .actorId(entry.getActorId())
                .action(entry.getAction())
                .resourceType(entry.getResourceType())
                .resourceId(entry.getResourceId())
                .details(entry.getDetails() == null ? null : objectMapper.writeValueAsString(entry.getDetails()))
                .createdAt(entry.getOccurredAt())
                .build());
        log.debug("Audit {} recorded for {} {}", entry.getAction(), entry.getResourceType(), entry.getResourceId());
    }

    private <T> T read(OutboxEvent event, Class<T> type) throws JsonProcessingException {
        return objectMapper.readValue(event.getPayload(), type);
    }
}
