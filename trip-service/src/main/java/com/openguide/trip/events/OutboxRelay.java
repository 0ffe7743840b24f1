package com.openguide.trip.events;

import com.openguide.trip.domain.model.OutboxEvent;
import com.openguide.trip.domain.model.OutboxEvent.OutboxStatus;
import com.openguide.trip.domain.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Drains the trip outbox. Each row is delivered right after its transaction commits and, failing that,
 * by the periodic sweep. A conditional claim makes sure only one relay works on a row at a time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxRelay {

    private static final Duration MAX_BACKOFF = Duration.ofHours(1);
    private static final int MAX_ERROR_LENGTH = 1000;

    private final OutboxEventRepository outboxEventRepository;
    private final OutboxDispatcher dispatcher;
    private final Clock clock;

    @Value("${trip.outbox.enabled:true}")
    private boolean enabled;

    @Value("${trip.outbox.batch-size:50}")
    private int batchSize;

    @Value("${trip.outbox.max-attempts:8}")
    private int maxAttempts;

    @Value("${trip.outbox.retry-backoff-seconds:30}")
    private long retryBackoffSeconds;

    /** A PROCESSING claim older than this is considered abandoned. */
    @Value("${trip.outbox.claim-timeout-seconds:120}")
    private long claimTimeoutSeconds;

    @Async("outboxExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onAppended(OutboxEventAppended appended) {
        if (!enabled) return;
        try {
            deliver(appended.outboxEventId());
        } catch (Exception e) {
            log.error("Immediate outbox delivery failed for {}; sweep will retry", appended.outboxEventId(), e);
        }
    }

    @Scheduled(fixedDelayString = "${trip.outbox.relay-interval-ms:5000}")
    public void relayPending() {
        if (!enabled) return;
        Instant now = clock.instant();
        List<UUID> due = outboxEventRepository.findDispatchableIds(OutboxStatus.PENDING, OutboxStatus.PROCESSING,
                now, staleBefore(now), PageRequest.of(0, batchSize));
        if (due.isEmpty()) return;
        log.info("Outbox sweep: {} event(s) due", due.size());
        int delivered = 0;
        for (UUID id : due) {
            try {
                if (deliver(id)) delivered++;
            } catch (Exception e) {
                log.error("Outbox delivery failed for {}", id, e);
            }
        }
        log.info("Outbox sweep completed. Delivered: {}, remaining: {}", delivered, due.size() - delivered);
    }

    /**
     * Claims and delivers one event.
     *
     * @return true if this call delivered it; false if it was not claimable or the sink failed
     */
    public boolean deliver(UUID eventId) {
        Instant now = clock.instant();
        int claimed = outboxEventRepository.claim(eventId, OutboxStatus.PENDING, OutboxStatus.PROCESSING,
                now, staleBefore(now));
        if (claimed == 0) {
            log.debug("Outbox event {} not claimable (delivered, in flight or not due)", eventId);
            return false;
        }
        OutboxEvent event = outboxEventRepository.findById(eventId).orElse(null);
        if (event == null) return false;
        try {
            dispatcher.dispatch(event);
            outboxEventRepository.markDelivered(eventId, OutboxStatus.DELIVERED, clock.instant());
            log.debug("Outbox event {} ({} {}) delivered", eventId, event.getKind(), event.getEventType());
            return true;
        } catch (Exception e) {
            handleFailure(event, e);
            return false;
        }
    }

    private void handleFailure(OutboxEvent event, Exception e) {
        String error = truncate(e.getClass().getSimpleName() + ": " + e.getMessage());
        if (event.getAttempts() >= maxAttempts) {
            log.error("Outbox event {} ({} {}) failed permanently after {} attempts",
                    event.getId(), event.getKind(), event.getEventType(), event.getAttempts(), e);
            outboxEventRepository.markAttemptFailed(event.getId(), OutboxStatus.FAILED, event.getNextAttemptAt(), error);
            return;
        }
        Instant next = clock.instant().plus(backoff(event.getAttempts()));
        log.warn("Outbox event {} ({} {}) attempt {} failed, retrying at {}: {}",
                event.getId(), event.getKind(), event.getEventType(), event.getAttempts(), next, e.getMessage());
        outboxEventRepository.markAttemptFailed(event.getId(), OutboxStatus.PENDING, next, error);
    }

    Duration backoff(int attempts) {
        int exponent = Math.max(0, Math.min(attempts - 1, 16));
        Duration delay = Duration.ofSeconds(retryBackoffSeconds).multipliedBy(1L << exponent);
        return delay.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay;
    }

    private Instant staleBefore(Instant now) {
        return now.minusSeconds(claimTimeoutSeconds);
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
