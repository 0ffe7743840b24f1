package com.openguide.trip.call;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * In-process auto-end timers for live calls, one per call id.
 * <p>
 * Timers are lost on restart; the deadline persisted on the session lets {@link CallDeadlineRecoveryJob} rebuild
 * them. Firing publishes a {@link CallDeadlineReachedEvent}.
 */
@Slf4j
@Component
public class CallTimeoutScheduler {

    private final TaskScheduler taskScheduler;
    private final ApplicationEventPublisher eventPublisher;
    private final Map<UUID, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public CallTimeoutScheduler(@Qualifier("callTimeoutScheduler") TaskScheduler taskScheduler,
                                ApplicationEventPublisher eventPublisher) {
        this.taskScheduler = taskScheduler;
        this.eventPublisher = eventPublisher;
    }

    /** Schedules after the surrounding transaction commits, or immediately without one. */
    public void schedule(UUID callId, Instant deadline) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    scheduleNow(callId, deadline);
                }
            });
        } else {
            scheduleNow(callId, deadline);
        }
    }

    public boolean cancel(UUID callId) {
        ScheduledFuture<?> future = pending.remove(callId);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        log.debug("Auto-end timer cancelled for call {}", callId);
        return true;
    }

    public boolean isScheduled(UUID callId) {
        return pending.containsKey(callId);
    }

    private void scheduleNow(UUID callId, Instant deadline) {
        ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(callId), deadline);
        ScheduledFuture<?> previous = pending.put(callId, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("Auto-end timer set for call {} at {}", callId, deadline);
    }

    private void fire(UUID callId) {
        pending.remove(callId);
        log.info("Call {} reached its deadline", callId);
        try {
            eventPublisher.publishEvent(new CallDeadlineReachedEvent(callId));
        } catch (Exception e) {
            log.error("Auto-end handling failed for call {}; recovery sweep will retry", callId, e);
        }
    }
}
