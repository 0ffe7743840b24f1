package com.openguide.trip.call;

import com.openguide.trip.domain.model.CallSession;
import com.openguide.trip.domain.model.CallStatus;
import com.openguide.trip.domain.repository.CallSessionRepository;
import com.openguide.trip.orchestration.TripOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Rebuilds call auto-end timers from persisted deadlines: expires live calls past their deadline and re-arms
 * timers for the rest. Runs at startup and periodically.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallDeadlineRecoveryJob {

    private final CallSessionRepository callSessionRepository;
    private final CallTimeoutScheduler timeoutScheduler;
    private final TripOrchestrator orchestrator;
    private final Clock clock;

    @Value("${trip.call.recovery-enabled:true}")
    private boolean recoveryEnabled;

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        log.info("Recovering call deadlines after startup");
        recoverDeadlines();
    }

    @Scheduled(fixedDelayString = "${trip.call.recovery-interval-ms:30000}")
    public void recoverDeadlines() {
        if (!recoveryEnabled) return;
        Instant now = clock.instant();

        List<CallSession> overdue = callSessionRepository.findByStatusInAndDeadlineAtLessThanEqual(CallStatus.LIVE, now);
        if (!overdue.isEmpty()) {
            log.info("Call recovery: {} live call(s) past their deadline", overdue.size());
        }
        for (CallSession session : overdue) {
            try {
                timeoutScheduler.cancel(session.getId());
                orchestrator.expireCall(session.getId());
            } catch (Exception e) {
                log.error("Recovery failed to expire call {}", session.getId(), e);
            }
        }

        for (CallSession session : callSessionRepository.findByStatusInAndDeadlineAtAfter(CallStatus.LIVE, now)) {
            if (!timeoutScheduler.isScheduled(session.getId())) {
                log.info("Call recovery: re-arming timer for call {} (deadline {})", session.getId(), session.getDeadlineAt());
                timeoutScheduler.schedule(session.getId(), session.getDeadlineAt());
            }
        }
    }
}
