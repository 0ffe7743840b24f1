package com.openguide.trip.call;

import com.openguide.trip.orchestration.TripOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Routes call deadlines to the orchestrator's timeout path, which ends the session and advances the trip.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallTimeoutListener {

    private final TripOrchestrator orchestrator;

    @EventListener
    public void onDeadlineReached(CallDeadlineReachedEvent event) {
        try {
            orchestrator.expireCall(event.callId());
        } catch (Exception e) {
            log.error("Timeout handling failed for call {}; recovery sweep will retry", event.callId(), e);
        }
    }
}
