package com.openguide.trip.call;

import com.openguide.trip.domain.model.CallSession;
import com.openguide.trip.domain.model.CallStatus;
import com.openguide.trip.domain.repository.CallSessionRepository;
import com.openguide.trip.orchestration.TripOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CallDeadlineRecoveryJobTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private CallSessionRepository callSessionRepository;
    @Mock
    private CallTimeoutScheduler timeoutScheduler;
    @Mock
    private TripOrchestrator orchestrator;

    private CallDeadlineRecoveryJob recoveryJob;

    @BeforeEach
    void setUp() {
        recoveryJob = new CallDeadlineRecoveryJob(callSessionRepository, timeoutScheduler, orchestrator,
                Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(recoveryJob, "recoveryEnabled", true);
    }

    @Test
    @DisplayName("Overdue live calls are expired and future ones get their timer back")
    void recoversDeadlines() {
        // given
        CallSession overdue = session(NOW.minusSeconds(5));
        CallSession armed = session(NOW.plusSeconds(60));
        CallSession lost = session(NOW.plusSeconds(120));
        when(callSessionRepository.findByStatusInAndDeadlineAtLessThanEqual(CallStatus.LIVE, NOW)).thenReturn(List.of(overdue));
        when(callSessionRepository.findByStatusInAndDeadlineAtAfter(CallStatus.LIVE, NOW)).thenReturn(List.of(armed, lost));
        when(timeoutScheduler.isScheduled(armed.getId())).thenReturn(true);
        when(timeoutScheduler.isScheduled(lost.getId())).thenReturn(false);

        // when
        recoveryJob.recoverDeadlines();

        // then
        verify(orchestrator).expireCall(overdue.getId());
        verify(timeoutScheduler).schedule(lost.getId(), lost.getDeadlineAt());
        verify(timeoutScheduler, never()).schedule(armed.getId(), armed.getDeadlineAt());
    }

    @Test
    @DisplayName("One failing expiry does not stop the sweep")
    void failureIsolated() {
        CallSession first = session(NOW.minusSeconds(10));
        CallSession second = session(NOW.minusSeconds(5));
        when(callSessionRepository.findByStatusInAndDeadlineAtLessThanEqual(CallStatus.LIVE, NOW)).thenReturn(List.of(first, second));
        when(callSessionRepository.findByStatusInAndDeadlineAtAfter(CallStatus.LIVE, NOW)).thenReturn(List.of());
        when(orchestrator.expireCall(first.getId())).thenThrow(new IllegalStateException("boom"));

        recoveryJob.recoverDeadlines();

        verify(orchestrator).expireCall(second.getId());
    }

    @Test
    @DisplayName("Disabled recovery does nothing")
    void disabled() {
        ReflectionTestUtils.setField(recoveryJob, "recoveryEnabled", false);

        recoveryJob.recoverDeadlines();

        verifyNoInteractions(callSessionRepository, timeoutScheduler, orchestrator);
        verify(orchestrator, never()).expireCall(any());
    }

    private static CallSession session(Instant deadline) {
        return CallSession.builder()
                .id(UUID.randomUUID())
                .status(CallStatus.ONGOING)
                .deadlineAt(deadline)
                .build();
    }
}
