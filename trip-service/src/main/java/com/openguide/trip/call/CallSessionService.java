package com.openguide.trip.call;

import com.openguide.common.exception.BusinessRuleViolationException;
import com.openguide.common.exception.ForbiddenException;
import com.openguide.common.exception.ResourceNotFoundException;
import com.openguide.common.exception.ValidationException;
import com.openguide.trip.domain.model.CallEndReason;
import com.openguide.trip.domain.model.CallSession;
import com.openguide.trip.domain.model.CallStatus;
import com.openguide.trip.domain.repository.CallSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle of negotiation calls: ringing on creation, ongoing on first join, ended exactly once.
 */
@Slf4j
@Service
public class CallSessionService {

    static final String CHANNEL_PREFIX = "call_";
    static final int UID_RANGE = 1_000_000;

    private final CallSessionRepository callSessionRepository;
    private final CallTimeoutScheduler timeoutScheduler;
    private final CallTokenSigner tokenSigner;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Value("${trip.call.max-duration-seconds:300}")
    private int maxDurationSeconds;

    @Value("${trip.call.token-margin-seconds:60}")
    private int tokenMarginSeconds;

    public CallSessionService(CallSessionRepository callSessionRepository,
                              CallTimeoutScheduler timeoutScheduler,
                              CallTokenSigner tokenSigner,
                              Clock clock) {
        this.callSessionRepository = callSessionRepository;
        this.timeoutScheduler = timeoutScheduler;
        this.tokenSigner = tokenSigner;
        this.clock = clock;
    }

    @Transactional
    public CallSession createSession(Long touristUserId, Long guideUserId, UUID tripId) {
        if (touristUserId == null || guideUserId == null) {
            throw new ValidationException("Both call parties are required");
        }
        if (touristUserId.equals(guideUserId)) {
            throw new ValidationException("A user cannot call themselves");
        }
        Instant now = clock.instant();
        CallSession session = callSessionRepository.save(CallSession.builder()
                .tripId(tripId)
                .channelName(CHANNEL_PREFIX + UUID.randomUUID().toString().replace("-", ""))
                .touristUserId(touristUserId)
                .guideUserId(guideUserId)
                .touristUid(random.nextInt(UID_RANGE) + 1)
                .guideUid(random.nextInt(UID_RANGE) + UID_RANGE + 1)
                .status(CallStatus.RINGING)
                .maxDurationSeconds(maxDurationSeconds)
                .startedAt(now)
                .deadlineAt(now.plusSeconds(maxDurationSeconds))
                .updatedAt(now)
                .build());
        timeoutScheduler.schedule(session.getId(), session.getDeadlineAt());
        log.info("Call {} created for trip {} (deadline {})", session.getId(), tripId, session.getDeadlineAt());
        return session;
    }

    @Transactional(readOnly = true)
    public Optional<CallSession> findById(UUID callId) {
        return callSessionRepository.findById(callId);
    }

    /**
     * Issues a transport token for the caller. The role comes from the caller's identity, never from input.
     */
    @Transactional
    public CallJoin join(UUID callId, Long userId) {
        CallSession session = callSessionRepository.findById(callId)
                .orElseThrow(() -> new ResourceNotFoundException("Call session", callId));
        CallRole role;
        int uid;
        if (session.getTouristUserId().equals(userId)) {
            role = CallRole.TOURIST;
            uid = session.getTouristUid();
        } else if (session.getGuideUserId().equals(userId)) {
            role = CallRole.GUIDE;
            uid = session.getGuideUid();
        } else {
            throw new ForbiddenException("Only the call's parties can join it");
        }
        if (session.isFinished()) {
            throw new BusinessRuleViolationException("Call has already ended", "CALL_ENDED");
        }
        Instant now = clock.instant();
        Instant expiresAt = now.plusSeconds((long) session.getMaxDurationSeconds() + tokenMarginSeconds);
        String token = tokenSigner.sign(new CallTokenClaims(tokenSigner.appId(), session.getChannelName(), uid, role, expiresAt));
        if (session.getStatus() == CallStatus.RINGING
                && callSessionRepository.markOngoing(callId, CallStatus.RINGING, CallStatus.ONGOING, now) == 1) {
            log.info("Call {} is now ongoing ({} joined)", callId, role.getValue());
        }
        return new CallJoin(callId, session.getTripId(), tokenSigner.appId(), session.getChannelName(), uid, role,
                token, expiresAt, session.getMaxDurationSeconds());
    }

    /**
     * Ends the session once. Ending an already ended session returns it unchanged with {@code endedNow=false}.
     */
    @Transactional
    public CallEndResult end(UUID callId, CallEndReason reason, String summary, BigDecimal negotiatedPrice) {
        CallSession session = callSessionRepository.findById(callId)
                .orElseThrow(() -> new ResourceNotFoundException("Call session", callId));
        if (session.isFinished()) {
            timeoutScheduler.cancel(callId);
            return new CallEndResult(session, false);
        }
        int rows = callSessionRepository.endIfLive(callId, CallStatus.ENDED, reason, summary, negotiatedPrice,
                clock.instant(), CallStatus.LIVE);
        timeoutScheduler.cancel(callId);
        CallSession current = callSessionRepository.findById(callId)
                .orElseThrow(() -> new ResourceNotFoundException("Call session", callId));
        if (rows == 0) {
            log.info("Call {} was ended concurrently ({}), nothing to do", callId, current.getEndReason());
            return new CallEndResult(current, false);
        }
        log.info("Call {} ended: {}", callId, reason);
        return new CallEndResult(current, true);
    }
}
