package com.openguide.trip.api.dto;

import com.openguide.trip.call.CallJoin;
import com.openguide.trip.call.CallRole;

import java.time.Instant;
import java.util.UUID;

public record CallJoinResponse(
        UUID callId,
        UUID tripId,
        String appId,
        String channel,
        int uid,
        CallRole role,
        String token,
        Instant expiresAt,
        int maxDurationSeconds
) {
    public static CallJoinResponse from(CallJoin join) {
        return new CallJoinResponse(join.callId(), join.tripId(), join.appId(), join.channel(), join.uid(),
                join.role(), join.token(), join.expiresAt(), join.maxDurationSeconds());
    }
}
