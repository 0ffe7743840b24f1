package com.openguide.trip.call;

import java.time.Instant;
import java.util.UUID;

/**
 * What a party needs to connect to the call transport.
 */
public record CallJoin(
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
}
