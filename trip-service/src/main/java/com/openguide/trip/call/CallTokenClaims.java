package com.openguide.trip.call;

import java.time.Instant;

public record CallTokenClaims(
        String appId,
        String channel,
        int uid,
        CallRole role,
        Instant expiresAt
) {
}
