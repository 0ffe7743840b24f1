package com.openguide.trip.domain.model;

import java.util.EnumSet;
import java.util.Set;

public enum CallStatus {
    RINGING,
    ONGOING,
    ENDED,
    CANCELLED;

    public static final Set<CallStatus> LIVE = EnumSet.of(RINGING, ONGOING);

    public boolean isLive() {
        return LIVE.contains(this);
    }
}
