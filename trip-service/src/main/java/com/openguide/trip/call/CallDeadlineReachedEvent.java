package com.openguide.trip.call;

import java.util.UUID;

public record CallDeadlineReachedEvent(UUID callId) {
}
