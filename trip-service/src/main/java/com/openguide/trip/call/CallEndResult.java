package com.openguide.trip.call;

import com.openguide.trip.domain.model.CallSession;

/**
 * {@code endedNow} is false when the session had already ended; {@code session} is then the untouched record.
 */
public record CallEndResult(CallSession session, boolean endedNow) {
}
