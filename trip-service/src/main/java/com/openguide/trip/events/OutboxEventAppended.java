package com.openguide.trip.events;

import java.util.UUID;

/**
 * In-process signal that an outbox row was written; the relay picks it up after commit.
 */
public record OutboxEventAppended(UUID outboxEventId) {
}
