package com.openguide.trip.domain.model;

/**
 * What an outbox row carries and therefore where the relay delivers it.
 */
public enum OutboxEventKind {
    NOTIFICATION,
    AUDIT,
    STATUS_CHANGE,
    GUIDE_TRIP_COMPLETED,
    GUIDE_RATED
}
