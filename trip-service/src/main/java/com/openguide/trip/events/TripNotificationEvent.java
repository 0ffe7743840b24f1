package com.openguide.trip.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Message published on {@code trip-notifications}. Consumed by notification-service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripNotificationEvent {
    private UUID eventId;
    private UUID tripId;
    private String type;
    private Long recipientUserId;
    private Map<String, Object> payload;
    private Instant timestamp;
}
