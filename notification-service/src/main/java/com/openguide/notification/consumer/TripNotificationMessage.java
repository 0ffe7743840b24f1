package com.openguide.notification.consumer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Wire shape of a record on the {@code trip-notifications} topic.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripNotificationMessage {
    private UUID eventId;
    private UUID tripId;
    private String type;
    private Long recipientUserId;
    private Map<String, Object> payload;
    private Instant timestamp;
}
