package com.openguide.notification.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * A trip notification addressed to one user. {@code eventId} is the producer's id and is unique, so a
 * redelivered record is stored once.
 */
@Document(collection = "notifications")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    @Id
    private String id;

    @Indexed(unique = true)
    private String eventId;

    @Indexed
    private Long userId;
    private String tripId;
    private String eventType;
    private NotificationChannel channel;
    private NotificationStatus status;
    private String title;
    private String body;
    private Map<String, Object> payload;
    private boolean read;
    private Instant occurredAt;
    private Instant sentAt;
    private Instant createdAt;

    public enum NotificationChannel {
        PUSH,
        IN_APP
    }

    public enum NotificationStatus {
        PENDING,
        SENT,
        FAILED
    }
}
