package com.openguide.notification.consumer;

import com.openguide.common.util.Constants;
import com.openguide.notification.domain.model.Notification;
import com.openguide.notification.domain.repository.NotificationRepository;
import com.openguide.notification.service.NotificationService;
import com.openguide.notification.service.NotificationTemplates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Consumes trip notifications, stores one document per producer event and hands it off for delivery.
 * The producer delivers at least once, so records are deduplicated on {@code eventId}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TripNotificationConsumer {

    private final NotificationRepository notificationRepository;
    private final NotificationService notificationService;
    private final NotificationTemplates templates;

    @KafkaListener(topics = Constants.TOPIC_TRIP_NOTIFICATIONS, groupId = "notification-service-group")
    public void handle(TripNotificationMessage message) {
        if (message == null || message.getRecipientUserId() == null || message.getEventId() == null) {
            log.warn("Dropping trip notification without recipient or event id: {}", message);
            return;
        }
        String eventId = message.getEventId().toString();
        if (notificationRepository.existsByEventId(eventId)) {
            log.info("Trip notification {} already stored, skipping redelivery", eventId);
            return;
        }
        log.info("Received {} for trip {} (user {})", message.getType(), message.getTripId(), message.getRecipientUserId());

        NotificationTemplates.Rendered rendered = templates.render(message.getType(), message.getPayload());
        Notification notification;
        try {
            notification = notificationRepository.save(Notification.builder()
                    .eventId(eventId)
                    .userId(message.getRecipientUserId())
                    .tripId(message.getTripId() != null ? message.getTripId().toString() : null)
                    .eventType(message.getType())
                    .channel(Notification.NotificationChannel.PUSH)
                    .status(Notification.NotificationStatus.PENDING)
                    .title(rendered.title())
                    .body(rendered.body())
                    .payload(message.getPayload())
                    .occurredAt(message.getTimestamp())
                    .createdAt(Instant.now())
                    .build());
        } catch (DuplicateKeyException e) {
            log.info("Trip notification {} stored concurrently, skipping", eventId);
            return;
        }
        notificationService.deliver(notification);
    }
}
