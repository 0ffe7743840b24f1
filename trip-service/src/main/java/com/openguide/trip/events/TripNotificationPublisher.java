package com.openguide.trip.events;

import com.openguide.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka publisher for trip notifications, keyed by trip id so one trip's messages stay ordered.
 * Waits for the broker ack: the outbox row is only marked delivered once Kafka has the message.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TripNotificationPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${trip.notifications.send-timeout-seconds:10}")
    private long sendTimeoutSeconds;

    public void publish(TripNotificationEvent event) {
        String key = String.valueOf(event.getTripId());
        try {
            SendResult<String, Object> result = kafkaTemplate
                    .send(Constants.TOPIC_TRIP_NOTIFICATIONS, key, event)
                    .get(sendTimeoutSeconds, TimeUnit.SECONDS);
            log.info("Notification {} for trip {} published: offset={}",
                    event.getType(), event.getTripId(), result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationPublishException("Interrupted while publishing notification", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new NotificationPublishException("Failed to publish notification " + event.getType(), e);
        }
    }
}
