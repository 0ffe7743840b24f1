package com.openguide.trip.events;

public class NotificationPublishException extends RuntimeException {
    public NotificationPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
