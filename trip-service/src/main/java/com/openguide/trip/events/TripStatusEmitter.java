package com.openguide.trip.events;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes {@code trip_status_updated} events to server-sent-event subscribers of a trip.
 * <p>
 * Best effort: no subscriber, a closed stream or any other failure is logged and dropped. Never throws.
 */
@Slf4j
@Component
public class TripStatusEmitter {

    public static final String EVENT_NAME = "trip_status_updated";

    private final Map<UUID, Set<SseEmitter>> subscribers = new ConcurrentHashMap<>();
    private final Clock clock;

    @Value("${trip.realtime.emitter-timeout-ms:1800000}")
    private long emitterTimeoutMs;

    public TripStatusEmitter(Clock clock) {
        this.clock = clock;
    }

    public SseEmitter subscribe(UUID tripId) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        register(tripId, emitter);
        return emitter;
    }

    void register(UUID tripId, SseEmitter emitter) {
        subscribers.computeIfAbsent(tripId, id -> new CopyOnWriteArraySet<>()).add(emitter);
        emitter.onCompletion(() -> remove(tripId, emitter));
        emitter.onTimeout(() -> remove(tripId, emitter));
        emitter.onError(e -> remove(tripId, emitter));
        log.debug("Subscriber added for trip {} ({} open)", tripId, subscriberCount(tripId));
    }

    /**
     * Broadcasts {@code {tripId, status, timestamp, ...extraFields}} to the trip's subscribers.
     *
     * @return how many subscribers received the event
     */
    public int emitStatusChange(UUID tripId, String status, Map<String, Object> extraFields) {
        try {
            Set<SseEmitter> emitters = subscribers.get(tripId);
            if (emitters == null || emitters.isEmpty()) {
                log.debug("No subscribers for trip {}, status {} not pushed", tripId, status);
                return 0;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("tripId", tripId.toString());
            data.put("status", status);
            data.put("timestamp", clock.instant().toString());
            if (extraFields != null) {
                data.putAll(extraFields);
            }
            int delivered = 0;
            for (SseEmitter emitter : emitters) {
                try {
                    emitter.send(SseEmitter.event().name(EVENT_NAME).data(data));
                    delivered++;
                } catch (Exception e) {
                    log.debug("Dropping subscriber of trip {}: {}", tripId, e.getMessage());
                    remove(tripId, emitter);
                }
            }
            return delivered;
        } catch (Exception e) {
            log.warn("Real-time emit failed for trip {} (non-fatal)", tripId, e);
            return 0;
        }
    }

    public int subscriberCount(UUID tripId) {
        Set<SseEmitter> emitters = subscribers.get(tripId);
        return emitters == null ? 0 : emitters.size();
    }

    private void remove(UUID tripId, SseEmitter emitter) {
        subscribers.computeIfPresent(tripId, (id, set) -> {
            set.remove(emitter);
            return set.isEmpty() ? null : set;
        });
    }
}
