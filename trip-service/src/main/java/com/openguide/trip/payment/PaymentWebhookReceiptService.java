package com.openguide.trip.payment;

import com.openguide.trip.domain.model.PaymentWebhookReceipt;
import com.openguide.trip.domain.repository.PaymentWebhookReceiptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Provider event ids that already settled a trip. The DB is the source of truth; Redis, when present, is a
 * warm cache in front of it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentWebhookReceiptService {

    private static final String REDIS_RECEIPT_PREFIX = "webhook:payment:";
    private static final Duration REDIS_RECEIPT_TTL = Duration.ofDays(3);

    private final PaymentWebhookReceiptRepository receiptRepository;
    private final Clock clock;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${trip.payment.idempotency-redis-cache:true}")
    private boolean redisCacheEnabled;

    /**
     * Read: Redis first if enabled; on miss or error fall back to the DB.
     */
    public boolean alreadyProcessed(String eventId) {
        if (eventId == null) {
            return false;
        }
        if (redisCacheEnabled && stringRedisTemplate != null) {
            try {
                if (Boolean.TRUE.equals(stringRedisTemplate.hasKey(REDIS_RECEIPT_PREFIX + eventId))) {
                    log.debug("Webhook receipt hit from Redis for event {}", eventId);
                    return true;
                }
            } catch (Exception e) {
                log.debug("Redis receipt read failed, falling back to DB: {}", e.getMessage());
            }
        }
        return receiptRepository.existsById(eventId);
    }

    public void record(PaymentEvent event, UUID tripId, WebhookOutcome outcome) {
        if (event.id() == null) {
            return;
        }
        try {
            receiptRepository.save(PaymentWebhookReceipt.builder()
                    .eventId(event.id())
                    .eventType(event.type())
                    .tripId(tripId)
                    .outcome(outcome.getValue())
                    .receivedAt(clock.instant())
                    .build());
        } catch (DataIntegrityViolationException e) {
            log.info("Webhook receipt for event {} already stored", event.id());
        }
        warmRedisCache(event.id(), outcome);
    }

    /** Best-effort: failure leaves only the DB receipt. */
    private void warmRedisCache(String eventId, WebhookOutcome outcome) {
        if (!redisCacheEnabled || stringRedisTemplate == null) return;
        try {
            stringRedisTemplate.opsForValue().set(REDIS_RECEIPT_PREFIX + eventId, outcome.getValue(), REDIS_RECEIPT_TTL);
        } catch (Exception e) {
            log.warn("Failed to warm Redis webhook receipt for event {} (non-fatal)", eventId, e);
        }
    }
}
