package com.openguide.trip.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Provider event ids that have already settled a trip. Keyed by the provider's event id.
 */
@Entity
@Table(name = "payment_webhook_receipts")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentWebhookReceipt {

    @Id
    @Column(name = "event_id", length = 100)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 60)
    private String eventType;

    @Column(name = "trip_id", nullable = false)
    private UUID tripId;

    @Column(name = "outcome", nullable = false, length = 30)
    private String outcome;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;
}
