package com.openguide.trip.domain.repository;

import com.openguide.trip.domain.model.PaymentWebhookReceipt;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PaymentWebhookReceiptRepository extends JpaRepository<PaymentWebhookReceipt, String> {
}
