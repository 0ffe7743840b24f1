package com.openguide.trip.payment;

/**
 * The fields of a provider event the confirmation flow needs. {@code tripReference} comes from the checkout
 * metadata and may be absent or malformed.
 */
public record PaymentEvent(
        String id,
        String type,
        String sessionId,
        String paymentIntentId,
        String tripReference
) {
    public static final String CHECKOUT_COMPLETED = "checkout.session.completed";

    public boolean isCheckoutCompleted() {
        return CHECKOUT_COMPLETED.equals(type);
    }
}
