package com.openguide.trip.orchestration;

import com.openguide.common.exception.BusinessRuleViolationException;
import com.openguide.common.exception.ConflictException;
import com.openguide.common.exception.InvalidTransitionException;
import com.openguide.trip.api.dto.CheckoutSessionResponse;
import com.openguide.trip.client.PaymentGateway;
import com.openguide.trip.client.dto.CheckoutSessionRequest;
import com.openguide.trip.client.dto.CheckoutSessionResult;
import com.openguide.trip.domain.model.PaymentStatus;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripStatus;
import com.openguide.trip.domain.store.TripPatch;
import com.openguide.trip.domain.store.TripStore;
import com.openguide.trip.domain.store.UpdateResult;
import com.openguide.trip.events.TripEventOutbox;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static com.openguide.trip.orchestration.TripOrchestrator.details;

/**
 * Opens a hosted checkout for a trip awaiting payment. The amount always comes from the trip's negotiated price.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripCheckoutService {

    public static final String METADATA_TRIP_ID = "tripId";
    private static final Set<PaymentStatus> PAYABLE = EnumSet.of(PaymentStatus.UNPAID, PaymentStatus.PENDING);
    private static final BigDecimal MINOR_UNITS = BigDecimal.valueOf(100);

    private final TripAccess access;
    private final TripStore tripStore;
    private final PaymentGateway paymentGateway;
    private final TripEventOutbox outbox;

    /**
     * Not transactional: the provider call sits between the read and the conditional write of the session id.
     */
    public CheckoutSessionResponse createCheckoutSession(Long touristId, UUID tripId) {
        Trip trip = access.load(tripId);
        access.requireTourist(trip, touristId, "pay for it");
        if (trip.getStatus() != TripStatus.AWAITING_PAYMENT) {
            throw new InvalidTransitionException(trip.getStatus().getValue(), TripStatus.CONFIRMED.getValue());
        }
        if (!PAYABLE.contains(trip.getPaymentStatus())) {
            throw new BusinessRuleViolationException("Trip is already " + trip.getPaymentStatus().getValue(), "NOT_PAYABLE");
        }
        BigDecimal price = trip.getNegotiatedPrice();
        if (price == null || price.signum() <= 0) {
            throw new BusinessRuleViolationException("Trip has no payable price", "PRICE_NOT_NEGOTIATED");
        }

        long amountMinor = price.multiply(MINOR_UNITS).setScale(0, RoundingMode.HALF_UP).longValueExact();
        CheckoutSessionResult session = paymentGateway.createCheckoutSession("checkout-" + tripId,
                new CheckoutSessionRequest(amountMinor, trip.getCurrency(), "Guided trip " + tripId,
                        String.valueOf(touristId), Map.of(METADATA_TRIP_ID, tripId.toString())));

        UpdateResult result = tripStore.updateIfStatus(tripId, TripStatus.AWAITING_PAYMENT,
                TripPatch.keepStatus().with(t -> t.setPaymentSessionId(session.sessionId())));
        if (!result.updated()) {
            // the session stays unused; a payment against it is refused by the confirmation handler
            log.warn("Trip {} left awaiting_payment while opening checkout {} (now {})",
                    tripId, session.sessionId(), result.trip().getStatus().getValue());
            throw new ConflictException("Trip was updated by another request. Please refresh and try again.");
        }
        outbox.audit(touristId, "create_checkout_session", result.trip(), details(
                "sessionId", session.sessionId(),
                "amountMinor", amountMinor));
        return new CheckoutSessionResponse(session.sessionId(), session.checkoutUrl(), price, trip.getCurrency());
    }
}
