package com.openguide.trip.orchestration;

import com.openguide.common.exception.BusinessRuleViolationException;
import com.openguide.common.exception.ConflictException;
import com.openguide.common.exception.ForbiddenException;
import com.openguide.common.exception.InvalidTransitionException;
import com.openguide.trip.api.dto.CheckoutSessionResponse;
import com.openguide.trip.client.DirectoryGateway;
import com.openguide.trip.client.PaymentGateway;
import com.openguide.trip.client.dto.CheckoutSessionRequest;
import com.openguide.trip.client.dto.CheckoutSessionResult;
import com.openguide.trip.domain.model.PaymentStatus;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripStatus;
import com.openguide.trip.domain.store.InMemoryTripStore;
import com.openguide.trip.events.TripEventOutbox;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TripCheckoutServiceTest {

    private static final Long TOURIST_ID = 1L;

    @Mock
    private PaymentGateway paymentGateway;
    @Mock
    private DirectoryGateway directoryGateway;
    @Mock
    private TripEventOutbox outbox;

    private InMemoryTripStore tripStore;
    private TripCheckoutService checkoutService;

    @BeforeEach
    void setUp() {
        tripStore = new InMemoryTripStore();
        checkoutService = new TripCheckoutService(new TripAccess(tripStore, directoryGateway, outbox), tripStore,
                paymentGateway, outbox);
    }

    @Test
    @DisplayName("Checkout charges the negotiated price in minor units and stores the session id")
    void createsCheckoutSession() {
        // given
        UUID tripId = tripStore.put(awaitingPayment(new BigDecimal("90.50"))).getId();
        when(paymentGateway.createCheckoutSession(eq("checkout-" + tripId), any(CheckoutSessionRequest.class)))
                .thenReturn(new CheckoutSessionResult("cs_123", "https://pay.example.com/cs_123"));

        // when
        CheckoutSessionResponse response = checkoutService.createCheckoutSession(TOURIST_ID, tripId);

        // then
        assertThat(response.sessionId()).isEqualTo("cs_123");
        assertThat(response.checkoutUrl()).isEqualTo("https://pay.example.com/cs_123");
        assertThat(response.amount()).isEqualByComparingTo("90.50");
        ArgumentCaptor<CheckoutSessionRequest> request = ArgumentCaptor.forClass(CheckoutSessionRequest.class);
        verify(paymentGateway).createCheckoutSession(eq("checkout-" + tripId), request.capture());
        assertThat(request.getValue().amountMinor()).isEqualTo(9050L);
        assertThat(request.getValue().currency()).isEqualTo("usd");
        assertThat(request.getValue().metadata()).containsEntry(TripCheckoutService.METADATA_TRIP_ID, tripId.toString());
        assertThat(tripStore.findById(tripId).orElseThrow().getPaymentSessionId()).isEqualTo("cs_123");
    }

    @Test
    @DisplayName("Only trips awaiting payment can be checked out")
    void wrongStatus() {
        Trip trip = awaitingPayment(new BigDecimal("90"));
        trip.setStatus(TripStatus.PENDING_CONFIRMATION);
        UUID tripId = tripStore.put(trip).getId();

        assertThatThrownBy(() -> checkoutService.createCheckoutSession(TOURIST_ID, tripId))
                .isInstanceOf(InvalidTransitionException.class);
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("Paid trips and foreign tourists are refused before the provider is called")
    void refusals() {
        Trip paid = awaitingPayment(new BigDecimal("90"));
        paid.setPaymentStatus(PaymentStatus.PAID);
        UUID paidId = tripStore.put(paid).getId();
        UUID otherId = tripStore.put(awaitingPayment(new BigDecimal("90"))).getId();

        assertThatThrownBy(() -> checkoutService.createCheckoutSession(TOURIST_ID, paidId))
                .isInstanceOf(BusinessRuleViolationException.class)
                .extracting("errorCode").isEqualTo("NOT_PAYABLE");
        assertThatThrownBy(() -> checkoutService.createCheckoutSession(2L, otherId))
                .isInstanceOf(ForbiddenException.class);
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("Trip cancelled while the provider call is in flight is a conflict")
    void cancelledDuringCheckout() {
        // given
        UUID tripId = tripStore.put(awaitingPayment(new BigDecimal("90"))).getId();
        when(paymentGateway.createCheckoutSession(any(), any()))
                .thenReturn(new CheckoutSessionResult("cs_456", "https://pay.example.com/cs_456"));
        tripStore.beforeUpdate(() -> {
            Trip current = tripStore.findById(tripId).orElseThrow();
            if (current.getStatus() == TripStatus.AWAITING_PAYMENT) {
                current.setStatus(TripStatus.CANCELLED);
                tripStore.put(current);
            }
        });

        // when / then
        assertThatThrownBy(() -> checkoutService.createCheckoutSession(TOURIST_ID, tripId))
                .isInstanceOf(ConflictException.class);
        assertThat(tripStore.findById(tripId).orElseThrow().getPaymentSessionId()).isNull();
        verify(outbox, never()).audit(any(), any(), any(), any());
    }

    private static Trip awaitingPayment(BigDecimal price) {
        Instant startAt = Instant.parse("2026-04-01T02:00:00Z");
        return Trip.builder()
                .touristId(TOURIST_ID)
                .selectedGuideId(7L)
                .provinceId(5L)
                .startAt(startAt)
                .endAt(startAt.plusSeconds(4 * 3600))
                .negotiatedPrice(price)
                .currency("usd")
                .paymentStatus(PaymentStatus.PENDING)
                .status(TripStatus.AWAITING_PAYMENT)
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }
}
