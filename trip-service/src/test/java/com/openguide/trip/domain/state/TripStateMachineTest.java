package com.openguide.trip.domain.state;

import com.openguide.common.exception.InvalidTransitionException;
import com.openguide.trip.domain.model.TripStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.openguide.trip.domain.model.TripStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TripStateMachineTest {

    @Test
    @DisplayName("Negotiation path from selecting_guide to confirmed is allowed")
    void negotiationPath() {
        assertThat(TripStateMachine.canTransition(DRAFT, SELECTING_GUIDE)).isTrue();
        assertThat(TripStateMachine.canTransition(SELECTING_GUIDE, AWAITING_CALL)).isTrue();
        assertThat(TripStateMachine.canTransition(AWAITING_CALL, IN_CALL)).isTrue();
        assertThat(TripStateMachine.canTransition(IN_CALL, PENDING_CONFIRMATION)).isTrue();
        assertThat(TripStateMachine.canTransition(PENDING_CONFIRMATION, AWAITING_PAYMENT)).isTrue();
        assertThat(TripStateMachine.canTransition(AWAITING_PAYMENT, CONFIRMED)).isTrue();
        assertThat(TripStateMachine.canTransition(CONFIRMED, IN_PROGRESS)).isTrue();
        assertThat(TripStateMachine.canTransition(IN_PROGRESS, COMPLETED)).isTrue();
    }

    @Test
    @DisplayName("Direct accept from in_call skips pending_confirmation")
    void directAcceptFromCall() {
        assertThat(TripStateMachine.canTransition(IN_CALL, AWAITING_PAYMENT)).isTrue();
    }

    @Test
    @DisplayName("Rejected trips can reopen guide selection but cannot pick a guide directly")
    void rejectedTrip() {
        assertThat(TripStateMachine.canTransition(REJECTED, SELECTING_GUIDE)).isTrue();
        assertThat(TripStateMachine.canTransition(REJECTED, AWAITING_CALL)).isFalse();
    }

    @Test
    @DisplayName("Completed and cancelled trips can only be archived")
    void finishedTrips() {
        assertThat(TripStateMachine.allowedTransitions(COMPLETED)).containsExactly(ARCHIVED);
        assertThat(TripStateMachine.allowedTransitions(CANCELLED)).containsExactly(ARCHIVED);
        assertThat(TripStateMachine.isTerminal(ARCHIVED)).isTrue();
        assertThat(TripStateMachine.isTerminal(COMPLETED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(TripStatus.class)
    @DisplayName("No status transitions to itself")
    void noSelfLoops(TripStatus status) {
        assertThat(TripStateMachine.canTransition(status, status)).isFalse();
    }

    @Test
    @DisplayName("Null endpoints are never valid")
    void nullEndpoints() {
        assertThat(TripStateMachine.canTransition(null, CANCELLED)).isFalse();
        assertThat(TripStateMachine.canTransition(CONFIRMED, null)).isFalse();
        assertThat(TripStateMachine.allowedTransitions(null)).isEmpty();
    }

    @Test
    @DisplayName("Invalid transition carries both wire values")
    void invalidTransitionCarriesValues() {
        assertThatThrownBy(() -> TripStateMachine.validateTransition(COMPLETED, IN_PROGRESS))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessage("Cannot transition from completed to in_progress")
                .satisfies(e -> {
                    InvalidTransitionException ex = (InvalidTransitionException) e;
                    assertThat(ex.getFrom()).isEqualTo("completed");
                    assertThat(ex.getTo()).isEqualTo("in_progress");
                    assertThat(ex.getErrorCode()).isEqualTo("INVALID_TRANSITION");
                });
    }
}
