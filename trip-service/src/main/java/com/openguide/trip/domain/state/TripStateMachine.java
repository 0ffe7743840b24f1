package com.openguide.trip.domain.state;

import com.openguide.common.exception.InvalidTransitionException;
import com.openguide.trip.domain.model.TripStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.openguide.trip.domain.model.TripStatus.*;

/**
 * Legal trip status transitions. Every status write validates against this table first.
 */
public final class TripStateMachine {

    private static final Map<TripStatus, Set<TripStatus>> TRANSITIONS;

    static {
        Map<TripStatus, Set<TripStatus>> edges = new EnumMap<>(TripStatus.class);
        edges.put(DRAFT, EnumSet.of(SELECTING_GUIDE, CANCELLED));
        edges.put(SELECTING_GUIDE, EnumSet.of(AWAITING_CALL, CANCELLED));
        edges.put(AWAITING_CALL, EnumSet.of(IN_CALL, SELECTING_GUIDE, CANCELLED));
        edges.put(IN_CALL, EnumSet.of(PENDING_CONFIRMATION, AWAITING_CALL, AWAITING_PAYMENT, CANCELLED));
        edges.put(PENDING_CONFIRMATION, EnumSet.of(AWAITING_PAYMENT, REJECTED, AWAITING_CALL, CANCELLED));
        edges.put(AWAITING_PAYMENT, EnumSet.of(CONFIRMED, PENDING_CONFIRMATION, CANCELLED));
        edges.put(CONFIRMED, EnumSet.of(IN_PROGRESS, COMPLETED, CANCELLED));
        edges.put(IN_PROGRESS, EnumSet.of(COMPLETED, CANCELLED));
        edges.put(REJECTED, EnumSet.of(SELECTING_GUIDE, ARCHIVED));
        edges.put(CANCELLED, EnumSet.of(ARCHIVED));
        edges.put(COMPLETED, EnumSet.of(ARCHIVED));
        edges.put(ARCHIVED, EnumSet.noneOf(TripStatus.class));
        edges.replaceAll((from, to) -> Collections.unmodifiableSet(to));
        TRANSITIONS = Collections.unmodifiableMap(edges);
    }

    private TripStateMachine() {
    }

    public static boolean canTransition(TripStatus from, TripStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * @throws InvalidTransitionException carrying both wire values when the edge does not exist
     */
    public static void validateTransition(TripStatus from, TripStatus to) {
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException(valueOf(from), valueOf(to));
        }
    }

    public static Set<TripStatus> allowedTransitions(TripStatus from) {
        return from == null ? Set.of() : TRANSITIONS.get(from);
    }

    public static boolean isTerminal(TripStatus status) {
        return allowedTransitions(status).isEmpty();
    }

    private static String valueOf(TripStatus status) {
        return status == null ? "null" : status.getValue();
    }
}
