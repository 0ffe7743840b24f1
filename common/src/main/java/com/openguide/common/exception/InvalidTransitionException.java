package com.openguide.common.exception;

import lombok.Getter;

/**
 * A requested status change that is not an edge of the lifecycle graph.
 */
@Getter
public class InvalidTransitionException extends BusinessException {
    private final String from;
    private final String to;

    public InvalidTransitionException(String from, String to) {
        super(String.format("Cannot transition from %s to %s", from, to), "INVALID_TRANSITION");
        this.from = from;
        this.to = to;
    }
}
