package com.openguide.common.exception;

/**
 * Well-formed request that a business rule forbids (cancellation window,
 * duplicate trip, guide already booked). Terminal for the request.
 */
public class BusinessRuleViolationException extends BusinessException {
    public BusinessRuleViolationException(String message, String ruleCode) {
        super(message, ruleCode);
    }
}
