package com.openguide.trip.payment;

import com.openguide.common.exception.BusinessException;

/**
 * The webhook body could not be authenticated. The provider gets a 400 and nothing in the body is trusted.
 */
public class WebhookSignatureException extends BusinessException {

    public WebhookSignatureException(String message) {
        super(message, "INVALID_SIGNATURE");
    }
}
