package com.openguide.trip.call;

/**
 * Issues transport tokens for the call provider. Opaque to the rest of the service.
 */
public interface CallTokenSigner {

    String appId();

    String sign(CallTokenClaims claims);
}
