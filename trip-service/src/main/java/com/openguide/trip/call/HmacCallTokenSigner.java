package com.openguide.trip.call;

import com.openguide.common.exception.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * Token format: {@code base64url(appId|channel|uid|role|expiresAtEpochSeconds).base64url(HMAC-SHA256)}.
 */
@Slf4j
@Component
public class HmacCallTokenSigner implements CallTokenSigner {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final String appId;
    private final String signingSecret;

    public HmacCallTokenSigner(@Value("${trip.call.app-id:open-guide}") String appId,
                               @Value("${trip.call.signing-secret:}") String signingSecret) {
        this.appId = appId;
        this.signingSecret = signingSecret;
        if (signingSecret == null || signingSecret.isBlank()) {
            log.error("Call signing secret is not configured; joining calls will fail until trip.call.signing-secret is set");
        } else if (signingSecret.length() < 32) {
            log.warn("Call signing secret is shorter than the recommended 32 characters");
        }
    }

    @Override
    public String appId() {
        return appId;
    }

    @Override
    public String sign(CallTokenClaims claims) {
        if (signingSecret == null || signingSecret.isBlank()) {
            throw new ServiceUnavailableException("Call transport is not configured");
        }
        String body = String.join("|",
                claims.appId(),
                claims.channel(),
                String.valueOf(claims.uid()),
                claims.role().getValue(),
                String.valueOf(claims.expiresAt().getEpochSecond()));
        String encodedBody = ENCODER.encodeToString(body.getBytes(StandardCharsets.UTF_8));
        return encodedBody + "." + ENCODER.encodeToString(hmac(encodedBody));
    }

    private byte[] hmac(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
