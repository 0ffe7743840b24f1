package com.openguide.trip.payment;

import com.openguide.common.exception.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Verifies {@code t=<unix seconds>,v1=<hex hmac>[,v1=...]} signatures: HMAC-SHA256 over {@code t + "." + body}
 * with the shared webhook secret, timestamp within the configured tolerance.
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SIGNATURE_SCHEME = "v1";

    private final String webhookSecret;
    private final long toleranceSeconds;
    private final Clock clock;

    public WebhookSignatureVerifier(@Value("${trip.payment.webhook-secret:}") String webhookSecret,
                                    @Value("${trip.payment.signature-tolerance-seconds:300}") long toleranceSeconds,
                                    Clock clock) {
        this.webhookSecret = webhookSecret;
        this.toleranceSeconds = toleranceSeconds;
        this.clock = clock;
    }

    /**
     * @throws WebhookSignatureException  when the header is missing, malformed, stale or does not match
     * @throws ServiceUnavailableException when no webhook secret is configured
     */
    public void verify(String payload, String signatureHeader) {
        if (webhookSecret == null || webhookSecret.isBlank()) {
            log.error("Webhook secret is not configured; rejecting delivery");
            throw new ServiceUnavailableException("Webhook secret not configured");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookSignatureException("Missing signature header");
        }

        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String part : signatureHeader.split(",")) {
            String[] kv = part.trim().split("=", 2);
            if (kv.length != 2) continue;
            if ("t".equals(kv[0])) {
                try {
                    timestamp = Long.parseLong(kv[1]);
                } catch (NumberFormatException e) {
                    throw new WebhookSignatureException("Malformed signature timestamp");
                }
            } else if (SIGNATURE_SCHEME.equals(kv[0])) {
                signatures.add(kv[1]);
            }
        }
        if (timestamp == null || signatures.isEmpty()) {
            throw new WebhookSignatureException("Signature header has no timestamp or no v1 signature");
        }
        long age = Math.abs(clock.instant().getEpochSecond() - timestamp);
        if (age > toleranceSeconds) {
            throw new WebhookSignatureException("Signature timestamp outside the tolerance window");
        }

        byte[] expected = HexFormat.of().formatHex(hmac(timestamp + "." + payload))
                .getBytes(StandardCharsets.UTF_8);
        for (String candidate : signatures) {
            if (MessageDigest.isEqual(expected, candidate.toLowerCase().getBytes(StandardCharsets.UTF_8))) {
                return;
            }
        }
        throw new WebhookSignatureException("No signature matches the payload");
    }

    /** Header value for a payload; used by tests and local tooling. */
    public String sign(String payload, long timestampSeconds) {
        return "t=" + timestampSeconds + "," + SIGNATURE_SCHEME + "="
                + HexFormat.of().formatHex(hmac(timestampSeconds + "." + payload));
    }

    private byte[] hmac(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(webhookSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
