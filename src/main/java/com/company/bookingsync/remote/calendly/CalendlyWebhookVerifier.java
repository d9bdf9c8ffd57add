package com.company.bookingsync.remote.calendly;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.exception.InvalidWebhookSignatureException;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Checks the {@code Calendly-Webhook-Signature} header: {@code t=<epoch seconds>,v1=<hex>}
 * where {@code v1} is HMAC-SHA256 over {@code t + "." + rawBody} with the signing key.
 */
@Component
public class CalendlyWebhookVerifier {

    public static final String SIGNATURE_HEADER = "Calendly-Webhook-Signature";

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final SyncProperties.Calendly settings;
    private final Clock clock;

    public CalendlyWebhookVerifier(SyncProperties properties, Clock clock) {
        this.settings = properties.getCalendly();
        this.clock = clock;
    }

    /**
     * @throws InvalidWebhookSignatureException when the header is missing, malformed, stale or wrong
     */
    public void verify(String signatureHeader, String rawBody) {
        String signingKey = settings.getWebhookSigningKey();
        if (signingKey == null || signingKey.isBlank()) {
            throw new InvalidWebhookSignatureException("Webhook signing key is not configured");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidWebhookSignatureException("Missing " + SIGNATURE_HEADER + " header");
        }

        String timestamp = null;
        String signature = null;
        for (String part : signatureHeader.split(",")) {
            String trimmed = part.trim();
            if (trimmed.startsWith("t=")) {
                timestamp = trimmed.substring(2);
            } else if (trimmed.startsWith("v1=")) {
                signature = trimmed.substring(3);
            }
        }
        if (timestamp == null || signature == null) {
            throw new InvalidWebhookSignatureException("Malformed " + SIGNATURE_HEADER + " header");
        }

        Instant signedAt;
        try {
            signedAt = Instant.ofEpochSecond(Long.parseLong(timestamp));
        } catch (NumberFormatException e) {
            throw new InvalidWebhookSignatureException("Malformed signature timestamp");
        }
        Duration age = Duration.between(signedAt, clock.instant()).abs();
        if (age.compareTo(settings.getWebhookTolerance()) > 0) {
            throw new InvalidWebhookSignatureException("Signature timestamp outside tolerance");
        }

        byte[] expected = sign(signingKey, timestamp + "." + rawBody);
        byte[] actual;
        try {
            actual = HexFormat.of().parseHex(signature);
        } catch (IllegalArgumentException e) {
            throw new InvalidWebhookSignatureException("Malformed signature value");
        }
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new InvalidWebhookSignatureException("Signature mismatch");
        }
    }

    static byte[] sign(String signingKey, String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingKey.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
