package com.qqsuccubus.delivery.core.resume;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Signed token letting a client resume its session on any connection.
 * <p>
 * <b>Token format:</b> {@code sessionId:ts:hmac}, Base64 URL-encoded
 * <ul>
 *   <li>{@code sessionId}: Logical session the token was issued for</li>
 *   <li>{@code ts}: Issue timestamp (epoch seconds)</li>
 *   <li>{@code hmac}: HMAC-SHA256 over "sessionId:ts"</li>
 * </ul>
 * </p>
 * <p>
 * The token carries no delivery position; the client reports its own last acknowledged
 * sequence on reconnect.
 * </p>
 */
public final class ResumeToken {
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String DELIMITER = ":";
    // Tokens issued by a node whose clock runs slightly ahead
    private static final long CLOCK_SKEW_SEC = 60;

    private ResumeToken() {
    }

    /**
     * @param secret HMAC secret key (must be the same on every node)
     * @return Base64-encoded resume token
     */
    public static String generate(String sessionId, Instant issuedAt, String secret) {
        String payload = sessionId + DELIMITER + issuedAt.getEpochSecond();
        String token = payload + DELIMITER + computeHmac(payload, secret);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Verifies signature and age.
     *
     * @return the session id, or empty if the token is malformed, forged or older than {@code ttl}
     */
    public static Optional<String> verify(String token, String secret, Duration ttl, Instant now) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        // Session ids may contain the delimiter, so split from the right
        int hmacAt = decoded.lastIndexOf(DELIMITER);
        int tsAt = hmacAt > 0 ? decoded.lastIndexOf(DELIMITER, hmacAt - 1) : -1;
        if (tsAt <= 0) {
            return Optional.empty();
        }
        String sessionId = decoded.substring(0, tsAt);
        String payload = decoded.substring(0, hmacAt);
        String providedHmac = decoded.substring(hmacAt + 1);

        long epochSec;
        try {
            epochSec = Long.parseLong(decoded.substring(tsAt + 1, hmacAt));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        byte[] expected = computeHmac(payload, secret).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, providedHmac.getBytes(StandardCharsets.UTF_8))) {
            return Optional.empty();
        }

        long age = now.getEpochSecond() - epochSec;
        if (age < -CLOCK_SKEW_SEC || age > ttl.getSeconds()) {
            return Optional.empty();
        }
        return Optional.of(sessionId);
    }

    private static String computeHmac(String data, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute HMAC", e);
        }
    }
}
