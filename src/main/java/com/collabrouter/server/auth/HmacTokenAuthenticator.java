package com.collabrouter.server.auth;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Verifies tokens of the form {@code base64url(name).expiryEpochSeconds.base64url(hmac)},
 * where the HMAC-SHA256 covers the first two parts. A leading {@code "Bearer "} is ignored.
 */
public class HmacTokenAuthenticator implements Authenticator {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String BEARER = "Bearer ";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] secret;
    private final Clock clock;

    public HmacTokenAuthenticator(String secret) {
        this(secret, Clock.systemUTC());
    }

    public HmacTokenAuthenticator(String secret, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Token secret must not be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
    }

    /**
     * Mints a token for {@code name}. Development helper: real deployments issue tokens
     * elsewhere with the same secret.
     */
    public String issue(String name, Duration ttl) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name must not be blank");
        }
        long expiry = clock.instant().plus(ttl).getEpochSecond();
        String payload = ENCODER.encodeToString(name.getBytes(StandardCharsets.UTF_8)) + "." + expiry;
        return payload + "." + ENCODER.encodeToString(sign(payload));
    }

    @Override
    public String authenticate(String credentialToken) throws AuthenticationException {
        if (credentialToken == null || credentialToken.isBlank()) {
            throw new AuthenticationException("No token provided");
        }
        String token = credentialToken.startsWith(BEARER)
            ? credentialToken.substring(BEARER.length())
            : credentialToken;

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw new AuthenticationException("Malformed token");
        }
        String payload = parts[0] + "." + parts[1];
        byte[] presented;
        String name;
        long expiry;
        try {
            presented = DECODER.decode(parts[2]);
            name = new String(DECODER.decode(parts[0]), StandardCharsets.UTF_8);
            expiry = Long.parseLong(parts[1]);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException("Malformed token");
        }
        if (!MessageDigest.isEqual(sign(payload), presented)) {
            throw new AuthenticationException("Invalid token signature");
        }
        if (Instant.ofEpochSecond(expiry).isBefore(clock.instant())) {
            throw new AuthenticationException("Token expired");
        }
        if (name.isBlank()) {
            throw new AuthenticationException("Token carries no name");
        }
        return name;
    }

    private byte[] sign(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            // HmacSHA256 is mandatory on every JDK
            throw new IllegalStateException("HMAC unavailable", e);
        }
    }
}
