package com.tasklane.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.tasklane.backend.global.error.ConfigurationFailureException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

/**
 * Process-wide HMAC signing key, loaded once at startup and handed to the token
 * issuer and verifier. The secret may be Base64 or raw UTF-8 and must be at least
 * 256 bits, the HS256 minimum.
 */
@Component
@DependsOn("environmentValidator")
public class JwtSigningKeyProvider {

    static final String HMAC_SHA_256 = "HmacSHA256";
    static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtSigningKeyProvider(@Value("${jwt.secret:}") String secretString) {
        this.secretKey = new SecretKeySpec(decode(secretString), HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    private static byte[] decode(String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new ConfigurationFailureException("jwt.secret is not configured; refusing to issue unsigned tokens");
        }
        String trimmed = secretString.trim();
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(trimmed);
        } catch (IllegalArgumentException ex) {
            keyBytes = trimmed.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new ConfigurationFailureException(
                    "jwt.secret must decode to at least " + MIN_KEY_BYTES + " bytes, got " + keyBytes.length);
        }
        return keyBytes;
    }
}
