package com.tasklane.backend.modules.auth.application;

import java.time.Instant;
import java.util.Date;
import java.util.Set;
import java.util.UUID;

import com.tasklane.backend.modules.auth.infrastructure.jwt.JwtSigningKeyProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SignatureException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Checks a bearer token in a fixed order: structure, signature, expiry. Holds no mutable
 * state, so a single instance serves any number of concurrent requests without locking.
 */
@Service
public class JwtTokenVerifier {

    private static final Set<String> ACCEPTED_CLAIMS = Set.of(Claims.SUBJECT, Claims.ISSUED_AT, Claims.EXPIRATION);

    private final JwtSigningKeyProvider keyProvider;

    public JwtTokenVerifier(JwtSigningKeyProvider keyProvider) {
        this.keyProvider = keyProvider;
    }

    public SessionClaims verify(String token, Instant now) {
        if (!StringUtils.hasText(token)) {
            throw new InvalidTokenException(AuthError.MALFORMED, "Token is empty");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .clock(() -> Date.from(now))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            throw new InvalidTokenException(AuthError.EXPIRED, "Token expired", ex);
        } catch (SignatureException ex) {
            throw new InvalidTokenException(AuthError.INVALID_SIGNATURE, "Token signature mismatch", ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new InvalidTokenException(AuthError.MALFORMED, "Token could not be parsed", ex);
        }

        SessionClaims sessionClaims = toSessionClaims(claims);
        // exp is exclusive: a token is no longer valid at the instant it expires
        if (sessionClaims.isExpiredAt(now)) {
            throw new InvalidTokenException(AuthError.EXPIRED, "Token expired");
        }
        return sessionClaims;
    }

    private SessionClaims toSessionClaims(Claims claims) {
        if (!ACCEPTED_CLAIMS.containsAll(claims.keySet())) {
            throw new InvalidTokenException(AuthError.MALFORMED, "Token carries unexpected claims");
        }
        try {
            String subject = claims.getSubject();
            Date issuedAt = claims.getIssuedAt();
            Date expiresAt = claims.getExpiration();
            if (subject == null || issuedAt == null || expiresAt == null) {
                throw new InvalidTokenException(AuthError.MALFORMED, "Token is missing required claims");
            }
            return new SessionClaims(UUID.fromString(subject), issuedAt.toInstant(), expiresAt.toInstant());
        } catch (JwtException | IllegalArgumentException ex) {
            throw new InvalidTokenException(AuthError.MALFORMED, "Token claims are invalid", ex);
        }
    }
}
