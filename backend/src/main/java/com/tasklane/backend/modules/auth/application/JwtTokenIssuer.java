package com.tasklane.backend.modules.auth.application;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

import com.tasklane.backend.modules.auth.infrastructure.jwt.JwtSigningKeyProvider;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Signs access tokens carrying exactly {@code sub}, {@code iat} and {@code exp}.
 *
 * <p>JWT timestamps have one-second resolution, so {@code now} and the TTL are truncated
 * to whole seconds before signing; the returned {@link IssuedToken} reports the instants
 * that actually went into the token. Output is a pure function of its arguments and the
 * key.
 */
@Service
public class JwtTokenIssuer {

    private final JwtSigningKeyProvider keyProvider;
    private final Duration ttl;

    public JwtTokenIssuer(JwtSigningKeyProvider keyProvider, @Value("${jwt.expiration}") long ttlMillis) {
        this.keyProvider = keyProvider;
        this.ttl = Duration.ofMillis(ttlMillis).truncatedTo(ChronoUnit.SECONDS);
    }

    public IssuedToken issue(UUID accountId, Instant now) {
        Instant issuedAt = now.truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl);

        String token = Jwts.builder()
                .subject(accountId.toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(token, issuedAt, expiresAt);
    }

    public Duration getTtl() {
        return ttl;
    }
}
