package com.tasklane.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.tasklane.backend.modules.auth.infrastructure.jwt.JwtSigningKeyProvider;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-signing-secret-0123456789-abcdefgh";
    private static final String OTHER_SECRET = "another-signing-secret-9876543210-zyxwvutsrq";
    private static final long TTL_MILLIS = Duration.ofHours(1).toMillis();
    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private final JwtSigningKeyProvider keyProvider = new JwtSigningKeyProvider(SECRET);
    private final JwtTokenIssuer issuer = new JwtTokenIssuer(keyProvider, TTL_MILLIS);
    private final JwtTokenVerifier verifier = new JwtTokenVerifier(keyProvider);

    @Test
    void verifiesOwnTokenBeforeExpiry() {
        UUID accountId = UUID.randomUUID();
        IssuedToken token = issuer.issue(accountId, NOW);

        SessionClaims claims = verifier.verify(token.value(), NOW.plus(Duration.ofMinutes(59)));

        assertThat(claims.subject()).isEqualTo(accountId);
        assertThat(claims.issuedAt()).isEqualTo(NOW);
        assertThat(claims.expiresAt()).isEqualTo(NOW.plusMillis(TTL_MILLIS));
        assertThat(token.expiresAt()).isEqualTo(claims.expiresAt());
    }

    @Test
    void tokenIsRejectedFromTheExpiryInstantOnwards() {
        IssuedToken token = issuer.issue(UUID.randomUUID(), NOW);

        assertThat(verifier.verify(token.value(), token.expiresAt().minusSeconds(1))).isNotNull();
        assertReason(() -> verifier.verify(token.value(), token.expiresAt()), AuthError.EXPIRED);
        assertReason(() -> verifier.verify(token.value(), token.expiresAt().plus(Duration.ofDays(3))), AuthError.EXPIRED);
    }

    @Test
    void subSecondIssueTimeIsTruncated() {
        IssuedToken token = issuer.issue(UUID.randomUUID(), NOW.plusMillis(750));

        assertThat(token.issuedAt()).isEqualTo(NOW);
        assertThat(verifier.verify(token.value(), NOW.plusMillis(900)).issuedAt()).isEqualTo(NOW);
    }

    @Test
    void flippingAnySignatureBitInvalidatesToken() {
        String token = issuer.issue(UUID.randomUUID(), NOW).value();
        String[] parts = token.split("\\.");
        byte[] signature = Base64.getUrlDecoder().decode(parts[2]);

        for (int bit = 0; bit < signature.length * 8; bit++) {
            byte[] tampered = signature.clone();
            tampered[bit / 8] ^= (byte) (1 << (bit % 8));
            String forged = parts[0] + "." + parts[1] + "." + Base64.getUrlEncoder().withoutPadding().encodeToString(tampered);

            assertReason(() -> verifier.verify(forged, NOW), AuthError.INVALID_SIGNATURE);
        }
    }

    @Test
    void rewrittenSubjectIsRejected() {
        String token = issuer.issue(UUID.randomUUID(), NOW).value();
        String[] parts = token.split("\\.");
        String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
        String otherPayload = payload.replaceFirst("\"sub\":\"[^\"]+\"", "\"sub\":\"" + UUID.randomUUID() + "\"");
        String forged = parts[0] + "."
                + Base64.getUrlEncoder().withoutPadding().encodeToString(otherPayload.getBytes(StandardCharsets.UTF_8))
                + "." + parts[2];

        assertReason(() -> verifier.verify(forged, NOW), AuthError.INVALID_SIGNATURE);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenIssuer foreignIssuer = new JwtTokenIssuer(new JwtSigningKeyProvider(OTHER_SECRET), TTL_MILLIS);
        String token = foreignIssuer.issue(UUID.randomUUID(), NOW).value();

        assertReason(() -> verifier.verify(token, NOW), AuthError.INVALID_SIGNATURE);
    }

    @Test
    void garbageAndEmptyTokensAreMalformed() {
        assertReason(() -> verifier.verify("", NOW), AuthError.MALFORMED);
        assertReason(() -> verifier.verify("not-a-jwt", NOW), AuthError.MALFORMED);
        assertReason(() -> verifier.verify("a.b.c", NOW), AuthError.MALFORMED);
    }

    @Test
    void unsignedTokenIsMalformed() {
        String unsigned = Jwts.builder()
                .subject(UUID.randomUUID().toString())
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plusSeconds(60)))
                .compact();

        assertReason(() -> verifier.verify(unsigned, NOW), AuthError.MALFORMED);
    }

    @Test
    void tokenWithExtraClaimIsMalformed() {
        String token = Jwts.builder()
                .subject(UUID.randomUUID().toString())
                .claim("role", "admin")
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plusSeconds(60)))
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();

        assertReason(() -> verifier.verify(token, NOW), AuthError.MALFORMED);
    }

    @Test
    void tokenMissingSubjectOrExpiryIsMalformed() {
        String noSubject = Jwts.builder()
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plusSeconds(60)))
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();
        String noExpiry = Jwts.builder()
                .subject(UUID.randomUUID().toString())
                .issuedAt(Date.from(NOW))
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();
        String nonUuidSubject = Jwts.builder()
                .subject("alice")
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plusSeconds(60)))
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();

        assertReason(() -> verifier.verify(noSubject, NOW), AuthError.MALFORMED);
        assertReason(() -> verifier.verify(noExpiry, NOW), AuthError.MALFORMED);
        assertReason(() -> verifier.verify(nonUuidSubject, NOW), AuthError.MALFORMED);
    }

    @Test
    void issuingIsDeterministicForSameInputs() {
        UUID accountId = UUID.randomUUID();

        assertThat(issuer.issue(accountId, NOW).value()).isEqualTo(issuer.issue(accountId, NOW).value());
    }

    @Test
    void concurrentVerificationsAgree() throws Exception {
        List<UUID> accounts = new ArrayList<>();
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            UUID accountId = UUID.randomUUID();
            accounts.add(accountId);
            tokens.add(issuer.issue(accountId, NOW).value());
        }

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<UUID>> calls = new ArrayList<>();
            for (int round = 0; round < 10; round++) {
                for (String token : tokens) {
                    calls.add(() -> verifier.verify(token, NOW.plusSeconds(5)).subject());
                }
            }
            List<Future<UUID>> results = executor.invokeAll(calls);
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get()).isEqualTo(accounts.get(i % accounts.size()));
            }
        } finally {
            executor.shutdownNow();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private static void assertReason(ThrowingCallable call, AuthError reason) {
        assertThatThrownBy(call)
                .isInstanceOf(InvalidTokenException.class)
                .extracting(ex -> ((InvalidTokenException) ex).getReason())
                .isEqualTo(reason);
    }
}
