package com.tasklane.backend.modules.auth.application;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Typed payload of an access token. Only exists inside a signed token and as the
 * result of a successful verification; never persisted.
 */
public record SessionClaims(UUID subject, Instant issuedAt, Instant expiresAt) {

    public SessionClaims {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
