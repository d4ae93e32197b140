package com.tasklane.backend.modules.auth.application;

import java.time.Instant;

public record IssuedToken(String value, Instant issuedAt, Instant expiresAt) {
}
