package com.tasklane.backend.modules.auth.presentation.dto;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.tasklane.backend.modules.auth.application.IssuedToken;

public record AccessTokenResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        OffsetDateTime issuedAt,
        OffsetDateTime expiresAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static AccessTokenResponse from(IssuedToken token) {
        return new AccessTokenResponse(
                token.value(),
                DEFAULT_TOKEN_TYPE,
                Duration.between(token.issuedAt(), token.expiresAt()).getSeconds(),
                token.issuedAt().atOffset(ZoneOffset.UTC),
                token.expiresAt().atOffset(ZoneOffset.UTC)
        );
    }
}
