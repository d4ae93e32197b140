package com.tasklane.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.tasklane.backend.modules.auth.domain.Account;

public record AccountResponse(
        UUID id,
        String loginHandle,
        OffsetDateTime createdAt
) {

    public static AccountResponse from(Account account) {
        return new AccountResponse(account.getId(), account.getLoginHandle(), account.getCreatedAt());
    }
}
