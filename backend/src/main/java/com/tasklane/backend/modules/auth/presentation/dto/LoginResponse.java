package com.tasklane.backend.modules.auth.presentation.dto;

public record LoginResponse(AccessTokenResponse tokens, AccountResponse account) {
}
