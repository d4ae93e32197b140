package com.tasklane.backend.global.security;

import java.util.Objects;
import java.util.UUID;

/**
 * The authenticated account behind the current request. Immutable, and only
 * {@link JwtAuthenticationFilter} can create one, after a token has verified; handlers
 * receive it as a parameter and pass it on explicitly.
 */
public final class CallerIdentity {

    private final UUID accountId;

    CallerIdentity(UUID accountId) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
    }

    public UUID accountId() {
        return accountId;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof CallerIdentity that && accountId.equals(that.accountId);
    }

    @Override
    public int hashCode() {
        return accountId.hashCode();
    }

    @Override
    public String toString() {
        return "CallerIdentity[" + accountId + "]";
    }
}
