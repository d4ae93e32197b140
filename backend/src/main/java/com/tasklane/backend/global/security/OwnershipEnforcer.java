package com.tasklane.backend.global.security;

import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single owner check consulted by every operation on an existing resource.
 *
 * <p>Non-owners get {@link OwnershipViolationException} (403) for reads and writes
 * alike; a missing id is reported separately as 404 by the caller. Owners are
 * immutable after creation, so checking inside the mutating transaction leaves no
 * window for the owner to change before the write.
 */
@Component
public class OwnershipEnforcer {

    private static final Logger log = LoggerFactory.getLogger(OwnershipEnforcer.class);

    public void authorize(CallerIdentity caller, OwnedResource resource) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(resource, "resource");
        if (!caller.accountId().equals(resource.getOwnerId())) {
            log.warn("Denied {} {} to non-owner {}",
                    resource.getClass().getSimpleName(), resource.getId(), caller.accountId());
            throw new OwnershipViolationException();
        }
    }

    /**
     * Owner id every list or count query must be filtered by.
     */
    public UUID ownerScope(CallerIdentity caller) {
        return Objects.requireNonNull(caller, "caller").accountId();
    }
}
