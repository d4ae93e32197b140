package com.tasklane.backend.global.security;

import java.util.UUID;

/**
 * A record that belongs to exactly one account for its whole lifetime.
 */
public interface OwnedResource {

    UUID getId();

    UUID getOwnerId();
}
