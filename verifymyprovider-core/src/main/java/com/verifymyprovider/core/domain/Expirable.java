package com.verifymyprovider.core.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Evidence that stops counting once its expiration passes.
 * An empty expiration marks legacy rows written before TTLs existed; those never expire.
 */
public interface Expirable {

    /** Attribute name of the expiration column, used when building query predicates. */
    String EXPIRES_AT = "expiresAt";

    Optional<Instant> getExpiresAt();

    default boolean isExpiredAt(Instant now) {
        return getExpiresAt().map(expiresAt -> !expiresAt.isAfter(now)).orElse(false);
    }
}
