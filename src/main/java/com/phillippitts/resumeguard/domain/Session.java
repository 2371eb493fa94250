package com.phillippitts.resumeguard.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Authenticated session as reported by the remote session client.
 *
 * @param userId    identifier of the signed-in user (must not be null)
 * @param expiresAt expiry reported by the auth service, or {@code null} when unknown
 */
public record Session(
        String userId,
        Instant expiresAt
) {

    public Session {
        Objects.requireNonNull(userId, "userId must not be null");
    }

    /**
     * A session is usable when it has no known expiry or the expiry lies in the future.
     *
     * @param now reference instant
     * @return {@code true} if the session can still authorize requests
     */
    public boolean isUsable(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
