package com.phillippitts.resumeguard.service.session;

import com.phillippitts.resumeguard.domain.Session;
import com.phillippitts.resumeguard.exception.SessionRefreshException;

import java.util.Optional;

/**
 * Remote authentication/session service as seen by the recovery procedure.
 *
 * <p>The host application registers its implementation through
 * {@code RecoveryCoordinator.registerSessionClient(...)}, or exposes it as a Spring bean.
 */
public interface SessionClient {

    /**
     * Asks the auth service for a fresh session.
     *
     * @return the refreshed session
     * @throws SessionRefreshException if the service refuses or cannot be reached
     */
    Session refreshSession();

    /**
     * Reads the current session, from memory or persisted local storage.
     *
     * @return the session, or empty when signed out
     */
    Optional<Session> getSession();

    /**
     * Signs out.
     *
     * @param localOnly {@code true} to drop only local state without invalidating the session server-side
     */
    void signOut(boolean localOnly);
}
