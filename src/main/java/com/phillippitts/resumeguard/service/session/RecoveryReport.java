package com.phillippitts.resumeguard.service.session;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link SessionRecoveryProcedure#recover()}.
 *
 * @param status   how the run ended
 * @param attempts refresh attempts in order
 * @param reason   failure description for exhausted runs, otherwise {@code null}
 */
public record RecoveryReport(
        Status status,
        List<RecoveryAttempt> attempts,
        String reason
) {

    public enum Status {
        /** A refresh attempt passed every verification probe. */
        RECOVERED,
        /** Refreshes failed, but the local restore produced a usable session. */
        RESTORED_FROM_STORAGE,
        /** Refreshes and the local restore failed; the user has to act. */
        EXHAUSTED,
        /** No session client is registered, so nothing was attempted. */
        NO_CLIENT
    }

    public RecoveryReport {
        Objects.requireNonNull(status, "status");
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    static RecoveryReport recovered(List<RecoveryAttempt> attempts) {
        return new RecoveryReport(Status.RECOVERED, attempts, null);
    }

    static RecoveryReport restored(List<RecoveryAttempt> attempts) {
        return new RecoveryReport(Status.RESTORED_FROM_STORAGE, attempts, null);
    }

    static RecoveryReport exhausted(List<RecoveryAttempt> attempts, String reason) {
        return new RecoveryReport(Status.EXHAUSTED, attempts, reason);
    }

    static RecoveryReport noClient() {
        return new RecoveryReport(Status.NO_CLIENT, List.of(), null);
    }

    /** {@code true} when the run ended with a usable session. */
    public boolean recovered() {
        return status == Status.RECOVERED || status == Status.RESTORED_FROM_STORAGE;
    }
}
