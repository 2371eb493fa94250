package com.phillippitts.resumeguard.service.session;

/**
 * Cheap read-only call representative of normal application traffic, used to confirm that a
 * refreshed session really works.
 *
 * <p>Probes are Spring beans supplied by the host; they run in {@code @Order} order and the
 * first probe doubles as the connectivity and keep-alive ping.
 */
public interface VerificationProbe {

    /** Short name for logs. */
    String name();

    /**
     * Performs the probe.
     *
     * @throws Exception if the call fails; any exception counts as a failed verification
     */
    void verify() throws Exception;
}
