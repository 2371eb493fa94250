package com.phillippitts.resumeguard.service.retry;

import java.util.Locale;

/**
 * Failure classes recognised by the retry wrapper.
 */
public enum ErrorKind {
    TIMEOUT,
    /** Expired or rejected session; eligible for the one-shot refresh. */
    AUTH,
    NETWORK,
    GENERIC;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
