package com.phillippitts.resumeguard.service.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What started a recovery run.
 */
public enum RecoveryType {
    /** Triggered by a resume past the stale threshold. */
    AGGRESSIVE,
    /** Triggered by the user through the manual refresh action. */
    MANUAL;

    /** Lower-case name used on the wire and as a metrics tag. */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
