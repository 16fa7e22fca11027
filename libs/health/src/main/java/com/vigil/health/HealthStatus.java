package com.vigil.health;

import java.util.Collection;
import java.util.Locale;

/**
 * Health status of a single dependency or of the whole system.
 * <p>
 * {@link #toString()} yields the lower-case wire name ({@code "ok"}, {@code "error"}, ...), which
 * is what status snapshots carry when serialized.
 */
public enum HealthStatus {

    /** The dependency answered and is behaving normally. */
    OK,

    /** The dependency works but is impaired (slow, nearly rate limited). */
    WARNING,

    /** The dependency failed its check. */
    ERROR,

    /** No usable information: not configured, not registered, or never checked. */
    UNKNOWN;

    /**
     * Returns true for the statuses that count towards consecutive-failure alerts.
     */
    public boolean isFailing() {
        return this == ERROR || this == WARNING;
    }

    /**
     * Reduces statuses to the single worst one: ERROR over WARNING over OK.
     * UNKNOWN entries are ignored unless every entry is UNKNOWN; an empty input is UNKNOWN.
     */
    public static HealthStatus worstOf(Collection<HealthStatus> statuses) {
        if (statuses.contains(ERROR)) {
            return ERROR;
        }
        if (statuses.contains(WARNING)) {
            return WARNING;
        }
        if (statuses.contains(OK)) {
            return OK;
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
