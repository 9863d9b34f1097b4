package com.gsesentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Ordered alarm severity: {@code NOMINAL < INFO < WARNING < FAULT < CRITICAL}.
 *
 * <p>
 * The declaration order is the escalation order; comparisons use
 * {@link #isAtLeast(Severity)} rather than {@link #compareTo(Enum)} at call
 * sites so the intent reads clearly.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    NOMINAL,
    INFO,
    WARNING,
    FAULT,
    CRITICAL;

    /**
     * @param other severity to compare against; must not be {@code null}
     * @return {@code true} if this severity is equal to or above {@code other}
     */
    public boolean isAtLeast(Severity other) {
        Objects.requireNonNull(other, "Severity must not be null");
        return compareTo(other) >= 0;
    }

    /**
     * Return the more severe of two severities.
     *
     * @param a first severity
     * @param b second severity
     * @return the higher of the two
     */
    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Parse a severity name, case-insensitively. A {@code null} or blank value
     * maps to {@link #NOMINAL}.
     *
     * @param value severity name
     * @return parsed severity
     * @throws IllegalArgumentException if the value is not a known severity
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return NOMINAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value + "'", e);
        }
    }
}
