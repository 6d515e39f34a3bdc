package tech.bookverse.sdk.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Release status of an application version.
 */
public enum ReleaseStatus {
    /** Created but not yet promoted to a release stage */
    PRE_RELEASE,

    /** Promoted to a non-production stage */
    STAGED,

    /** Released to production */
    RELEASED,

    /** Released to production with trusted-release evidence */
    TRUSTED_RELEASE,

    /** Missing or unrecognised on the wire */
    UNKNOWN;

    /**
     * Production-eligible versions are the only ones that take part in tag reconciliation.
     */
    public boolean isProductionEligible() {
        return this == RELEASED || this == TRUSTED_RELEASE;
    }

    @JsonCreator
    public static ReleaseStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
