package com.synthgov.core.model;

import java.util.Locale;

/**
 * Per-signal severity tier. Declared from least to most severe.
 */
public enum Severity {

    /** Threshold barely crossed. Worth a note in the report. */
    LOW,

    /** Clear threshold crossing. Should be reviewed. */
    MEDIUM,

    /** Strong evidence of the threat. Reviewed before the dataset is shared. */
    HIGH;

    /** Tiers in evaluation order: most severe first. */
    public static final Severity[] DESCENDING = { HIGH, MEDIUM, LOW };

    public int rank() {
        return ordinal();
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Severity id must not be null");
        }
        return Severity.valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
