package com.synthgov.core.model;

import java.util.Locale;

/**
 * Dataset-wide risk level derived from all threat signals of one evaluation.
 */
public enum RiskLevel {

    LOW("Low risk profile. Standard monitoring and governance practices apply."),

    WARNING("Elevated risk detected. Review recommended before the dataset is shared."),

    CRITICAL("Critical risk requiring immediate attention. The dataset may pose significant privacy or governance concerns."),

    /** No signal could be produced because required metrics were missing or invalid. */
    UNKNOWN("Risk could not be determined from the supplied metrics.");

    private final String description;

    RiskLevel(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
