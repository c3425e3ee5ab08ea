package com.synthgov.core.model;

import com.synthgov.core.GovernanceContractException;

import java.util.Locale;

/**
 * How much of the evaluation a {@link GovernanceResult} carries.
 */
public enum OutputMode {

    /** Risk summary only, no per-threat list. */
    SUMMARY,

    /** Threat list included, evidence truncated to the configured limit. */
    DETAILED,

    /** Threat list with complete evidence. */
    FULL;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean includesThreats() {
        return this != SUMMARY;
    }

    /**
     * Parses a caller-supplied mode name.
     *
     * @throws GovernanceContractException for null or unknown names
     */
    public static OutputMode fromId(String id) {
        if (id == null) {
            throw new GovernanceContractException("Output mode must not be null");
        }
        try {
            return OutputMode.valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new GovernanceContractException(
                    "Unknown output mode '" + id + "', expected one of summary, detailed, full", e);
        }
    }
}
