package com.synthgov.core.model;

import java.util.Locale;

/**
 * Stable threat identifiers. The id is what appears in results and audit
 * records, so it must never change once released.
 */
public enum ThreatKind {

    MEMBERSHIP_INFERENCE("Membership Inference Attack", ImpactedProperty.PRIVACY,
            "An attacker could determine whether a specific record was part of the original "
                    + "training dataset by analyzing synthetic data characteristics."),

    RECORD_LINKAGE("Record Linkage / Re-identification", ImpactedProperty.PRIVACY,
            "Synthetic records lying very close to original records could be linked back to "
                    + "individuals when combined with external quasi-identifiers."),

    NEAR_DUPLICATE("Near-Duplicate Records", ImpactedProperty.PRIVACY,
            "Synthetic rows that nearly copy original rows leak the underlying records directly."),

    ATTRIBUTE_INFERENCE("Attribute Inference Attack", ImpactedProperty.PRIVACY,
            "Strong correlations could allow attackers to infer sensitive attributes from known "
                    + "quasi-identifiers with high accuracy."),

    PRIVACY_LEAKAGE("General Privacy Leakage", ImpactedProperty.PRIVACY,
            "The overall privacy score indicates potential information leakage through record "
                    + "similarity, membership patterns or nearest-neighbor proximity."),

    DISTRIBUTION_DRIFT("Statistical Distribution Drift", ImpactedProperty.UTILITY,
            "Divergence in statistical distributions reduces the fidelity of insights derived "
                    + "from the synthetic data."),

    CORRELATION_INCONSISTENCY("Correlation Structure Inconsistency", ImpactedProperty.UTILITY,
            "Divergent correlation patterns compromise multivariate analyses and model performance."),

    UTILITY_DEGRADATION("ML Utility Degradation", ImpactedProperty.UTILITY,
            "Models trained on the synthetic data underperform models trained on real data."),

    SEMANTIC_VIOLATION("Semantic Constraint Violation", ImpactedProperty.CONSISTENCY,
            "Violations of business rules or cross-field constraints show that the data does "
                    + "not respect real-world invariants."),

    SCHEMA_VIOLATION("Schema Violation", ImpactedProperty.CONSISTENCY,
            "Values outside declared field types, domains or formats reveal generation artifacts.");

    private final String displayName;
    private final ImpactedProperty impactedProperty;
    private final String description;

    ThreatKind(String displayName, ImpactedProperty impactedProperty, String description) {
        this.displayName = displayName;
        this.impactedProperty = impactedProperty;
        this.description = description;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDisplayName() {
        return displayName;
    }

    public ImpactedProperty getImpactedProperty() {
        return impactedProperty;
    }

    public String getDescription() {
        return description;
    }

    /** Final tie-break weight when ranking top threats. */
    public int getPriorityWeight() {
        return impactedProperty.getPriorityWeight();
    }

    /**
     * Looks up a kind by its stable id ({@code membership_inference}) or enum name.
     *
     * @throws IllegalArgumentException if no kind matches
     */
    public static ThreatKind fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Threat kind id must not be blank");
        }
        String normalized = id.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ThreatKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown threat kind '" + id + "'");
    }
}
