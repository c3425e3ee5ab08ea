package com.synthgov.core.catalog;

/**
 * Predicate families a {@link ThresholdRule} can use.
 */
public enum PredicateKind {

    /** Triggers when the value is strictly above a boundary. */
    GREATER_THAN(true),

    /** Triggers when the value reaches or exceeds a boundary. */
    GREATER_OR_EQUAL(true),

    /** Triggers when the value is strictly below a boundary. */
    LESS_THAN(false),

    /** Triggers when the value reaches or falls below a boundary. */
    LESS_OR_EQUAL(false),

    /**
     * Triggers when the value leaves an acceptable band. Boundaries are
     * deviations from the nearest band edge.
     */
    RANGE(true),

    /** Triggers when a categorical value belongs to a tier's category set. */
    CATEGORICAL(true);

    private final boolean severityGrowsWithValue;

    PredicateKind(boolean severityGrowsWithValue) {
        this.severityGrowsWithValue = severityGrowsWithValue;
    }

    /**
     * Whether a more severe tier needs a larger boundary. False for the
     * "less than" family, where more severe tiers sit lower.
     */
    public boolean isSeverityGrowsWithValue() {
        return severityGrowsWithValue;
    }

    public boolean isNumeric() {
        return this != CATEGORICAL;
    }

    /**
     * Whether {@code value} is past {@code boundary}. For RANGE the value is
     * the deviation outside the band.
     */
    public boolean crosses(double value, double boundary) {
        return switch (this) {
            case GREATER_THAN, RANGE -> value > boundary;
            case GREATER_OR_EQUAL -> value >= boundary;
            case LESS_THAN -> value < boundary;
            case LESS_OR_EQUAL -> value <= boundary;
            case CATEGORICAL -> false;
        };
    }

    /** Non-negative distance of {@code value} past {@code boundary} in the triggering direction. */
    public double distancePast(double value, double boundary) {
        double distance = severityGrowsWithValue ? value - boundary : boundary - value;
        return Math.max(0.0, distance);
    }

    public String symbol() {
        return switch (this) {
            case GREATER_THAN -> ">";
            case GREATER_OR_EQUAL -> ">=";
            case LESS_THAN -> "<";
            case LESS_OR_EQUAL -> "<=";
            case RANGE -> "outside band by >";
            case CATEGORICAL -> "in";
        };
    }
}
