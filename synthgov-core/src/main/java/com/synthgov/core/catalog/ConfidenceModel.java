package com.synthgov.core.catalog;

import com.synthgov.core.model.Severity;

/**
 * Confidence formula of a rule. All three shapes are non-decreasing in the
 * distance past the entry boundary, so moving a metric further into threat
 * territory never lowers confidence.
 */
public final class ConfidenceModel {

    public enum Type {
        /** {@code floor + (1 - floor) * min(1, distance / scale)} */
        LINEAR,
        /** {@code floor + (1 - floor) * min(1, log10(1 + distance) / scale)}, for counts. */
        LOGARITHMIC,
        /** {@code floor + scale * rank(severity)}; used where there is no numeric distance. */
        TIERED
    }

    private final Type type;
    private final double floor;
    private final double scale;

    private ConfidenceModel(Type type, double floor, double scale) {
        this.type = type;
        this.floor = floor;
        this.scale = scale;
    }

    public static ConfidenceModel linear(double floor, double scale) {
        return new ConfidenceModel(Type.LINEAR, floor, scale);
    }

    public static ConfidenceModel logarithmic(double floor, double scale) {
        return new ConfidenceModel(Type.LOGARITHMIC, floor, scale);
    }

    public static ConfidenceModel tiered(double floor, double step) {
        return new ConfidenceModel(Type.TIERED, floor, step);
    }

    public static ConfidenceModel of(Type type, double floor, double scale) {
        if (type == null) {
            throw new IllegalArgumentException("Confidence model type must not be null");
        }
        return new ConfidenceModel(type, floor, scale);
    }

    public Type getType() {
        return type;
    }

    public double getFloor() {
        return floor;
    }

    public double getScale() {
        return scale;
    }

    /**
     * @param distance non-negative distance past the rule's entry boundary
     * @param severity the tier the value landed in
     * @return confidence in [0, 1], rounded to three decimals
     */
    public double apply(double distance, Severity severity) {
        double raw = switch (type) {
            case LINEAR -> floor + (1.0 - floor) * Math.min(1.0, distance / scale);
            case LOGARITHMIC -> floor + (1.0 - floor) * Math.min(1.0, Math.log10(1.0 + distance) / scale);
            case TIERED -> floor + scale * severity.rank();
        };
        return round(clamp(raw));
    }

    void validate(String ruleId) {
        if (!Double.isFinite(floor) || floor < 0.0 || floor > 1.0) {
            throw new CatalogValidationException(ruleId, "confidence floor must lie in [0, 1], was " + floor);
        }
        if (!Double.isFinite(scale)) {
            throw new CatalogValidationException(ruleId, "confidence scale must be finite");
        }
        if (type == Type.TIERED ? scale < 0.0 : scale <= 0.0) {
            throw new CatalogValidationException(ruleId,
                    "confidence scale must be " + (type == Type.TIERED ? "non-negative" : "positive")
                            + ", was " + scale);
        }
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConfidenceModel other)) {
            return false;
        }
        return type == other.type
                && Double.compare(floor, other.floor) == 0
                && Double.compare(scale, other.scale) == 0;
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();
        result = 31 * result + Double.hashCode(floor);
        result = 31 * result + Double.hashCode(scale);
        return result;
    }

    @Override
    public String toString() {
        return type.name().toLowerCase() + "(floor=" + floor + ", scale=" + scale + ")";
    }
}
