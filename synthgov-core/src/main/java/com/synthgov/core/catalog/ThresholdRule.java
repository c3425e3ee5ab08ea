package com.synthgov.core.catalog;

import com.synthgov.core.model.Severity;
import com.synthgov.core.model.ThreatKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One row of the threat catalog: which metric to read, how to compare it and
 * how severe each crossing is. Rules are immutable and validated on
 * {@link Builder#build()}, so a catalog that exists is always evaluable.
 */
public final class ThresholdRule {

    private final String id;
    private final ThreatKind threatKind;
    private final String metricPath;
    private final List<String> aliasPaths;
    private final List<String> contextPaths;
    private final PredicateKind predicate;
    private final Map<Severity, Double> boundaries;
    private final Map<Severity, Set<String>> categories;
    private final double bandLower;
    private final double bandUpper;
    private final ConfidenceModel confidenceModel;
    private final boolean required;

    private ThresholdRule(Builder builder) {
        this.id = builder.id;
        this.threatKind = builder.threatKind;
        this.metricPath = builder.metricPath;
        this.aliasPaths = List.copyOf(builder.aliasPaths);
        this.contextPaths = List.copyOf(builder.contextPaths);
        this.predicate = builder.predicate;
        this.boundaries = Collections.unmodifiableMap(new EnumMap<>(builder.boundaries));
        Map<Severity, Set<String>> cats = new EnumMap<>(Severity.class);
        builder.categories.forEach((severity, values) -> cats.put(severity, Set.copyOf(values)));
        this.categories = Collections.unmodifiableMap(cats);
        this.bandLower = builder.bandLower;
        this.bandUpper = builder.bandUpper;
        this.confidenceModel = builder.confidenceModel;
        this.required = builder.required;
        validate();
    }

    public String getId() {
        return id;
    }

    public ThreatKind getThreatKind() {
        return threatKind;
    }

    public String getMetricPath() {
        return metricPath;
    }

    public List<String> getAliasPaths() {
        return aliasPaths;
    }

    public List<String> getContextPaths() {
        return contextPaths;
    }

    public PredicateKind getPredicate() {
        return predicate;
    }

    public Map<Severity, Double> getBoundaries() {
        return boundaries;
    }

    public Map<Severity, Set<String>> getCategories() {
        return categories;
    }

    public double getBandLower() {
        return bandLower;
    }

    public double getBandUpper() {
        return bandUpper;
    }

    public ConfidenceModel getConfidenceModel() {
        return confidenceModel;
    }

    /** Required rules count as unresolved when their metric is absent altogether. */
    public boolean isRequired() {
        return required;
    }

    public ValueKind getValueKind() {
        return predicate.isNumeric() ? ValueKind.NUMBER : ValueKind.CATEGORY;
    }

    /** Primary path followed by aliases, in resolution order. */
    public List<String> getCandidatePaths() {
        List<String> paths = new ArrayList<>(1 + aliasPaths.size());
        paths.add(metricPath);
        paths.addAll(aliasPaths);
        return paths;
    }

    /** Boundary of the least severe tier; confidence distance is measured from here. */
    public double getEntryBoundary() {
        for (Severity severity : Severity.values()) {
            Double boundary = boundaries.get(severity);
            if (boundary != null) {
                return boundary;
            }
        }
        return 0.0;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with this rule's values, for overrides. */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .id(id)
                .threatKind(threatKind)
                .metricPath(metricPath)
                .aliasPaths(aliasPaths)
                .contextPaths(contextPaths)
                .predicate(predicate)
                .confidence(confidenceModel)
                .required(required);
        builder.boundaries.putAll(boundaries);
        categories.forEach((severity, values) -> builder.categories.put(severity, new LinkedHashSet<>(values)));
        builder.bandLower = bandLower;
        builder.bandUpper = bandUpper;
        return builder;
    }

    private void validate() {
        if (id == null || id.isBlank()) {
            throw new CatalogValidationException(null, "rule id must not be blank");
        }
        if (threatKind == null) {
            throw new CatalogValidationException(id, "threat kind is required");
        }
        if (metricPath == null || metricPath.isBlank()) {
            throw new CatalogValidationException(id, "metric path must not be blank");
        }
        if (predicate == null) {
            throw new CatalogValidationException(id, "predicate is required");
        }
        if (confidenceModel == null) {
            throw new CatalogValidationException(id, "confidence model is required");
        }
        confidenceModel.validate(id);

        Set<String> seen = new LinkedHashSet<>();
        for (String path : getCandidatePaths()) {
            if (path == null || path.isBlank() || !seen.add(path)) {
                throw new CatalogValidationException(id, "metric and alias paths must be non-blank and distinct");
            }
        }
        for (String path : contextPaths) {
            if (path == null || path.isBlank()) {
                throw new CatalogValidationException(id, "context paths must not be blank");
            }
        }

        if (predicate == PredicateKind.CATEGORICAL) {
            validateCategories();
        } else {
            validateBoundaries();
        }
    }

    private void validateCategories() {
        if (!boundaries.isEmpty()) {
            throw new CatalogValidationException(id, "categorical rules take category sets, not numeric boundaries");
        }
        if (categories.isEmpty()) {
            throw new CatalogValidationException(id, "categorical rules need at least one tier");
        }
        Set<String> all = new LinkedHashSet<>();
        categories.forEach((severity, values) -> {
            if (values.isEmpty()) {
                throw new CatalogValidationException(id, "empty category set for tier " + severity.id());
            }
            for (String value : values) {
                if (!all.add(value)) {
                    throw new CatalogValidationException(id, "category '" + value + "' is mapped to more than one tier");
                }
            }
        });
    }

    private void validateBoundaries() {
        if (!categories.isEmpty()) {
            throw new CatalogValidationException(id, "numeric rules take boundaries, not category sets");
        }
        if (boundaries.isEmpty()) {
            throw new CatalogValidationException(id, "at least one severity boundary is required");
        }
        for (Map.Entry<Severity, Double> entry : boundaries.entrySet()) {
            if (entry.getValue() == null || !Double.isFinite(entry.getValue())) {
                throw new CatalogValidationException(id, "boundary for tier " + entry.getKey().id() + " must be finite");
            }
            if (predicate == PredicateKind.RANGE && entry.getValue() < 0.0) {
                throw new CatalogValidationException(id, "range deviations must be non-negative");
            }
        }
        if (predicate == PredicateKind.RANGE) {
            if (!Double.isFinite(bandLower) || !Double.isFinite(bandUpper) || bandLower > bandUpper) {
                throw new CatalogValidationException(id,
                        "range band [" + bandLower + ", " + bandUpper + "] is not a valid interval");
            }
        }

        // More severe tiers must sit further into threat territory. Equal boundaries
        // are accepted; the more severe tier then wins the tie.
        Double previous = null;
        Severity previousTier = null;
        for (Severity severity : Severity.values()) {
            Double boundary = boundaries.get(severity);
            if (boundary == null) {
                continue;
            }
            if (previous != null) {
                boolean inverted = predicate.isSeverityGrowsWithValue() ? boundary < previous : boundary > previous;
                if (inverted) {
                    throw new CatalogValidationException(id, String.format(Locale.ROOT,
                            "boundary ordering is inverted: %s=%s vs %s=%s for predicate %s",
                            severity.id(), boundary, previousTier.id(), previous, predicate));
                }
            }
            previous = boundary;
            previousTier = severity;
        }
    }

    public static class Builder {
        private String id;
        private ThreatKind threatKind;
        private String metricPath;
        private List<String> aliasPaths = List.of();
        private List<String> contextPaths = List.of();
        private PredicateKind predicate;
        private final Map<Severity, Double> boundaries = new EnumMap<>(Severity.class);
        private final Map<Severity, Set<String>> categories = new EnumMap<>(Severity.class);
        private double bandLower = Double.NaN;
        private double bandUpper = Double.NaN;
        private ConfidenceModel confidenceModel;
        private boolean required;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder threatKind(ThreatKind threatKind) {
            this.threatKind = threatKind;
            return this;
        }

        public Builder metricPath(String metricPath) {
            this.metricPath = metricPath;
            return this;
        }

        public Builder aliasPaths(List<String> aliasPaths) {
            this.aliasPaths = aliasPaths != null ? aliasPaths : List.of();
            return this;
        }

        public Builder aliases(String... aliasPaths) {
            return aliasPaths(List.of(aliasPaths));
        }

        public Builder contextPaths(List<String> contextPaths) {
            this.contextPaths = contextPaths != null ? contextPaths : List.of();
            return this;
        }

        public Builder context(String... contextPaths) {
            return contextPaths(List.of(contextPaths));
        }

        public Builder predicate(PredicateKind predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder boundary(Severity severity, double boundary) {
            this.boundaries.put(severity, boundary);
            return this;
        }

        public Builder clearBoundaries() {
            this.boundaries.clear();
            return this;
        }

        /** Convenience for the common three-tier row; pass {@code Double.NaN} to leave a tier out. */
        public Builder boundaries(double high, double medium, double low) {
            clearBoundaries();
            if (!Double.isNaN(high)) {
                boundary(Severity.HIGH, high);
            }
            if (!Double.isNaN(medium)) {
                boundary(Severity.MEDIUM, medium);
            }
            if (!Double.isNaN(low)) {
                boundary(Severity.LOW, low);
            }
            return this;
        }

        public Builder categories(Severity severity, String... values) {
            Set<String> normalized = new LinkedHashSet<>();
            for (String value : values) {
                normalized.add(value.trim().toLowerCase(Locale.ROOT));
            }
            this.categories.put(severity, normalized);
            return this;
        }

        public Builder clearCategories() {
            this.categories.clear();
            return this;
        }

        public Builder band(double lower, double upper) {
            this.bandLower = lower;
            this.bandUpper = upper;
            return this;
        }

        public Builder confidence(ConfidenceModel confidenceModel) {
            this.confidenceModel = confidenceModel;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        /**
         * @throws CatalogValidationException if the row cannot be evaluated consistently
         */
        public ThresholdRule build() {
            return new ThresholdRule(this);
        }
    }

    @Override
    public String toString() {
        return "ThresholdRule{" +
                "id='" + id + '\'' +
                ", threat=" + (threatKind != null ? threatKind.id() : null) +
                ", path='" + metricPath + '\'' +
                ", predicate=" + predicate +
                ", boundaries=" + boundaries +
                '}';
    }
}
