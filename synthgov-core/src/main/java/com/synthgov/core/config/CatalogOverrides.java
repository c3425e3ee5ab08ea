package com.synthgov.core.config;

import com.synthgov.core.catalog.CatalogValidationException;
import com.synthgov.core.catalog.ConfidenceModel;
import com.synthgov.core.catalog.PredicateKind;
import com.synthgov.core.catalog.ThreatCatalog;
import com.synthgov.core.catalog.ThresholdRule;
import com.synthgov.core.model.Severity;
import com.synthgov.core.model.ThreatKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns {@code synthgov.catalog.rules} rows into validated rules.
 */
public final class CatalogOverrides {

    private CatalogOverrides() {
    }

    /**
     * Applies the configured override rows on top of {@code base}.
     *
     * @throws CatalogValidationException if a row names an unknown threat kind,
     *                                    predicate or confidence model, or the
     *                                    resulting rule is invalid
     */
    public static ThreatCatalog apply(ThreatCatalog base, List<RuleProperties> rows) {
        if (rows == null || rows.isEmpty()) {
            return base;
        }
        List<ThresholdRule> overrides = new ArrayList<>();
        for (RuleProperties row : rows) {
            overrides.add(toRule(row, base));
        }
        return base.withOverrides(overrides);
    }

    static ThresholdRule toRule(RuleProperties row, ThreatCatalog base) {
        String id = row.getId();
        if (id == null || id.isBlank()) {
            throw new CatalogValidationException(null, "override rows need an id");
        }
        ThresholdRule.Builder builder = base.findRule(id)
                .map(ThresholdRule::toBuilder)
                .orElseGet(() -> ThresholdRule.builder().id(id).confidence(ConfidenceModel.linear(0.5, 0.5)));

        if (row.getThreat() != null) {
            builder.threatKind(parseThreat(id, row.getThreat()));
        }
        if (row.getMetricPath() != null) {
            builder.metricPath(row.getMetricPath());
        }
        if (row.getAliases() != null && !row.getAliases().isEmpty()) {
            builder.aliasPaths(row.getAliases());
        }
        if (row.getContext() != null && !row.getContext().isEmpty()) {
            builder.contextPaths(row.getContext());
        }
        if (row.getPredicate() != null) {
            builder.predicate(parsePredicate(id, row.getPredicate()));
        }
        if (row.getHigh() != null) {
            builder.boundary(Severity.HIGH, row.getHigh());
        }
        if (row.getMedium() != null) {
            builder.boundary(Severity.MEDIUM, row.getMedium());
        }
        if (row.getLow() != null) {
            builder.boundary(Severity.LOW, row.getLow());
        }
        if (row.getCategories() != null && !row.getCategories().isEmpty()) {
            builder.clearCategories();
            for (Map.Entry<String, List<String>> entry : row.getCategories().entrySet()) {
                Severity tier = parseSeverity(id, entry.getKey());
                builder.categories(tier, entry.getValue().toArray(new String[0]));
            }
        }
        if (row.getBandLower() != null || row.getBandUpper() != null) {
            ThresholdRule current = base.findRule(id).orElse(null);
            double lower = row.getBandLower() != null ? row.getBandLower()
                    : current != null ? current.getBandLower() : Double.NaN;
            double upper = row.getBandUpper() != null ? row.getBandUpper()
                    : current != null ? current.getBandUpper() : Double.NaN;
            builder.band(lower, upper);
        }
        if (row.getConfidence() != null || row.getConfidenceFloor() != null || row.getConfidenceScale() != null) {
            builder.confidence(confidenceOf(row, base.findRule(id).map(ThresholdRule::getConfidenceModel)
                    .orElse(ConfidenceModel.linear(0.5, 0.5))));
        }
        if (row.getRequired() != null) {
            builder.required(row.getRequired());
        }
        return builder.build();
    }

    private static ConfidenceModel confidenceOf(RuleProperties row, ConfidenceModel current) {
        ConfidenceModel.Type type = current.getType();
        if (row.getConfidence() != null) {
            try {
                type = ConfidenceModel.Type.valueOf(row.getConfidence().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new CatalogValidationException(row.getId(),
                        "unknown confidence model '" + row.getConfidence() + "'");
            }
        }
        double floor = row.getConfidenceFloor() != null ? row.getConfidenceFloor() : current.getFloor();
        double scale = row.getConfidenceScale() != null ? row.getConfidenceScale() : current.getScale();
        return ConfidenceModel.of(type, floor, scale);
    }

    private static ThreatKind parseThreat(String ruleId, String value) {
        try {
            return ThreatKind.fromId(value);
        } catch (IllegalArgumentException e) {
            throw new CatalogValidationException(ruleId, "unknown threat kind '" + value + "'");
        }
    }

    private static PredicateKind parsePredicate(String ruleId, String value) {
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        switch (normalized) {
            case ">":
                return PredicateKind.GREATER_THAN;
            case ">=":
                return PredicateKind.GREATER_OR_EQUAL;
            case "<":
                return PredicateKind.LESS_THAN;
            case "<=":
                return PredicateKind.LESS_OR_EQUAL;
            default:
                break;
        }
        try {
            return PredicateKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new CatalogValidationException(ruleId, "unknown predicate '" + value + "'");
        }
    }

    private static Severity parseSeverity(String ruleId, String value) {
        try {
            return Severity.fromId(value);
        } catch (IllegalArgumentException e) {
            throw new CatalogValidationException(ruleId, "unknown severity tier '" + value + "'");
        }
    }
}
