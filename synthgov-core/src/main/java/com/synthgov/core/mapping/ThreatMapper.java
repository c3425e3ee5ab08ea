package com.synthgov.core.mapping;

import com.synthgov.core.catalog.PredicateKind;
import com.synthgov.core.catalog.ThreatCatalog;
import com.synthgov.core.catalog.ThresholdRule;
import com.synthgov.core.model.Severity;
import com.synthgov.core.model.ThreatSignal;
import com.synthgov.core.sanitize.MetricSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Generic interpreter for the threat catalog.
 *
 * <p>
 * Each rule is evaluated on its own against the same snapshot, so no rule can
 * influence another rule's severity or confidence. Signals come back in catalog
 * declaration order.
 * </p>
 */
public class ThreatMapper {

    private static final Logger log = LoggerFactory.getLogger(ThreatMapper.class);

    private static final MathContext DISPLAY_PRECISION = new MathContext(6);

    private final ThreatCatalog catalog;

    public ThreatMapper(ThreatCatalog catalog) {
        this.catalog = catalog;
    }

    public MappingResult map(MetricSnapshot snapshot) {
        List<ThreatSignal> signals = new ArrayList<>();
        List<UnresolvedRule> unresolved = new ArrayList<>();
        int evaluated = 0;
        int notApplicable = 0;

        for (ThresholdRule rule : catalog.getRules()) {
            Resolution resolution = resolve(rule, snapshot);
            switch (resolution.status) {
                case NOT_APPLICABLE -> {
                    notApplicable++;
                    continue;
                }
                case UNRESOLVED -> {
                    unresolved.add(new UnresolvedRule(rule, resolution.path, resolution.reason));
                    continue;
                }
                case RESOLVED -> evaluated++;
            }

            Optional<ThreatSignal> signal = evaluate(rule, resolution.path, resolution.value, snapshot);
            signal.ifPresent(s -> {
                log.debug("[SynthGov] [{}] {}", rule.getId(), s);
                signals.add(s);
            });
        }

        return new MappingResult(signals, unresolved, evaluated, notApplicable);
    }

    /**
     * Evaluates a single rule against an already resolved value. Exposed so a
     * rule row can be checked in isolation.
     */
    public Optional<ThreatSignal> evaluate(ThresholdRule rule, String path, Object value, MetricSnapshot snapshot) {
        Outcome outcome = rule.getPredicate() == PredicateKind.CATEGORICAL
                ? evaluateCategory(rule, path, value)
                : evaluateNumber(rule, path, ((Number) value).doubleValue(), value);
        if (outcome == null) {
            return Optional.empty();
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put(path, value);
        for (String contextPath : rule.getContextPaths()) {
            snapshot.resolve(contextPath).ifPresent(v -> evidence.putIfAbsent(contextPath, v));
        }

        return Optional.of(ThreatSignal.of(rule.getThreatKind(), rule.getId(), outcome.severity,
                outcome.confidence, path, value, evidence, outcome.conditions));
    }

    private Outcome evaluateNumber(ThresholdRule rule, String path, double value, Object literal) {
        PredicateKind predicate = rule.getPredicate();
        double measured = predicate == PredicateKind.RANGE ? deviation(rule, value) : value;

        Severity severity = null;
        List<String> conditions = new ArrayList<>();
        for (Severity tier : Severity.DESCENDING) {
            Double boundary = rule.getBoundaries().get(tier);
            if (boundary == null || !predicate.crosses(measured, boundary)) {
                continue;
            }
            if (severity == null) {
                severity = tier;
            }
            conditions.add(describe(rule, path, literal, measured, boundary, tier));
        }
        if (severity == null) {
            return null;
        }

        double distance = predicate.distancePast(measured, rule.getEntryBoundary());
        double confidence = rule.getConfidenceModel().apply(distance, severity);
        return new Outcome(severity, confidence, conditions);
    }

    private Outcome evaluateCategory(ThresholdRule rule, String path, Object literal) {
        String label = literal.toString().trim().toLowerCase(Locale.ROOT);
        for (Severity tier : Severity.DESCENDING) {
            Set<String> members = rule.getCategories().get(tier);
            if (members != null && members.contains(label)) {
                String condition = String.format(Locale.ROOT, "%s (\"%s\") in %s [%s]",
                        path, literal, new TreeSet<>(members), tier.id());
                double confidence = rule.getConfidenceModel().apply(0.0, tier);
                return new Outcome(tier, confidence, List.of(condition));
            }
        }
        return null;
    }

    private static double deviation(ThresholdRule rule, double value) {
        if (value < rule.getBandLower()) {
            return rule.getBandLower() - value;
        }
        if (value > rule.getBandUpper()) {
            return value - rule.getBandUpper();
        }
        return 0.0;
    }

    private static String describe(ThresholdRule rule, String path, Object literal, double measured,
            double boundary, Severity tier) {
        if (rule.getPredicate() == PredicateKind.RANGE) {
            return String.format(Locale.ROOT, "%s (%s) outside [%s, %s] by %s > %s [%s]",
                    path, literal, plain(rule.getBandLower()), plain(rule.getBandUpper()),
                    plain(measured), plain(boundary), tier.id());
        }
        return String.format(Locale.ROOT, "%s (%s) %s %s [%s]",
                path, literal, rule.getPredicate().symbol(), plain(boundary), tier.id());
    }

    private static String plain(double value) {
        return new BigDecimal(value, DISPLAY_PRECISION).stripTrailingZeros().toPlainString();
    }

    private static Resolution resolve(ThresholdRule rule, MetricSnapshot snapshot) {
        String unavailablePath = null;
        for (String candidate : rule.getCandidatePaths()) {
            Optional<Object> value = snapshot.resolve(candidate);
            if (value.isPresent()) {
                return Resolution.resolved(candidate, value.get());
            }
            if (unavailablePath == null && snapshot.isUnavailable(candidate)) {
                unavailablePath = candidate;
            }
        }
        if (unavailablePath != null) {
            return Resolution.unresolved(unavailablePath, "unavailable");
        }
        if (rule.isRequired()) {
            return Resolution.unresolved(rule.getMetricPath(), "missing");
        }
        return Resolution.notApplicable();
    }

    private record Outcome(Severity severity, double confidence, List<String> conditions) {
    }

    private enum Status {
        RESOLVED,
        UNRESOLVED,
        NOT_APPLICABLE
    }

    private static final class Resolution {
        final Status status;
        final String path;
        final Object value;
        final String reason;

        private Resolution(Status status, String path, Object value, String reason) {
            this.status = status;
            this.path = path;
            this.value = value;
            this.reason = reason;
        }

        static Resolution resolved(String path, Object value) {
            return new Resolution(Status.RESOLVED, path, value, null);
        }

        static Resolution unresolved(String path, String reason) {
            return new Resolution(Status.UNRESOLVED, path, null, reason);
        }

        static Resolution notApplicable() {
            return new Resolution(Status.NOT_APPLICABLE, null, null, null);
        }
    }
}
