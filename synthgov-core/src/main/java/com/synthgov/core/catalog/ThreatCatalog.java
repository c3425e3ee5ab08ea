package com.synthgov.core.catalog;

import com.synthgov.core.model.ThreatKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered, immutable table of threshold rules. Declaration order is the order
 * in which signals are reported and the last tie-break when ranking them.
 * Built once at startup and shared read-only by every evaluation.
 */
public final class ThreatCatalog {

    private static final Logger log = LoggerFactory.getLogger(ThreatCatalog.class);

    private final List<ThresholdRule> rules;
    private final Map<String, ThresholdRule> ruleMap;
    private final Map<String, ValueKind> expectedValueKinds;

    private ThreatCatalog(List<ThresholdRule> rules) {
        Map<String, ThresholdRule> byId = new LinkedHashMap<>();
        Map<String, ValueKind> kinds = new LinkedHashMap<>();
        for (ThresholdRule rule : rules) {
            if (rule == null) {
                throw new CatalogValidationException(null, "catalog contains a null rule");
            }
            if (byId.putIfAbsent(rule.getId(), rule) != null) {
                throw new CatalogValidationException(rule.getId(), "duplicate rule id");
            }
            List<String> paths = new ArrayList<>(rule.getCandidatePaths());
            for (String path : paths) {
                ValueKind existing = kinds.putIfAbsent(path, rule.getValueKind());
                if (existing != null && existing != rule.getValueKind()) {
                    throw new CatalogValidationException(rule.getId(),
                            "metric path '" + path + "' is read as both " + existing + " and " + rule.getValueKind());
                }
            }
        }
        this.rules = List.copyOf(rules);
        this.ruleMap = Collections.unmodifiableMap(byId);
        this.expectedValueKinds = Collections.unmodifiableMap(kinds);
        if (this.rules.isEmpty()) {
            log.warn("[SynthGov] Threat catalog is empty; every evaluation will report low risk");
        }
    }

    /**
     * @throws CatalogValidationException on duplicate ids or conflicting path types
     */
    public static ThreatCatalog of(List<ThresholdRule> rules) {
        if (rules == null) {
            throw new CatalogValidationException(null, "rule list must not be null");
        }
        return new ThreatCatalog(rules);
    }

    public static ThreatCatalog of(ThresholdRule... rules) {
        return of(List.of(rules));
    }

    public List<ThresholdRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public Optional<ThresholdRule> findRule(String id) {
        return Optional.ofNullable(ruleMap.get(id));
    }

    /** Position of the rule in declaration order, or -1. */
    public int indexOf(String ruleId) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).getId().equals(ruleId)) {
                return i;
            }
        }
        return -1;
    }

    /** Threat kinds covered by this catalog, in declaration order. */
    public List<ThreatKind> getThreatKinds() {
        Set<ThreatKind> kinds = new LinkedHashSet<>();
        rules.forEach(rule -> kinds.add(rule.getThreatKind()));
        return List.copyOf(kinds);
    }

    /** Every metric path (primary, alias, context) read for the given threat. */
    public List<String> getMetricPaths(ThreatKind kind) {
        Set<String> paths = new LinkedHashSet<>();
        for (ThresholdRule rule : rules) {
            if (rule.getThreatKind() == kind) {
                paths.addAll(rule.getCandidatePaths());
                paths.addAll(rule.getContextPaths());
            }
        }
        return List.copyOf(paths);
    }

    /**
     * Paths a rule compares against, with the value type it expects there.
     * The sanitizer uses this to spot type mismatches.
     */
    public Map<String, ValueKind> getExpectedValueKinds() {
        return expectedValueKinds;
    }

    /**
     * Returns a new catalog where override rules replace same-id rules in place
     * and new ids are appended in the order given.
     */
    public ThreatCatalog withOverrides(List<ThresholdRule> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, ThresholdRule> merged = new LinkedHashMap<>(ruleMap);
        for (ThresholdRule override : overrides) {
            if (merged.put(override.getId(), override) != null) {
                log.info("[SynthGov] Catalog override replaces rule '{}'", override.getId());
            } else {
                log.info("[SynthGov] Catalog override adds rule '{}'", override.getId());
            }
        }
        return new ThreatCatalog(new ArrayList<>(merged.values()));
    }

    @Override
    public String toString() {
        return "ThreatCatalog{" + rules.stream().map(ThresholdRule::getId).collect(Collectors.joining(", ")) + '}';
    }
}
