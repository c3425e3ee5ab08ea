package com.synthgov.core.aggregate;

import com.synthgov.core.model.ImpactedProperty;
import com.synthgov.core.model.RiskLevel;
import com.synthgov.core.model.Severity;
import com.synthgov.core.model.ThreatSignal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dataset-level view over the signals of one evaluation. Only
 * {@link RiskAggregator} can create one.
 */
public final class DatasetRiskSummary {

    /** Conditions shown per entry in {@code top_threats}. */
    private static final int TOP_THREAT_CONDITIONS = 2;

    private final RiskLevel overallRiskLevel;
    private final Map<Severity, Integer> severityBreakdown;
    private final Map<ImpactedProperty, Integer> propertyBreakdown;
    private final List<ThreatSignal> topThreats;
    private final List<String> escalationReasons;
    private final String summary;
    private final List<String> threatIds;
    private final ConfidenceStats confidenceStats;
    private final int totalThreats;
    private final int evaluatedRules;
    private final List<String> unresolvedRules;
    private final List<String> uncertaintyNotes;

    private DatasetRiskSummary(Builder builder) {
        this.overallRiskLevel = builder.overallRiskLevel;
        this.severityBreakdown = Collections.unmodifiableMap(new EnumMap<>(builder.severityBreakdown));
        this.propertyBreakdown = Collections.unmodifiableMap(new EnumMap<>(builder.propertyBreakdown));
        this.topThreats = List.copyOf(builder.topThreats);
        this.escalationReasons = List.copyOf(builder.escalationReasons);
        this.summary = builder.summary;
        this.threatIds = List.copyOf(builder.threatIds);
        this.confidenceStats = builder.confidenceStats;
        this.totalThreats = builder.totalThreats;
        this.evaluatedRules = builder.evaluatedRules;
        this.unresolvedRules = List.copyOf(builder.unresolvedRules);
        this.uncertaintyNotes = List.copyOf(builder.uncertaintyNotes);
    }

    public RiskLevel getOverallRiskLevel() {
        return overallRiskLevel;
    }

    public Map<Severity, Integer> getSeverityBreakdown() {
        return severityBreakdown;
    }

    public Map<ImpactedProperty, Integer> getPropertyBreakdown() {
        return propertyBreakdown;
    }

    public List<ThreatSignal> getTopThreats() {
        return topThreats;
    }

    public List<String> getEscalationReasons() {
        return escalationReasons;
    }

    public String getSummary() {
        return summary;
    }

    public List<String> getThreatIds() {
        return threatIds;
    }

    public ConfidenceStats getConfidenceStats() {
        return confidenceStats;
    }

    public int getTotalThreats() {
        return totalThreats;
    }

    public int getEvaluatedRules() {
        return evaluatedRules;
    }

    public List<String> getUnresolvedRules() {
        return unresolvedRules;
    }

    public boolean hasUncertainty() {
        return !uncertaintyNotes.isEmpty();
    }

    public List<String> getUncertaintyNotes() {
        return uncertaintyNotes;
    }

    /**
     * Read-only document form. This is also the projection handed to advisory
     * text generators, so it never contains raw evidence values.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("overall_risk_level", overallRiskLevel.id());
        map.put("total_threats", totalThreats);

        Map<String, Object> severities = new LinkedHashMap<>();
        for (Severity severity : Severity.DESCENDING) {
            severities.put(severity.id(), severityBreakdown.getOrDefault(severity, 0));
        }
        map.put("severity_breakdown", severities);

        Map<String, Object> properties = new LinkedHashMap<>();
        for (ImpactedProperty property : ImpactedProperty.values()) {
            properties.put(property.id(), propertyBreakdown.getOrDefault(property, 0));
        }
        map.put("property_breakdown", properties);

        List<Map<String, Object>> top = new ArrayList<>();
        for (ThreatSignal signal : topThreats) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("threat_id", signal.getThreatId());
            entry.put("threat_name", signal.getThreatName());
            entry.put("rule_id", signal.getRuleId());
            entry.put("severity", signal.getSeverity().id());
            entry.put("impacted_property", signal.getThreatKind().getImpactedProperty().id());
            entry.put("confidence", signal.getConfidence());
            List<String> conditions = signal.getTriggeredConditions();
            entry.put("triggered_conditions",
                    new ArrayList<>(conditions.subList(0, Math.min(TOP_THREAT_CONDITIONS, conditions.size()))));
            top.add(entry);
        }
        map.put("top_threats", top);
        map.put("escalation_reasons", new ArrayList<>(escalationReasons));
        map.put("summary", summary);
        map.put("threat_ids", new ArrayList<>(threatIds));
        map.put("confidence_stats", confidenceStats.toMap());
        map.put("evaluated_rules", evaluatedRules);
        map.put("unresolved_rules", new ArrayList<>(unresolvedRules));
        return map;
    }

    static Builder builder() {
        return new Builder();
    }

    /** Average, maximum and minimum confidence over all signals; zeros when there are none. */
    public record ConfidenceStats(double avg, double max, double min) {

        static final ConfidenceStats NONE = new ConfidenceStats(0.0, 0.0, 0.0);

        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("avg", avg);
            map.put("max", max);
            map.put("min", min);
            return map;
        }
    }

    static class Builder {
        private RiskLevel overallRiskLevel;
        private Map<Severity, Integer> severityBreakdown = new EnumMap<>(Severity.class);
        private Map<ImpactedProperty, Integer> propertyBreakdown = new EnumMap<>(ImpactedProperty.class);
        private List<ThreatSignal> topThreats = List.of();
        private List<String> escalationReasons = List.of();
        private String summary;
        private List<String> threatIds = List.of();
        private ConfidenceStats confidenceStats = ConfidenceStats.NONE;
        private int totalThreats;
        private int evaluatedRules;
        private List<String> unresolvedRules = List.of();
        private List<String> uncertaintyNotes = List.of();

        Builder overallRiskLevel(RiskLevel overallRiskLevel) {
            this.overallRiskLevel = overallRiskLevel;
            return this;
        }

        Builder severityBreakdown(Map<Severity, Integer> severityBreakdown) {
            this.severityBreakdown = severityBreakdown;
            return this;
        }

        Builder propertyBreakdown(Map<ImpactedProperty, Integer> propertyBreakdown) {
            this.propertyBreakdown = propertyBreakdown;
            return this;
        }

        Builder topThreats(List<ThreatSignal> topThreats) {
            this.topThreats = topThreats;
            return this;
        }

        Builder escalationReasons(List<String> escalationReasons) {
            this.escalationReasons = escalationReasons;
            return this;
        }

        Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        Builder threatIds(List<String> threatIds) {
            this.threatIds = threatIds;
            return this;
        }

        Builder confidenceStats(ConfidenceStats confidenceStats) {
            this.confidenceStats = confidenceStats;
            return this;
        }

        Builder totalThreats(int totalThreats) {
            this.totalThreats = totalThreats;
            return this;
        }

        Builder evaluatedRules(int evaluatedRules) {
            this.evaluatedRules = evaluatedRules;
            return this;
        }

        Builder unresolvedRules(List<String> unresolvedRules) {
            this.unresolvedRules = unresolvedRules;
            return this;
        }

        Builder uncertaintyNotes(List<String> uncertaintyNotes) {
            this.uncertaintyNotes = uncertaintyNotes;
            return this;
        }

        DatasetRiskSummary build() {
            return new DatasetRiskSummary(this);
        }
    }

    @Override
    public String toString() {
        return "DatasetRiskSummary{" +
                "level=" + overallRiskLevel.id() +
                ", threats=" + totalThreats +
                ", unresolved=" + unresolvedRules.size() +
                '}';
    }
}
