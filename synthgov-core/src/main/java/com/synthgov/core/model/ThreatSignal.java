package com.synthgov.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One evidenced concern about a dataset, produced by exactly one rule
 * evaluation. The triggering value is kept verbatim so an auditor can trace
 * the signal without re-running anything.
 */
public final class ThreatSignal {

    private final ThreatKind threatKind;
    private final String ruleId;
    private final Severity severity;
    private final double confidence;
    private final String metricPath;
    private final Object triggeringValue;
    private final Map<String, Object> evidence;
    private final List<String> triggeredConditions;

    private ThreatSignal(ThreatKind threatKind, String ruleId, Severity severity, double confidence,
            String metricPath, Object triggeringValue, Map<String, Object> evidence,
            List<String> triggeredConditions) {
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must lie in [0, 1], was " + confidence);
        }
        this.threatKind = threatKind;
        this.ruleId = ruleId;
        this.severity = severity;
        this.confidence = confidence;
        this.metricPath = metricPath;
        this.triggeringValue = triggeringValue;
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
        this.triggeredConditions = List.copyOf(triggeredConditions);
    }

    /**
     * @param evidence            metric path to literal value; the triggering
     *                            path must come first
     * @param triggeredConditions crossed boundaries, most severe first
     */
    public static ThreatSignal of(ThreatKind threatKind, String ruleId, Severity severity, double confidence,
            String metricPath, Object triggeringValue, Map<String, Object> evidence,
            List<String> triggeredConditions) {
        return new ThreatSignal(threatKind, ruleId, severity, confidence, metricPath, triggeringValue,
                evidence, triggeredConditions);
    }

    public ThreatKind getThreatKind() {
        return threatKind;
    }

    public String getThreatId() {
        return threatKind.id();
    }

    public String getThreatName() {
        return threatKind.getDisplayName();
    }

    public String getRuleId() {
        return ruleId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getMetricPath() {
        return metricPath;
    }

    public Object getTriggeringValue() {
        return triggeringValue;
    }

    public Map<String, Object> getEvidence() {
        return evidence;
    }

    public List<String> getTriggeredConditions() {
        return triggeredConditions;
    }

    /**
     * Copy keeping only the first {@code limit} evidence entries and conditions.
     * The triggering value always survives because it is the first entry.
     */
    public ThreatSignal truncated(int limit) {
        int keep = Math.max(1, limit);
        if (evidence.size() <= keep && triggeredConditions.size() <= keep) {
            return this;
        }
        Map<String, Object> kept = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : evidence.entrySet()) {
            if (kept.size() == keep) {
                break;
            }
            kept.put(entry.getKey(), entry.getValue());
        }
        List<String> conditions = triggeredConditions.subList(0, Math.min(keep, triggeredConditions.size()));
        return new ThreatSignal(threatKind, ruleId, severity, confidence, metricPath, triggeringValue,
                kept, conditions);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("threat_id", getThreatId());
        map.put("threat_name", getThreatName());
        map.put("rule_id", ruleId);
        map.put("impacted_property", threatKind.getImpactedProperty().id());
        map.put("severity", severity.id());
        map.put("confidence", confidence);
        map.put("triggered_conditions", new ArrayList<>(triggeredConditions));
        map.put("evidence", new LinkedHashMap<>(evidence));
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ThreatSignal other)) {
            return false;
        }
        return threatKind == other.threatKind
                && ruleId.equals(other.ruleId)
                && severity == other.severity
                && Double.compare(confidence, other.confidence) == 0
                && metricPath.equals(other.metricPath)
                && evidence.equals(other.evidence)
                && triggeredConditions.equals(other.triggeredConditions);
    }

    @Override
    public int hashCode() {
        int result = threatKind.hashCode();
        result = 31 * result + ruleId.hashCode();
        result = 31 * result + severity.hashCode();
        result = 31 * result + Double.hashCode(confidence);
        result = 31 * result + evidence.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "ThreatSignal{" +
                "threat=" + getThreatId() +
                ", rule='" + ruleId + '\'' +
                ", severity=" + severity.id() +
                ", confidence=" + confidence +
                ", " + metricPath + "=" + triggeringValue +
                '}';
    }
}
