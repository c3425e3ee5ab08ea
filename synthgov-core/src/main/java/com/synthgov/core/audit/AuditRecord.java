package com.synthgov.core.audit;

import com.synthgov.core.aggregate.DatasetRiskSummary;
import com.synthgov.core.assemble.GovernanceResult;

import java.time.Instant;
import java.util.List;

/**
 * What gets written to the audit trail for one evaluation. Holds only the
 * derived outcome, never the raw metrics.
 */
public final class AuditRecord {

    private final String evaluationId;
    private final Instant recordedAt;
    private final String overallRiskLevel;
    private final int totalThreats;
    private final List<String> threatIds;
    private final List<String> unresolvedRules;
    private final boolean hasUncertainty;
    private final String mode;

    private AuditRecord(String evaluationId, Instant recordedAt, String overallRiskLevel, int totalThreats,
            List<String> threatIds, List<String> unresolvedRules, boolean hasUncertainty, String mode) {
        this.evaluationId = evaluationId;
        this.recordedAt = recordedAt;
        this.overallRiskLevel = overallRiskLevel;
        this.totalThreats = totalThreats;
        this.threatIds = List.copyOf(threatIds);
        this.unresolvedRules = List.copyOf(unresolvedRules);
        this.hasUncertainty = hasUncertainty;
        this.mode = mode;
    }

    public static AuditRecord of(String evaluationId, Instant recordedAt, GovernanceResult result) {
        DatasetRiskSummary summary = result.getDatasetRiskSummary();
        return new AuditRecord(evaluationId, recordedAt, summary.getOverallRiskLevel().id(),
                summary.getTotalThreats(), summary.getThreatIds(), summary.getUnresolvedRules(),
                result.hasUncertainty(), result.getMode().id());
    }

    public String getEvaluationId() {
        return evaluationId;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    public String getOverallRiskLevel() {
        return overallRiskLevel;
    }

    public int getTotalThreats() {
        return totalThreats;
    }

    public List<String> getThreatIds() {
        return threatIds;
    }

    public List<String> getUnresolvedRules() {
        return unresolvedRules;
    }

    public boolean hasUncertainty() {
        return hasUncertainty;
    }

    public String getMode() {
        return mode;
    }

    @Override
    public String toString() {
        return "AuditRecord{" +
                "id='" + evaluationId + '\'' +
                ", at=" + recordedAt +
                ", level=" + overallRiskLevel +
                ", threats=" + totalThreats +
                ", uncertain=" + hasUncertainty +
                '}';
    }
}
