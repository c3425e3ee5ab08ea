package com.synthgov.core.assemble;

import com.synthgov.core.aggregate.DatasetRiskSummary;
import com.synthgov.core.model.OutputMode;
import com.synthgov.core.model.ThreatSignal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outward envelope of one evaluation. Advisory only: there is no
 * field that approves, rejects or gates a dataset.
 */
public final class GovernanceResult {

    private final DatasetRiskSummary datasetRiskSummary;
    private final List<ThreatSignal> threats;
    private final boolean hasUncertainty;
    private final List<String> uncertaintyNotes;
    private final List<String> disclaimers;
    private final Map<String, Object> metadata;
    private final OutputMode mode;

    GovernanceResult(DatasetRiskSummary datasetRiskSummary, List<ThreatSignal> threats, OutputMode mode,
            List<String> disclaimers, Map<String, Object> metadata) {
        this.datasetRiskSummary = datasetRiskSummary;
        this.threats = threats != null ? List.copyOf(threats) : null;
        this.hasUncertainty = datasetRiskSummary.hasUncertainty();
        this.uncertaintyNotes = datasetRiskSummary.getUncertaintyNotes();
        this.disclaimers = List.copyOf(disclaimers);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.mode = mode;
    }

    public DatasetRiskSummary getDatasetRiskSummary() {
        return datasetRiskSummary;
    }

    /** Empty in {@link OutputMode#SUMMARY}. */
    public Optional<List<ThreatSignal>> getThreats() {
        return Optional.ofNullable(threats);
    }

    public boolean hasUncertainty() {
        return hasUncertainty;
    }

    public List<String> getUncertaintyNotes() {
        return uncertaintyNotes;
    }

    public List<String> getDisclaimers() {
        return disclaimers;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public OutputMode getMode() {
        return mode;
    }

    /**
     * Nested key-value document. The {@code threats} key is absent, not null,
     * when the mode excludes it.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("dataset_risk_summary", datasetRiskSummary.toMap());
        if (threats != null) {
            List<Map<String, Object>> list = new ArrayList<>(threats.size());
            threats.forEach(t -> list.add(t.toMap()));
            map.put("threats", list);
        }
        map.put("has_uncertainty", hasUncertainty);
        map.put("uncertainty_notes", new ArrayList<>(uncertaintyNotes));
        map.put("disclaimers", new ArrayList<>(disclaimers));
        map.put("metadata", copy(metadata));
        return map;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value instanceof Map<?, ?> nested) {
                copy.put(key, new LinkedHashMap<>(nested));
            } else {
                copy.put(key, value);
            }
        });
        return copy;
    }

    @Override
    public String toString() {
        return "GovernanceResult{" +
                "level=" + datasetRiskSummary.getOverallRiskLevel().id() +
                ", mode=" + mode.id() +
                ", threats=" + (threats != null ? threats.size() : "omitted") +
                ", uncertain=" + hasUncertainty +
                '}';
    }
}
