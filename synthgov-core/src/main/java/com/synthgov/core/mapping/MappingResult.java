package com.synthgov.core.mapping;

import com.synthgov.core.model.ThreatSignal;

import java.util.List;

/**
 * Signals in catalog order plus the bookkeeping the aggregator needs to
 * decide between {@code low} and {@code unknown}.
 */
public record MappingResult(List<ThreatSignal> signals, List<UnresolvedRule> unresolvedRules,
        int evaluatedRules, int notApplicableRules) {

    public MappingResult {
        signals = List.copyOf(signals);
        unresolvedRules = List.copyOf(unresolvedRules);
    }

    public static MappingResult empty() {
        return new MappingResult(List.of(), List.of(), 0, 0);
    }

    public boolean hasUnresolvedRules() {
        return !unresolvedRules.isEmpty();
    }
}
