package com.synthgov.core.mapping;

import com.synthgov.core.catalog.ThresholdRule;

/**
 * A rule that should have been evaluated but had no usable value.
 *
 * @param rule   the rule that was skipped
 * @param path   the first candidate path, or the unavailable one if present
 * @param reason {@code missing} or {@code unavailable}
 */
public record UnresolvedRule(ThresholdRule rule, String path, String reason) {

    public String describe() {
        return "insufficient data to evaluate " + rule.getThreatKind().id()
                + " (rule " + rule.getId() + ": " + path + " " + reason + ")";
    }
}
