package com.synthgov.core.sanitize;

import java.util.List;

/**
 * Output of the sanitization stage: the cleaned snapshot plus every issue
 * found on the way. Either part may be empty, neither is ever null.
 */
public record SanitizedMetrics(MetricSnapshot snapshot, List<SanitizationIssue> issues) {

    public SanitizedMetrics {
        snapshot = snapshot != null ? snapshot : MetricSnapshot.empty();
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
