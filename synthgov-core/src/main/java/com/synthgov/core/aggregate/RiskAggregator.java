package com.synthgov.core.aggregate;

import com.synthgov.core.GovernanceConfigurationException;
import com.synthgov.core.mapping.MappingResult;
import com.synthgov.core.model.ImpactedProperty;
import com.synthgov.core.model.RiskLevel;
import com.synthgov.core.model.Severity;
import com.synthgov.core.model.ThreatSignal;
import com.synthgov.core.sanitize.SanitizationIssue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rolls the signals of one evaluation up into a {@link DatasetRiskSummary}.
 *
 * <p>
 * Escalation is a fixed decision list, evaluated top to bottom:
 * </p>
 * <ol>
 * <li>no signals, nothing unresolved: {@code low}</li>
 * <li>no signals, at least one rule unresolved: {@code unknown}</li>
 * <li>any high severity signal: {@code critical}</li>
 * <li>any medium severity signal: {@code warning}</li>
 * <li>otherwise: {@code low}</li>
 * </ol>
 */
public class RiskAggregator {

    public static final int DEFAULT_TOP_THREATS_LIMIT = 5;

    /** Dominant kinds named in the summary sentence. */
    private static final int SUMMARY_KINDS = 3;

    // Severity, then confidence, then property weight. The sort is stable over
    // catalog order, which settles whatever is still tied.
    private static final Comparator<ThreatSignal> PRIORITY = Comparator
            .comparing(ThreatSignal::getSeverity, Comparator.comparingInt(Severity::rank)).reversed()
            .thenComparing(Comparator.comparingDouble(ThreatSignal::getConfidence).reversed())
            .thenComparing(Comparator.comparingInt((ThreatSignal s) -> s.getThreatKind().getPriorityWeight()).reversed());

    private final int topThreatsLimit;

    public RiskAggregator() {
        this(DEFAULT_TOP_THREATS_LIMIT);
    }

    public RiskAggregator(int topThreatsLimit) {
        if (topThreatsLimit < 1) {
            throw new GovernanceConfigurationException("top-threats-limit must be at least 1, was " + topThreatsLimit);
        }
        this.topThreatsLimit = topThreatsLimit;
    }

    public int getTopThreatsLimit() {
        return topThreatsLimit;
    }

    public DatasetRiskSummary aggregate(MappingResult mapping, List<SanitizationIssue> issues) {
        List<ThreatSignal> signals = mapping.signals();

        Map<Severity, Integer> severityBreakdown = new EnumMap<>(Severity.class);
        Map<ImpactedProperty, Integer> propertyBreakdown = new EnumMap<>(ImpactedProperty.class);
        for (Severity severity : Severity.values()) {
            severityBreakdown.put(severity, 0);
        }
        for (ImpactedProperty property : ImpactedProperty.values()) {
            propertyBreakdown.put(property, 0);
        }
        for (ThreatSignal signal : signals) {
            severityBreakdown.merge(signal.getSeverity(), 1, Integer::sum);
            propertyBreakdown.merge(signal.getThreatKind().getImpactedProperty(), 1, Integer::sum);
        }

        Escalation escalation = escalate(signals, mapping.unresolvedRules().size(), severityBreakdown);
        List<ThreatSignal> topThreats = rank(signals);

        List<String> notes = new ArrayList<>();
        issues.forEach(issue -> notes.add(issue.describe()));
        mapping.unresolvedRules().forEach(rule -> notes.add(rule.describe()));

        return DatasetRiskSummary.builder()
                .overallRiskLevel(escalation.level)
                .totalThreats(signals.size())
                .severityBreakdown(severityBreakdown)
                .propertyBreakdown(propertyBreakdown)
                .topThreats(topThreats)
                .escalationReasons(List.of(escalation.reason))
                .summary(summarize(escalation.level, signals.size(), severityBreakdown, topThreats,
                        mapping.unresolvedRules().size(), !notes.isEmpty()))
                .threatIds(signals.stream().map(ThreatSignal::getThreatId).distinct().collect(Collectors.toList()))
                .confidenceStats(confidenceStats(signals))
                .evaluatedRules(mapping.evaluatedRules())
                .unresolvedRules(mapping.unresolvedRules().stream()
                        .map(unresolved -> unresolved.rule().getId())
                        .collect(Collectors.toList()))
                .uncertaintyNotes(notes)
                .build();
    }

    List<ThreatSignal> rank(List<ThreatSignal> signals) {
        return signals.stream()
                .sorted(PRIORITY)
                .limit(topThreatsLimit)
                .collect(Collectors.toList());
    }

    private static Escalation escalate(List<ThreatSignal> signals, int unresolved,
            Map<Severity, Integer> severityBreakdown) {
        if (signals.isEmpty() && unresolved == 0) {
            return new Escalation(RiskLevel.LOW, "No threats detected");
        }
        if (signals.isEmpty()) {
            return new Escalation(RiskLevel.UNKNOWN,
                    "No threat could be evaluated: " + unresolved + " rule(s) lacked usable metrics");
        }
        int high = severityBreakdown.get(Severity.HIGH);
        if (high > 0) {
            return new Escalation(RiskLevel.CRITICAL,
                    high + " high severity threat signal(s) detected: " + kindsAt(signals, Severity.HIGH));
        }
        int medium = severityBreakdown.get(Severity.MEDIUM);
        if (medium > 0) {
            return new Escalation(RiskLevel.WARNING,
                    medium + " medium severity threat signal(s) detected: " + kindsAt(signals, Severity.MEDIUM));
        }
        return new Escalation(RiskLevel.LOW, "Only low severity threat signals detected");
    }

    private static String kindsAt(List<ThreatSignal> signals, Severity severity) {
        return signals.stream()
                .filter(s -> s.getSeverity() == severity)
                .map(ThreatSignal::getThreatId)
                .distinct()
                .collect(Collectors.joining(", "));
    }

    private static String summarize(RiskLevel level, int total, Map<Severity, Integer> severityBreakdown,
            List<ThreatSignal> topThreats, int unresolved, boolean uncertain) {
        StringBuilder sb = new StringBuilder();
        switch (level) {
            case CRITICAL -> sb.append("CRITICAL RISK: immediate review required.");
            case WARNING -> sb.append("WARNING: elevated risk detected.");
            case UNKNOWN -> sb.append("UNKNOWN RISK: insufficient data to evaluate ")
                    .append(unresolved).append(" rule(s).");
            case LOW -> sb.append(total == 0
                    ? "LOW RISK: no threats detected."
                    : "LOW RISK: minor concerns detected.");
        }

        if (total > 0) {
            sb.append(String.format(Locale.ROOT, " Detected %d threat signal(s): %d high, %d medium, %d low severity.",
                    total, severityBreakdown.get(Severity.HIGH), severityBreakdown.get(Severity.MEDIUM),
                    severityBreakdown.get(Severity.LOW)));

            Set<String> dominant = new LinkedHashSet<>();
            for (ThreatSignal signal : topThreats) {
                if (dominant.size() == SUMMARY_KINDS) {
                    break;
                }
                dominant.add(signal.getThreatName() + " (" + signal.getSeverity().id() + ")");
            }
            sb.append(" Dominant threats: ").append(String.join(", ", dominant)).append('.');
        }

        if (uncertain) {
            sb.append(" Some metrics were missing or invalid; see uncertainty notes.");
        }
        return sb.toString();
    }

    private static DatasetRiskSummary.ConfidenceStats confidenceStats(List<ThreatSignal> signals) {
        if (signals.isEmpty()) {
            return DatasetRiskSummary.ConfidenceStats.NONE;
        }
        double sum = 0.0;
        double max = 0.0;
        double min = 1.0;
        for (ThreatSignal signal : signals) {
            sum += signal.getConfidence();
            max = Math.max(max, signal.getConfidence());
            min = Math.min(min, signal.getConfidence());
        }
        double avg = Math.round(sum / signals.size() * 1000.0) / 1000.0;
        return new DatasetRiskSummary.ConfidenceStats(avg, max, min);
    }

    private record Escalation(RiskLevel level, String reason) {
    }
}
