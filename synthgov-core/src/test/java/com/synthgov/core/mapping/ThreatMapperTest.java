package com.synthgov.core.mapping;

import com.synthgov.core.TestCatalogs;
import com.synthgov.core.catalog.ConfidenceModel;
import com.synthgov.core.catalog.PredicateKind;
import com.synthgov.core.catalog.ThreatCatalog;
import com.synthgov.core.catalog.ThresholdRule;
import com.synthgov.core.model.Severity;
import com.synthgov.core.model.ThreatKind;
import com.synthgov.core.model.ThreatSignal;
import com.synthgov.core.sanitize.MetricSanitizer;
import com.synthgov.core.sanitize.MetricSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ThreatMapperTest {

    private static MappingResult map(ThreatCatalog catalog, Map<String, ?> metrics) {
        MetricSnapshot snapshot = new MetricSanitizer(catalog).sanitize(metrics).snapshot();
        return new ThreatMapper(catalog).map(snapshot);
    }

    private static ThreatSignal single(ThresholdRule rule, Map<String, ?> metrics) {
        List<ThreatSignal> signals = map(ThreatCatalog.of(rule), metrics).signals();
        assertThat(signals).hasSize(1);
        return signals.get(0);
    }

    @Nested
    @DisplayName("numeric predicates")
    class Numeric {

        @Test
        @DisplayName("reports one condition per crossed tier, most severe first")
        void conditionsPerCrossedTier() {
            ThreatSignal signal = single(TestCatalogs.membershipInference(),
                    Map.of("privacy_risk", Map.of("membership_inference_auc", 0.9)));

            assertThat(signal.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(signal.getConfidence()).isEqualTo(1.0);
            assertThat(signal.getTriggeredConditions()).containsExactly(
                    "privacy_risk.membership_inference_auc (0.9) > 0.7 [high]",
                    "privacy_risk.membership_inference_auc (0.9) > 0.6 [medium]",
                    "privacy_risk.membership_inference_auc (0.9) > 0.55 [low]");
        }

        @ParameterizedTest
        @CsvSource({
                "0.56, LOW",
                "0.60, LOW",
                "0.61, MEDIUM",
                "0.70, MEDIUM",
                "0.71, HIGH"
        })
        void strictBoundariesPickFirstMatchingTier(double auc, Severity expected) {
            ThreatSignal signal = single(TestCatalogs.membershipInference(), Map.of("membership_inference_auc", auc));

            assertThat(signal.getSeverity()).isEqualTo(expected);
        }

        @Test
        void valueAtEntryBoundaryDoesNotTriggerStrictPredicate() {
            MappingResult result = map(ThreatCatalog.of(TestCatalogs.membershipInference()),
                    Map.of("membership_inference_auc", 0.55));

            assertThat(result.signals()).isEmpty();
            assertThat(result.evaluatedRules()).isEqualTo(1);
        }

        @Test
        @DisplayName("equal boundaries resolve to the more severe tier")
        void tiesGoToMoreSevereTier() {
            ThresholdRule rule = TestCatalogs.membershipInference().toBuilder()
                    .predicate(PredicateKind.GREATER_OR_EQUAL)
                    .boundaries(0.7, 0.7, 0.6)
                    .build();

            ThreatSignal signal = single(rule, Map.of("membership_inference_auc", 0.7));

            assertThat(signal.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(signal.getTriggeredConditions()).hasSize(3);
        }

        @Test
        void lessThanMeasuresDistanceDownwards() {
            ThreatSignal low = single(TestCatalogs.privacyScore(), Map.of("privacy_score", 0.85));
            ThreatSignal high = single(TestCatalogs.privacyScore(), Map.of("privacy_score", 0.4));

            assertThat(low.getSeverity()).isEqualTo(Severity.LOW);
            assertThat(low.getConfidence()).isCloseTo(0.388, within(0.001));
            assertThat(low.getTriggeredConditions()).containsExactly("privacy_score (0.85) < 0.9 [low]");
            assertThat(high.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(high.getConfidence()).isEqualTo(1.0);
        }

        @Test
        void integerMetricsKeepTheirLiteral() {
            ThreatSignal signal = single(TestCatalogs.semanticViolations(), Map.of("semantic_violations", 42));

            assertThat(signal.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(signal.getTriggeringValue()).isEqualTo(42);
            assertThat(signal.getTriggeredConditions()).first().isEqualTo("semantic_violations (42) > 10 [medium]");
        }

        @Test
        @DisplayName("range rules measure the deviation outside the band")
        void rangeDeviation() {
            ThresholdRule rule = ThresholdRule.builder()
                    .id("histogram-overlap")
                    .threatKind(ThreatKind.DISTRIBUTION_DRIFT)
                    .metricPath("statistical_fidelity.mean_ratio")
                    .predicate(PredicateKind.RANGE)
                    .band(0.4, 0.6)
                    .boundaries(0.3, 0.2, 0.1)
                    .confidence(ConfidenceModel.linear(0.4, 0.2))
                    .build();
            ThreatCatalog catalog = ThreatCatalog.of(rule);

            assertThat(map(catalog, Map.of("statistical_fidelity.mean_ratio", 0.5)).signals()).isEmpty();

            ThreatSignal below = single(rule, Map.of("statistical_fidelity.mean_ratio", 0.25));
            assertThat(below.getSeverity()).isEqualTo(Severity.LOW);
            assertThat(below.getTriggeredConditions())
                    .containsExactly("statistical_fidelity.mean_ratio (0.25) outside [0.4, 0.6] by 0.15 > 0.1 [low]");

            ThreatSignal above = single(rule, Map.of("statistical_fidelity.mean_ratio", 0.95));
            assertThat(above.getSeverity()).isEqualTo(Severity.HIGH);
        }

        @Test
        @DisplayName("a decimal too large for a double leaves a range rule unresolved")
        void overflowingDecimalLeavesRangeRuleUnresolved() {
            ThresholdRule rule = ThresholdRule.builder()
                    .id("histogram-overlap")
                    .threatKind(ThreatKind.DISTRIBUTION_DRIFT)
                    .metricPath("statistical_fidelity.mean_ratio")
                    .predicate(PredicateKind.RANGE)
                    .band(0.4, 0.6)
                    .boundaries(0.3, 0.2, 0.1)
                    .confidence(ConfidenceModel.linear(0.4, 0.2))
                    .build();

            MappingResult result = map(ThreatCatalog.of(rule),
                    Map.of("statistical_fidelity.mean_ratio", new BigDecimal("1e400")));

            assertThat(result.signals()).isEmpty();
            assertThat(result.unresolvedRules()).singleElement().satisfies(unresolved -> {
                assertThat(unresolved.rule().getId()).isEqualTo("histogram-overlap");
                assertThat(unresolved.reason()).isEqualTo("unavailable");
            });
        }

        @Test
        @DisplayName("confidence never decreases as the value moves into threat territory")
        void monotoneConfidence() {
            ThresholdRule rule = TestCatalogs.nearDuplicateRate();
            double previous = 0.0;
            for (int i = 1; i <= 60; i++) {
                double rate = 0.005 + i * 0.001;
                ThreatSignal signal = single(rule, Map.of("privacy_risk.near_duplicates_rate", rate));
                assertThat(signal.getConfidence()).isBetween(0.0, 1.0).isGreaterThanOrEqualTo(previous);
                previous = signal.getConfidence();
            }
        }
    }

    @Nested
    @DisplayName("categorical predicates")
    class Categorical {

        @Test
        void matchesCaseInsensitively() {
            ThreatSignal signal = single(TestCatalogs.driftLevel(), Map.of("statistical_drift", "Moderate"));

            assertThat(signal.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(signal.getConfidence()).isEqualTo(0.6);
            assertThat(signal.getTriggeredConditions())
                    .containsExactly("statistical_drift (\"Moderate\") in [moderate] [medium]");
            assertThat(signal.getEvidence()).containsEntry("statistical_drift", "Moderate");
        }

        @Test
        void unlistedLabelProducesNoSignal() {
            MappingResult result = map(ThreatCatalog.of(TestCatalogs.driftLevel()), Map.of("statistical_drift", "none"));

            assertThat(result.signals()).isEmpty();
            assertThat(result.evaluatedRules()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("resolution")
    class Resolution {

        @Test
        void fallsBackToAliasPath() {
            ThreatSignal signal = single(TestCatalogs.membershipInference(), Map.of("membership_inference_auc", 0.65));

            assertThat(signal.getMetricPath()).isEqualTo("membership_inference_auc");
            assertThat(signal.getEvidence()).containsOnlyKeys("membership_inference_auc");
        }

        @Test
        void primaryPathWinsOverAlias() {
            ThreatSignal signal = single(TestCatalogs.membershipInference(), Map.of(
                    "membership_inference_auc", 0.56,
                    "privacy_risk", Map.of("membership_inference_auc", 0.9)));

            assertThat(signal.getMetricPath()).isEqualTo("privacy_risk.membership_inference_auc");
            assertThat(signal.getSeverity()).isEqualTo(Severity.HIGH);
        }

        @Test
        void evidenceListsTriggerThenContext() {
            ThreatSignal signal = single(TestCatalogs.membershipInference(), Map.of("privacy_risk", Map.of(
                    "membership_inference_accuracy", 0.66,
                    "membership_inference_auc", 0.72)));

            assertThat(List.copyOf(signal.getEvidence().keySet())).containsExactly(
                    "privacy_risk.membership_inference_auc", "privacy_risk.membership_inference_accuracy");
        }

        @Test
        void unavailableValueLeavesRuleUnresolved() {
            MappingResult result = map(TestCatalogs.standard(), Map.of(
                    "privacy_score", Double.NaN,
                    "utility_score", 0.95,
                    "membership_inference_auc", 0.5));

            assertThat(result.signals()).isEmpty();
            assertThat(result.unresolvedRules()).singleElement().satisfies(unresolved -> {
                assertThat(unresolved.rule().getId()).isEqualTo("privacy-score");
                assertThat(unresolved.reason()).isEqualTo("unavailable");
                assertThat(unresolved.describe()).isEqualTo(
                        "insufficient data to evaluate privacy_leakage (rule privacy-score: privacy_score unavailable)");
            });
        }

        @Test
        @DisplayName("missing required rules are unresolved, missing optional ones are skipped")
        void requiredVersusOptional() {
            MappingResult result = map(TestCatalogs.standard(), Map.of());

            assertThat(result.unresolvedRules()).extracting(u -> u.rule().getId())
                    .containsExactly("membership-inference-auc", "privacy-score", "utility-score");
            assertThat(result.unresolvedRules()).extracting(UnresolvedRule::reason).containsOnly("missing");
            assertThat(result.notApplicableRules()).isEqualTo(3);
            assertThat(result.evaluatedRules()).isZero();
        }

        @Test
        @DisplayName("signals follow catalog order regardless of input order")
        void catalogOrder() {
            MappingResult result = map(TestCatalogs.standard(), Map.of(
                    "semantic_violations", 500,
                    "statistical_drift", "high",
                    "privacy_score", 0.5,
                    "membership_inference_auc", 0.8,
                    "utility_score", 0.6));

            assertThat(result.signals()).extracting(ThreatSignal::getRuleId).containsExactly(
                    "membership-inference-auc", "privacy-score", "utility-score",
                    "distribution-drift-level", "semantic-violations");
        }
    }
}
