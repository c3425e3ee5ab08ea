package com.synthgov.core;

import com.synthgov.core.assemble.GovernanceResult;
import com.synthgov.core.config.GovernanceProperties;
import com.synthgov.core.model.OutputMode;
import com.synthgov.core.model.RiskLevel;
import com.synthgov.core.model.Severity;
import com.synthgov.core.model.ThreatSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GovernanceEngineTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private GovernanceEngine engine;

    @BeforeEach
    void setUp() {
        engine = new GovernanceEngine(TestCatalogs.standard(), new GovernanceProperties(), FIXED);
    }

    private static Map<String, Object> healthyMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("privacy_score", 0.85);
        metrics.put("utility_score", 0.90);
        metrics.put("privacy_risk", Map.of("membership_inference_auc", 0.52));
        return metrics;
    }

    @Nested
    @DisplayName("reference scenarios")
    class Scenarios {

        @Test
        @DisplayName("healthy metrics in summary mode report low risk without threats")
        void healthyMetricsAreLowRisk() {
            GovernanceResult result = engine.evaluate(healthyMetrics(), "summary");

            assertThat(result.getDatasetRiskSummary().getOverallRiskLevel()).isEqualTo(RiskLevel.LOW);
            assertThat(result.hasUncertainty()).isFalse();
            assertThat(result.getThreats()).isEmpty();
            assertThat(result.toMap()).doesNotContainKey("threats");
        }

        @Test
        @DisplayName("a high membership inference AUC is critical with high confidence")
        void highAucIsCritical() {
            Map<String, Object> metrics = Map.of("privacy_risk", Map.of("membership_inference_auc", 0.9));

            GovernanceResult result = engine.evaluate(metrics, OutputMode.FULL);

            assertThat(result.getDatasetRiskSummary().getOverallRiskLevel()).isEqualTo(RiskLevel.CRITICAL);
            List<ThreatSignal> threats = result.getThreats().orElseThrow();
            assertThat(threats).hasSize(1);
            ThreatSignal signal = threats.get(0);
            assertThat(signal.getThreatId()).isEqualTo("membership_inference");
            assertThat(signal.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(signal.getConfidence()).isGreaterThan(0.8);
            assertThat(signal.getEvidence()).containsEntry("privacy_risk.membership_inference_auc", 0.9);
        }

        @Test
        @DisplayName("an empty mapping is unknown, never low")
        void emptyMappingIsUnknown() {
            GovernanceResult result = engine.evaluate(Map.of());

            assertThat(result.getDatasetRiskSummary().getOverallRiskLevel()).isEqualTo(RiskLevel.UNKNOWN);
            assertThat(result.hasUncertainty()).isTrue();
            assertThat(result.getUncertaintyNotes()).hasSize(3);
            assertThat(result.getUncertaintyNotes().get(0))
                    .startsWith("insufficient data to evaluate membership_inference");
        }
    }

    @Nested
    @DisplayName("caller contract")
    class Contract {

        @Test
        void rejectsNull() {
            assertThatThrownBy(() -> engine.evaluate(null))
                    .isInstanceOf(GovernanceContractException.class)
                    .hasMessageContaining("must not be null");
        }

        @Test
        void rejectsNonMapInput() {
            assertThatThrownBy(() -> engine.evaluate(List.of(0.5)))
                    .isInstanceOf(GovernanceContractException.class)
                    .hasMessageContaining("must be a map");
        }

        @Test
        void rejectsNonStringKeys() {
            Map<Object, Object> metrics = new HashMap<>();
            metrics.put(42, 0.5);

            assertThatThrownBy(() -> engine.evaluate(metrics))
                    .isInstanceOf(GovernanceContractException.class)
                    .hasMessageContaining("Integer");
        }

        @Test
        void rejectsUnknownMode() {
            assertThatThrownBy(() -> engine.evaluate(healthyMetrics(), "verbose"))
                    .isInstanceOf(GovernanceContractException.class)
                    .hasMessageContaining("verbose");
        }

        @Test
        void contractViolationsAreIllegalArguments() {
            assertThatThrownBy(() -> engine.evaluate("privacy_score=0.8"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("an unknown configured mode fails at construction")
        void rejectsUnknownConfiguredMode() {
            GovernanceProperties properties = new GovernanceProperties();
            properties.setOutputMode("everything");

            assertThatThrownBy(() -> new GovernanceEngine(TestCatalogs.standard(), properties, FIXED))
                    .isInstanceOf(GovernanceConfigurationException.class)
                    .hasMessageContaining("synthgov.output-mode");
        }
    }

    @Nested
    @DisplayName("evaluation properties")
    class Properties {

        @Test
        @DisplayName("identical input and clock give identical documents")
        void deterministic() {
            Map<String, Object> metrics = new LinkedHashMap<>(healthyMetrics());
            metrics.put("statistical_drift", "moderate");
            metrics.put("semantic_violations", 42);

            assertThat(engine.evaluate(metrics, "full").toMap())
                    .isEqualTo(engine.evaluate(metrics, "full").toMap());
        }

        @Test
        @DisplayName("the caller's map is never modified")
        void inputUntouched() {
            Map<String, Object> nested = new HashMap<>();
            nested.put("membership_inference_auc", Double.NaN);
            Map<String, Object> metrics = new HashMap<>();
            metrics.put("privacy_risk", nested);
            metrics.put("privacy_score", null);

            engine.evaluate(metrics, "full");

            assertThat(nested).containsOnlyKeys("membership_inference_auc");
            assertThat((Double) nested.get("membership_inference_auc")).isNaN();
            assertThat(metrics).containsKeys("privacy_risk", "privacy_score");
        }

        @Test
        @DisplayName("raising the AUC never lowers severity or confidence")
        void monotoneInAuc() {
            double previousConfidence = 0.0;
            int previousRank = -1;
            for (double auc = 0.56; auc <= 1.0; auc += 0.02) {
                GovernanceResult result = engine.evaluate(Map.of("membership_inference_auc", auc), "full");
                ThreatSignal signal = result.getThreats().orElseThrow().stream()
                        .filter(s -> s.getRuleId().equals("membership-inference-auc"))
                        .findFirst().orElseThrow();

                assertThat(signal.getSeverity().rank()).isGreaterThanOrEqualTo(previousRank);
                assertThat(signal.getConfidence()).isGreaterThanOrEqualTo(previousConfidence);
                previousRank = signal.getSeverity().rank();
                previousConfidence = signal.getConfidence();
            }
        }

        @Test
        @DisplayName("medium signals without high ones escalate to warning")
        void mediumIsWarning() {
            Map<String, Object> metrics = healthyMetrics();
            metrics.put("privacy_score", 0.75);

            GovernanceResult result = engine.evaluate(metrics);

            assertThat(result.getDatasetRiskSummary().getOverallRiskLevel()).isEqualTo(RiskLevel.WARNING);
        }

        @Test
        @DisplayName("a non-finite metric becomes two notes: the discard, then the unresolved rule")
        void nonFiniteMetricIsNoted() {
            Map<String, Object> metrics = healthyMetrics();
            metrics.put("privacy_score", Double.NaN);

            GovernanceResult result = engine.evaluate(metrics);

            assertThat(result.hasUncertainty()).isTrue();
            assertThat(result.getUncertaintyNotes()).containsExactly(
                    "metric privacy_score was non-finite (NaN), value discarded",
                    "insufficient data to evaluate privacy_leakage (rule privacy-score: privacy_score unavailable)");
            assertThat(result.getDatasetRiskSummary().getOverallRiskLevel()).isEqualTo(RiskLevel.UNKNOWN);
        }

        @Test
        @DisplayName("detailed mode carries the same threats as full, with less evidence")
        void detailedIsContainedInFull() {
            Map<String, Object> metrics = new LinkedHashMap<>(healthyMetrics());
            metrics.put("privacy_risk", Map.of("membership_inference_auc", 0.72,
                    "membership_inference_accuracy", 0.66));

            List<ThreatSignal> detailed = engine.evaluate(metrics, "detailed").getThreats().orElseThrow();
            List<ThreatSignal> full = engine.evaluate(metrics, "full").getThreats().orElseThrow();

            assertThat(detailed.stream().map(ThreatSignal::getRuleId).collect(Collectors.toList()))
                    .isEqualTo(full.stream().map(ThreatSignal::getRuleId).collect(Collectors.toList()));
            for (int i = 0; i < full.size(); i++) {
                assertThat(full.get(i).getEvidence()).containsAllEntriesOf(detailed.get(i).getEvidence());
                assertThat(full.get(i).getTriggeredConditions())
                        .containsAll(detailed.get(i).getTriggeredConditions());
            }
        }

        @Test
        @DisplayName("no decision field ever appears in the document")
        void noDecisionFields() {
            Map<String, Object> document = engine.evaluate(Map.of("membership_inference_auc", 0.99), "full").toMap();

            assertThat(document).doesNotContainKeys("approved", "rejected", "should_deploy", "decision");
            assertThat(document).containsKeys("dataset_risk_summary", "threats", "has_uncertainty",
                    "uncertainty_notes", "disclaimers", "metadata");
        }

        @Test
        void metadataUsesInjectedClock() {
            GovernanceResult result = engine.evaluate(healthyMetrics());

            assertThat(result.getMetadata())
                    .containsEntry("timestamp", "2024-05-01T12:00:00Z")
                    .containsEntry("mode", "summary")
                    .containsEntry("version", "2.1.0");
        }
    }
}
