package com.synthgov.core.assemble;

import com.synthgov.core.GovernanceConfigurationException;
import com.synthgov.core.aggregate.DatasetRiskSummary;
import com.synthgov.core.aggregate.RiskAggregator;
import com.synthgov.core.mapping.MappingResult;
import com.synthgov.core.model.OutputMode;
import com.synthgov.core.model.Severity;
import com.synthgov.core.model.ThreatKind;
import com.synthgov.core.model.ThreatSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultAssemblerTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T12:00:00.123456Z"), ZoneOffset.UTC);

    private ThreatSignal signal;
    private DatasetRiskSummary summary;

    @BeforeEach
    void setUp() {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("privacy_risk.membership_inference_auc", 0.72);
        evidence.put("privacy_risk.membership_inference_accuracy", 0.66);
        signal = ThreatSignal.of(ThreatKind.MEMBERSHIP_INFERENCE, "membership-inference-auc", Severity.HIGH, 0.34,
                "privacy_risk.membership_inference_auc", 0.72, evidence, List.of(
                        "privacy_risk.membership_inference_auc (0.72) > 0.7 [high]",
                        "privacy_risk.membership_inference_auc (0.72) > 0.6 [medium]",
                        "privacy_risk.membership_inference_auc (0.72) > 0.55 [low]"));
        summary = new RiskAggregator().aggregate(new MappingResult(List.of(signal), List.of(), 1, 0), List.of());
    }

    private static ResultAssembler assembler(int evidenceLimit) {
        Map<String, Object> echo = new LinkedHashMap<>();
        echo.put("top_threats_limit", 5);
        echo.put("output_mode", "summary");
        echo.put("evidence_limit", evidenceLimit);
        return new ResultAssembler(FIXED, evidenceLimit, echo);
    }

    @Test
    void summaryModeOmitsThreats() {
        GovernanceResult result = assembler(1).assemble(summary, List.of(signal), OutputMode.SUMMARY);

        assertThat(result.getThreats()).isEmpty();
        assertThat(result.toMap()).doesNotContainKey("threats");
        assertThat(result.getDisclaimers()).isEqualTo(ResultAssembler.DISCLAIMERS);
    }

    @Test
    void detailedModeTruncatesEvidenceButKeepsTheTrigger() {
        GovernanceResult result = assembler(1).assemble(summary, List.of(signal), OutputMode.DETAILED);

        ThreatSignal detailed = result.getThreats().orElseThrow().get(0);
        assertThat(detailed.getEvidence()).containsOnlyKeys("privacy_risk.membership_inference_auc");
        assertThat(detailed.getTriggeredConditions())
                .containsExactly("privacy_risk.membership_inference_auc (0.72) > 0.7 [high]");
        assertThat(detailed.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(detailed.getConfidence()).isEqualTo(0.34);
    }

    @Test
    void widerEvidenceLimitKeepsMore() {
        GovernanceResult result = assembler(2).assemble(summary, List.of(signal), OutputMode.DETAILED);

        ThreatSignal detailed = result.getThreats().orElseThrow().get(0);
        assertThat(detailed.getEvidence()).hasSize(2);
        assertThat(detailed.getTriggeredConditions()).hasSize(2);
    }

    @Test
    void fullModeKeepsEverything() {
        GovernanceResult result = assembler(1).assemble(summary, List.of(signal), OutputMode.FULL);

        assertThat(result.getThreats().orElseThrow()).containsExactly(signal);
    }

    @Test
    void metadataEchoesConfigInKeyOrder() {
        Map<String, Object> metadata = assembler(1).assemble(summary, List.of(), OutputMode.FULL).getMetadata();

        assertThat(metadata).containsEntry("version", ResultAssembler.ENGINE_VERSION)
                .containsEntry("timestamp", "2024-05-01T12:00:00.123Z")
                .containsEntry("mode", "full");
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) metadata.get("config");
        assertThat(config.keySet()).containsExactly("evidence_limit", "output_mode", "top_threats_limit");
    }

    @Test
    void documentIsDetachedFromResult() {
        GovernanceResult result = assembler(1).assemble(summary, List.of(signal), OutputMode.FULL);

        Map<String, Object> document = result.toMap();
        document.clear();

        assertThat(result.toMap()).containsKeys("dataset_risk_summary", "threats", "metadata");
    }

    @Test
    void rejectsNonPositiveEvidenceLimit() {
        assertThatThrownBy(() -> new ResultAssembler(FIXED, 0, Map.of()))
                .isInstanceOf(GovernanceConfigurationException.class)
                .hasMessageContaining("evidence-limit");
    }
}
