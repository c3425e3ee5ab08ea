package com.synthgov.core.audit;

import com.synthgov.core.GovernanceConfigurationException;
import com.synthgov.core.GovernanceEngine;
import com.synthgov.core.TestCatalogs;
import com.synthgov.core.assemble.GovernanceResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAuditSinkTest {

    private static final Instant AT = Instant.parse("2024-05-01T12:00:00Z");

    private final GovernanceResult result = new GovernanceEngine(TestCatalogs.standard())
            .evaluate(Map.of("membership_inference_auc", 0.9, "privacy_score", 0.85));

    @Test
    void recordCapturesOutcomeOnly() {
        AuditRecord record = AuditRecord.of("eval-1", AT, result);

        assertThat(record.getOverallRiskLevel()).isEqualTo("critical");
        assertThat(record.getTotalThreats()).isEqualTo(2);
        assertThat(record.getThreatIds()).containsExactly("membership_inference", "privacy_leakage");
        assertThat(record.getUnresolvedRules()).containsExactly("utility-score");
        assertThat(record.hasUncertainty()).isTrue();
        assertThat(record.getMode()).isEqualTo("summary");
        assertThat(record.getRecordedAt()).isEqualTo(AT);
    }

    @Test
    void evictsOldestBeyondCapacity() {
        InMemoryAuditSink sink = new InMemoryAuditSink(2);

        sink.record(AuditRecord.of("a", AT, result));
        sink.record(AuditRecord.of("b", AT, result));
        sink.record(AuditRecord.of("c", AT, result));

        assertThat(sink.size()).isEqualTo(2);
        assertThat(sink.recent(10)).extracting(AuditRecord::getEvaluationId).containsExactly("b", "c");
    }

    @Test
    void recentReturnsNewestLast() {
        InMemoryAuditSink sink = new InMemoryAuditSink(5);
        sink.record(AuditRecord.of("a", AT, result));
        sink.record(AuditRecord.of("b", AT, result));
        sink.record(AuditRecord.of("c", AT, result));

        assertThat(sink.recent(2)).extracting(AuditRecord::getEvaluationId).containsExactly("b", "c");
        assertThat(sink.recent(0)).isEmpty();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new InMemoryAuditSink(0))
                .isInstanceOf(GovernanceConfigurationException.class)
                .hasMessageContaining("synthgov.audit.capacity");
    }
}
