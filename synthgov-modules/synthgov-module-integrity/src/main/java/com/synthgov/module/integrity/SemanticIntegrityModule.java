package com.synthgov.module.integrity;

import com.synthgov.core.catalog.ConfidenceModel;
import com.synthgov.core.catalog.PredicateKind;
import com.synthgov.core.catalog.ThresholdRule;
import com.synthgov.core.model.ThreatKind;
import com.synthgov.core.plugin.ModuleContext;
import com.synthgov.core.plugin.ThreatRuleModule;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Semantic integrity of generated records: business rule violations,
 * cross-field constraint breaks and schema violations. All three are counts,
 * where any violation at all is worth reporting.
 */
@Component
public class SemanticIntegrityModule implements ThreatRuleModule {

    static final String ID = "integrity";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Semantic Integrity";
    }

    @Override
    public int getOrder() {
        return 300;
    }

    @Override
    public List<ThresholdRule> getRules(ModuleContext context) {
        return List.of(
                context.tiers(ID, "semantic-violations", ThresholdRule.builder()
                        .id("semantic-violations")
                        .threatKind(ThreatKind.SEMANTIC_VIOLATION)
                        .metricPath("semantic_invariants.total_violations")
                        .aliases("semantic_violations", "semantic_invariants.semantic_violations")
                        .context("synthetic_rows")
                        .predicate(PredicateKind.GREATER_THAN)
                        .confidence(ConfidenceModel.logarithmic(0.4, 2.0)), 100, 10, 0)
                        .build(),

                context.tiers(ID, "cross-field-violations", ThresholdRule.builder()
                        .id("cross-field-violations")
                        .threatKind(ThreatKind.SEMANTIC_VIOLATION)
                        .metricPath("semantic_invariants.cross_field_violation_count")
                        .predicate(PredicateKind.GREATER_THAN)
                        .confidence(ConfidenceModel.logarithmic(0.4, 1.5)), 20, 5, 0)
                        .build(),

                context.tiers(ID, "schema-violations", ThresholdRule.builder()
                        .id("schema-violations")
                        .threatKind(ThreatKind.SCHEMA_VIOLATION)
                        .metricPath("semantic_invariants.schema_violations")
                        .aliases("schema_violations")
                        .predicate(PredicateKind.GREATER_THAN)
                        .confidence(ConfidenceModel.logarithmic(0.5, 1.5)), 10, 1, 0)
                        .build());
    }
}
