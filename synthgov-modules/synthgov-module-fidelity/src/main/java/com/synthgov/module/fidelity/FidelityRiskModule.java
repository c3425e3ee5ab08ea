package com.synthgov.module.fidelity;

import com.synthgov.core.catalog.ConfidenceModel;
import com.synthgov.core.catalog.PredicateKind;
import com.synthgov.core.catalog.ThresholdRule;
import com.synthgov.core.model.Severity;
import com.synthgov.core.model.ThreatKind;
import com.synthgov.core.plugin.ModuleContext;
import com.synthgov.core.plugin.ThreatRuleModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Statistical fidelity and ML utility.
 *
 * Watches for distribution drift (KL divergence, PSI and the pipeline's own
 * drift label), broken correlation structure and models trained on the
 * synthetic data falling behind models trained on real data.
 */
@Component
public class FidelityRiskModule implements ThreatRuleModule {

    private static final Logger log = LoggerFactory.getLogger(FidelityRiskModule.class);
    static final String ID = "fidelity";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Statistical Fidelity & Utility";
    }

    @Override
    public int getOrder() {
        return 200;
    }

    @Override
    public List<ThresholdRule> getRules(ModuleContext context) {
        List<ThresholdRule> rules = new ArrayList<>();

        rules.add(context.tiers(ID, "distribution-drift-kl", ThresholdRule.builder()
                .id("distribution-drift-kl")
                .threatKind(ThreatKind.DISTRIBUTION_DRIFT)
                .metricPath("statistical_fidelity.avg_kl_divergence")
                .aliases("avg_kl_divergence")
                .context("statistical_fidelity.avg_wasserstein_distance",
                        "statistical_fidelity.avg_histogram_overlap")
                .predicate(PredicateKind.GREATER_THAN)
                .confidence(ConfidenceModel.linear(0.4, 0.5)), 0.5, 0.2, 0.1)
                .build());

        // Fixed confidence per tier: 0.3 / 0.6 / 0.9
        rules.add(ThresholdRule.builder()
                .id("distribution-drift-level")
                .threatKind(ThreatKind.DISTRIBUTION_DRIFT)
                .metricPath("statistical_drift")
                .aliases("statistical_fidelity.drift_classification")
                .predicate(PredicateKind.CATEGORICAL)
                .categories(Severity.HIGH, "high", "severe")
                .categories(Severity.MEDIUM, "moderate", "medium")
                .categories(Severity.LOW, "low")
                .confidence(ConfidenceModel.tiered(0.3, 0.3))
                .build());

        // PSI has no established "low" band
        rules.add(context.tiers(ID, "distribution-drift-psi", ThresholdRule.builder()
                .id("distribution-drift-psi")
                .threatKind(ThreatKind.DISTRIBUTION_DRIFT)
                .metricPath("statistical_fidelity.avg_psi")
                .aliases("avg_psi")
                .predicate(PredicateKind.GREATER_THAN)
                .confidence(ConfidenceModel.linear(0.5, 0.25)), 0.25, 0.10, Double.NaN)
                .build());

        rules.add(context.tiers(ID, "correlation-frobenius", ThresholdRule.builder()
                .id("correlation-frobenius")
                .threatKind(ThreatKind.CORRELATION_INCONSISTENCY)
                .metricPath("statistical_fidelity.correlation_frobenius_norm")
                .aliases("correlation_frobenius_norm")
                .context("utility_preservation.feature_importance_correlation")
                .predicate(PredicateKind.GREATER_THAN)
                .confidence(ConfidenceModel.linear(0.4, 1.5)), 2.0, 1.0, 0.5)
                .build());

        rules.add(context.tiers(ID, "utility-score", ThresholdRule.builder()
                .id("utility-score")
                .threatKind(ThreatKind.UTILITY_DEGRADATION)
                .metricPath("utility_score")
                .aliases("utility_preservation.utility_score")
                .context("utility_preservation.synthetic_model_accuracy",
                        "utility_preservation.real_model_accuracy")
                .predicate(PredicateKind.LESS_THAN)
                .confidence(ConfidenceModel.linear(0.3, 0.3))
                .required(true), 0.70, 0.85, 0.90)
                .build());

        rules.add(context.tiers(ID, "utility-accuracy-gap", ThresholdRule.builder()
                .id("utility-accuracy-gap")
                .threatKind(ThreatKind.UTILITY_DEGRADATION)
                .metricPath("utility_preservation.accuracy_gap")
                .aliases("accuracy_gap")
                .context("utility_preservation.synthetic_model_accuracy",
                        "utility_preservation.real_model_accuracy")
                .predicate(PredicateKind.GREATER_THAN)
                .confidence(ConfidenceModel.linear(0.4, 0.15)), 0.15, 0.10, 0.05)
                .build());

        log.debug("[SynthGov] [{}] {} rule(s) prepared", ID, rules.size());
        return rules;
    }
}
