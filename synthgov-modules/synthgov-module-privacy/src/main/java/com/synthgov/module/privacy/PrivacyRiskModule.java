package com.synthgov.module.privacy;

import com.synthgov.core.catalog.ConfidenceModel;
import com.synthgov.core.catalog.PredicateKind;
import com.synthgov.core.catalog.ThresholdRule;
import com.synthgov.core.model.ThreatKind;
import com.synthgov.core.plugin.ModuleContext;
import com.synthgov.core.plugin.ThreatRuleModule;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Privacy attack surface of a synthetic dataset.
 *
 * Reads the {@code privacy_risk.*} block produced by the metric pipeline:
 * 1. Membership inference AUC (0.5 is random guessing)
 * 2. Nearest-neighbour distance to real records
 * 3. Near-duplicate rate and count
 * 4. Attribute inference accuracy
 * 5. The aggregate privacy score
 *
 * Boundaries can be overridden under {@code synthgov.modules.privacy.config},
 * e.g. {@code membership-inference-auc-high: 0.75}.
 */
@Component
public class PrivacyRiskModule implements ThreatRuleModule {

    static final String ID = "privacy";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Privacy Risk";
    }

    @Override
    public int getOrder() {
        return 100;
    }

    @Override
    public List<ThresholdRule> getRules(ModuleContext context) {
        ThresholdRule membershipInference = context.tiers(ID, "membership-inference-auc", ThresholdRule.builder()
                .id("membership-inference-auc")
                .threatKind(ThreatKind.MEMBERSHIP_INFERENCE)
                .metricPath("privacy_risk.membership_inference_auc")
                .aliases("membership_inference_auc")
                .context("privacy_risk.membership_inference_accuracy")
                .predicate(PredicateKind.GREATER_THAN)
                .confidence(ConfidenceModel.linear(0.3, 0.3))
                .required(true), 0.70, 0.60, 0.55)
                .build();

        ThresholdRule recordLinkage = context.tiers(ID, "record-linkage-min-distance", ThresholdRule.builder()
                .id("record-linkage-min-distance")
                .threatKind(ThreatKind.RECORD_LINKAGE)
                .metricPath("privacy_risk.min_nn_distance")
                .aliases("min_nn_distance")
                .context("privacy_risk.avg_nn_distance", "privacy_risk.median_nn_distance")
                .predicate(PredicateKind.LESS_THAN)
                .confidence(ConfidenceModel.linear(0.4, 1.0)), 0.1, 0.5, 1.0)
                .build();

        ThresholdRule nearDuplicateRate = context.tiers(ID, "near-duplicate-rate", ThresholdRule.builder()
                .id("near-duplicate-rate")
                .threatKind(ThreatKind.NEAR_DUPLICATE)
                .metricPath("privacy_risk.near_duplicates_rate")
                .aliases("near_duplicates_rate")
                .context("privacy_risk.near_duplicates_count", "privacy_risk.near_duplicates_threshold")
                .predicate(PredicateKind.GREATER_THAN)
                .confidence(ConfidenceModel.linear(0.4, 0.02)), 0.02, 0.01, 0.005)
                .build();

        // Confidence follows log10 of the excess count
        ThresholdRule nearDuplicateCount = context.tiers(ID, "near-duplicate-count", ThresholdRule.builder()
                .id("near-duplicate-count")
                .threatKind(ThreatKind.NEAR_DUPLICATE)
                .metricPath("privacy_risk.near_duplicates_count")
                .aliases("near_duplicates_count")
                .context("synthetic_rows")
                .predicate(PredicateKind.GREATER_THAN)
                .confidence(ConfidenceModel.logarithmic(0.3, 2.0)), 10, 5, 0)
                .build();

        ThresholdRule attributeInference = context.tiers(ID, "attribute-inference-accuracy", ThresholdRule.builder()
                .id("attribute-inference-accuracy")
                .threatKind(ThreatKind.ATTRIBUTE_INFERENCE)
                .metricPath("privacy_risk.attribute_inference_accuracy")
                .aliases("attribute_inference_accuracy")
                .predicate(PredicateKind.GREATER_THAN)
                .confidence(ConfidenceModel.linear(0.3, 0.15)), 0.85, 0.75, 0.65)
                .build();

        ThresholdRule privacyScore = context.tiers(ID, "privacy-score", ThresholdRule.builder()
                .id("privacy-score")
                .threatKind(ThreatKind.PRIVACY_LEAKAGE)
                .metricPath("privacy_score")
                .aliases("privacy_risk.privacy_score")
                .context("leakage_risk_level", "privacy_risk.avg_nn_distance")
                .predicate(PredicateKind.LESS_THAN)
                .confidence(ConfidenceModel.linear(0.3, 0.4))
                .required(true), 0.60, 0.80, 0.90)
                .build();

        return List.of(membershipInference, recordLinkage, nearDuplicateRate, nearDuplicateCount,
                attributeInference, privacyScore);
    }
}
