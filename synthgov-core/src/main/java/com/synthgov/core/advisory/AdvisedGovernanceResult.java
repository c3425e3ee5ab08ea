package com.synthgov.core.advisory;

import com.synthgov.core.assemble.GovernanceResult;

import java.util.Map;
import java.util.Optional;

/**
 * A core result plus whatever advisory text a narrator produced for it. The
 * advisory sits beside the result; the result itself is never touched.
 */
public final class AdvisedGovernanceResult {

    private final String evaluationId;
    private final GovernanceResult result;
    private final String advisory;

    AdvisedGovernanceResult(String evaluationId, GovernanceResult result, String advisory) {
        this.evaluationId = evaluationId;
        this.result = result;
        this.advisory = advisory;
    }

    public String getEvaluationId() {
        return evaluationId;
    }

    public GovernanceResult getResult() {
        return result;
    }

    public Optional<String> getAdvisory() {
        return Optional.ofNullable(advisory);
    }

    /** The result document with an {@code advisory} key added when text is present. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = result.toMap();
        if (advisory != null) {
            map.put("advisory", advisory);
        }
        return map;
    }
}
