package com.synthgov.core.catalog;

import com.synthgov.core.GovernanceConfigurationException;

/**
 * A threshold rule or catalog that cannot be evaluated consistently.
 */
public class CatalogValidationException extends GovernanceConfigurationException {

    private final String ruleId;

    public CatalogValidationException(String ruleId, String message) {
        super(ruleId != null ? "Rule '" + ruleId + "': " + message : message);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
