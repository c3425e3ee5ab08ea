package com.synthgov.core.plugin;

import com.synthgov.core.GovernanceConfigurationException;
import com.synthgov.core.catalog.ThresholdRule;
import com.synthgov.core.config.GovernanceProperties;

/**
 * Shared context passed to each ThreatRuleModule while the catalog is built.
 */
public class ModuleContext {

    private final GovernanceProperties properties;

    public ModuleContext(GovernanceProperties properties) {
        this.properties = properties;
    }

    /** Access to configuration properties. */
    public GovernanceProperties getProperties() {
        return properties;
    }

    /**
     * Numeric module setting from {@code synthgov.modules.<id>.config.<key>},
     * or {@code defaultValue} when it is not set.
     */
    public double getDouble(String moduleId, String key, double defaultValue) {
        Object val = properties.getModuleConfig(moduleId).get(key);
        if (val == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(val.toString());
        } catch (NumberFormatException e) {
            throw new GovernanceConfigurationException(
                    "synthgov.modules." + moduleId + ".config." + key + " is not a number: " + val, e);
        }
    }

    /**
     * Applies the three severity boundaries of a rule, each overridable as
     * {@code <key>-high}, {@code <key>-medium} and {@code <key>-low} in the
     * module's config map. A {@code NaN} default leaves that tier out unless
     * it is configured.
     */
    public ThresholdRule.Builder tiers(String moduleId, String key, ThresholdRule.Builder builder,
            double high, double medium, double low) {
        return builder.boundaries(
                getDouble(moduleId, key + "-high", high),
                getDouble(moduleId, key + "-medium", medium),
                getDouble(moduleId, key + "-low", low));
    }
}
