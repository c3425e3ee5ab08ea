package com.synthgov.core.plugin;

import com.synthgov.core.catalog.ThresholdRule;

import java.util.List;

/**
 * The plugin interface that all SynthGov rule modules implement.
 * Each module contributes the catalog rows for one family of threats.
 *
 * <p>
 * Modules are discovered automatically via Spring's component scanning.
 * Simply annotate your implementation with {@code @Component}.
 * </p>
 */
public interface ThreatRuleModule {

    /**
     * Unique identifier for this module. Used in configuration keys:
     * {@code synthgov.modules.{id}.enabled}
     */
    String getId();

    /**
     * Human-readable name for logging.
     */
    String getName();

    /**
     * Priority order. Lower values contribute their rules first, which also
     * makes them win final ranking ties.
     * Default modules use: 100 (privacy), 200 (fidelity), 300 (integrity).
     */
    default int getOrder() {
        return 500;
    }

    /**
     * Rule rows of this module, in the order they should be reported.
     * Called once at startup; thresholds may come from the module's config map.
     */
    List<ThresholdRule> getRules(ModuleContext context);

    /**
     * Whether this module is enabled. Checked against configuration.
     */
    default boolean isEnabled(ModuleContext context) {
        return context.getProperties().isModuleEnabled(getId());
    }
}
