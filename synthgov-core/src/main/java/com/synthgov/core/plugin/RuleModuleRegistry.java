package com.synthgov.core.plugin;

import com.synthgov.core.catalog.CatalogValidationException;
import com.synthgov.core.catalog.ThreatCatalog;
import com.synthgov.core.catalog.ThresholdRule;
import com.synthgov.core.config.CatalogOverrides;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Discovers and manages all registered ThreatRuleModules.
 * Modules are ordered by their {@link ThreatRuleModule#getOrder()} priority.
 */
public class RuleModuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuleModuleRegistry.class);

    private final List<ThreatRuleModule> modules;

    public RuleModuleRegistry(List<ThreatRuleModule> modules) {
        List<ThreatRuleModule> sorted = new ArrayList<>(modules);
        sorted.sort(Comparator.comparingInt(ThreatRuleModule::getOrder));
        this.modules = Collections.unmodifiableList(sorted);

        Set<String> ids = new HashSet<>();
        for (ThreatRuleModule module : sorted) {
            if (!ids.add(module.getId())) {
                throw new IllegalStateException("Duplicate rule module id: " + module.getId());
            }
        }

        log.info("[SynthGov] Registered {} rule modules: {}",
                sorted.size(),
                sorted.stream().map(m -> m.getId() + "(order=" + m.getOrder() + ")")
                        .collect(Collectors.joining(", ")));
    }

    public List<ThreatRuleModule> getModules() {
        return modules;
    }

    public List<ThreatRuleModule> getEnabledModules(ModuleContext context) {
        return modules.stream()
                .filter(m -> m.isEnabled(context))
                .collect(Collectors.toList());
    }

    /**
     * Collects the rules of every enabled module in module order, then applies
     * the {@code synthgov.catalog.rules} overrides.
     *
     * @throws CatalogValidationException if the resulting catalog is invalid
     */
    public ThreatCatalog buildCatalog(ModuleContext context) {
        List<ThresholdRule> rules = new ArrayList<>();
        for (ThreatRuleModule module : getEnabledModules(context)) {
            List<ThresholdRule> contributed = module.getRules(context);
            log.debug("[SynthGov] [{}] contributed {} rule(s)", module.getId(), contributed.size());
            rules.addAll(contributed);
        }
        ThreatCatalog catalog = CatalogOverrides.apply(ThreatCatalog.of(rules),
                context.getProperties().getCatalog().getRules());
        log.info("[SynthGov] Threat catalog built with {} rule(s) covering {} threat kind(s)",
                catalog.size(), catalog.getThreatKinds().size());
        return catalog;
    }
}
