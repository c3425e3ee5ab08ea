package com.synthgov.core.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Core configuration properties for SynthGov.
 * These map directly to the `synthgov.*` properties in your application.yml.
 */
public class GovernanceProperties {

    private boolean enabled = true;
    private String outputMode = "summary"; // summary, detailed or full
    private int topThreatsLimit = 5;
    private int evidenceLimit = 1; // evidence entries kept per threat in detailed mode

    private AdvisoryProperties advisory = new AdvisoryProperties();
    private AuditProperties audit = new AuditProperties();
    private CatalogProperties catalog = new CatalogProperties();
    private Map<String, ModuleProperties> modules = new HashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getOutputMode() {
        return outputMode;
    }

    public void setOutputMode(String outputMode) {
        this.outputMode = outputMode;
    }

    public int getTopThreatsLimit() {
        return topThreatsLimit;
    }

    public void setTopThreatsLimit(int topThreatsLimit) {
        this.topThreatsLimit = topThreatsLimit;
    }

    public int getEvidenceLimit() {
        return evidenceLimit;
    }

    public void setEvidenceLimit(int evidenceLimit) {
        this.evidenceLimit = evidenceLimit;
    }

    public AdvisoryProperties getAdvisory() {
        return advisory;
    }

    public void setAdvisory(AdvisoryProperties advisory) {
        this.advisory = advisory;
    }

    public AuditProperties getAudit() {
        return audit;
    }

    public void setAudit(AuditProperties audit) {
        this.audit = audit;
    }

    public CatalogProperties getCatalog() {
        return catalog;
    }

    public void setCatalog(CatalogProperties catalog) {
        this.catalog = catalog;
    }

    public Map<String, ModuleProperties> getModules() {
        return modules;
    }

    public void setModules(Map<String, ModuleProperties> modules) {
        this.modules = modules;
    }

    /**
     * Useful for checking if a specific rule module is turned on.
     * Note: modules are enabled by default unless explicitly disabled.
     */
    public boolean isModuleEnabled(String moduleId) {
        ModuleProperties props = modules.get(moduleId);
        if (props == null)
            return true;
        return props.isEnabled();
    }

    /**
     * Grab any custom settings specific to a module, e.g. threshold overrides.
     */
    public Map<String, Object> getModuleConfig(String moduleId) {
        ModuleProperties props = modules.get(moduleId);
        if (props == null)
            return Map.of();
        return props.getConfig();
    }

    /** Settings echoed into {@code metadata.config} of every result. */
    public Map<String, Object> toConfigEcho() {
        Map<String, Object> echo = new LinkedHashMap<>();
        echo.put("output_mode", outputMode);
        echo.put("top_threats_limit", topThreatsLimit);
        echo.put("evidence_limit", evidenceLimit);
        echo.put("catalog_overrides", catalog.getRules().size());
        return echo;
    }

    public static class AdvisoryProperties {
        private boolean enabled = false;
        private String provider = "openai";
        private String apiKey;
        private String model;
        private String baseUrl;
        private long timeoutMillis = 10_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public long getTimeoutMillis() {
            return timeoutMillis;
        }

        public void setTimeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
        }
    }

    public static class AuditProperties {
        private boolean enabled = true;
        private String type = "in-memory";
        private int capacity = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }

    public static class CatalogProperties {
        private List<RuleProperties> rules = new ArrayList<>();

        public List<RuleProperties> getRules() {
            return rules;
        }

        public void setRules(List<RuleProperties> rules) {
            this.rules = rules;
        }
    }

    public static class ModuleProperties {
        private boolean enabled = true;
        private Map<String, Object> config = new HashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, Object> getConfig() {
            return config;
        }

        public void setConfig(Map<String, Object> config) {
            this.config = config;
        }
    }
}
