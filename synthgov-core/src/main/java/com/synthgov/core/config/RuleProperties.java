package com.synthgov.core.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One catalog override row under {@code synthgov.catalog.rules[n]}.
 * For an existing rule id only the fields that are set replace the module's
 * values; a new id must describe a complete rule.
 */
public class RuleProperties {

    private String id;
    private String threat;
    private String metricPath;
    private List<String> aliases = new ArrayList<>();
    private List<String> context = new ArrayList<>();
    private String predicate;
    private Double high;
    private Double medium;
    private Double low;
    private Map<String, List<String>> categories = new LinkedHashMap<>();
    private Double bandLower;
    private Double bandUpper;
    private String confidence; // linear, logarithmic or tiered
    private Double confidenceFloor;
    private Double confidenceScale;
    private Boolean required;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getThreat() {
        return threat;
    }

    public void setThreat(String threat) {
        this.threat = threat;
    }

    public String getMetricPath() {
        return metricPath;
    }

    public void setMetricPath(String metricPath) {
        this.metricPath = metricPath;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public void setAliases(List<String> aliases) {
        this.aliases = aliases;
    }

    public List<String> getContext() {
        return context;
    }

    public void setContext(List<String> context) {
        this.context = context;
    }

    public String getPredicate() {
        return predicate;
    }

    public void setPredicate(String predicate) {
        this.predicate = predicate;
    }

    public Double getHigh() {
        return high;
    }

    public void setHigh(Double high) {
        this.high = high;
    }

    public Double getMedium() {
        return medium;
    }

    public void setMedium(Double medium) {
        this.medium = medium;
    }

    public Double getLow() {
        return low;
    }

    public void setLow(Double low) {
        this.low = low;
    }

    public Map<String, List<String>> getCategories() {
        return categories;
    }

    public void setCategories(Map<String, List<String>> categories) {
        this.categories = categories;
    }

    public Double getBandLower() {
        return bandLower;
    }

    public void setBandLower(Double bandLower) {
        this.bandLower = bandLower;
    }

    public Double getBandUpper() {
        return bandUpper;
    }

    public void setBandUpper(Double bandUpper) {
        this.bandUpper = bandUpper;
    }

    public String getConfidence() {
        return confidence;
    }

    public void setConfidence(String confidence) {
        this.confidence = confidence;
    }

    public Double getConfidenceFloor() {
        return confidenceFloor;
    }

    public void setConfidenceFloor(Double confidenceFloor) {
        this.confidenceFloor = confidenceFloor;
    }

    public Double getConfidenceScale() {
        return confidenceScale;
    }

    public void setConfidenceScale(Double confidenceScale) {
        this.confidenceScale = confidenceScale;
    }

    public Boolean getRequired() {
        return required;
    }

    public void setRequired(Boolean required) {
        this.required = required;
    }
}
