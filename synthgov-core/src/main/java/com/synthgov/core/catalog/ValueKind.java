package com.synthgov.core.catalog;

/**
 * The value type a rule expects at the metric paths it reads.
 */
public enum ValueKind {
    NUMBER,
    CATEGORY
}
