package com.synthgov.core.model;

import java.util.Locale;

/**
 * The dataset property a threat puts at risk.
 */
public enum ImpactedProperty {

    PRIVACY(3),
    UTILITY(2),
    CONSISTENCY(1);

    private final int priorityWeight;

    ImpactedProperty(int priorityWeight) {
        this.priorityWeight = priorityWeight;
    }

    public int getPriorityWeight() {
        return priorityWeight;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
