package com.fraud.cohortanomaly.model;

/**
 * Ordered severity tiers. Declaration order is the escalation order.
 */
public enum Severity {
    NONE,
    INFO,
    WARN,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return this.compareTo(other) >= 0;
    }
}
