package com.platform.driftdetector.classify;

/**
 * Security relevance of a drift entry, most severe first.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFORMATIONAL;
    
    public boolean isMoreSevereThan(Severity other) {
        return other == null || ordinal() < other.ordinal();
    }
}
