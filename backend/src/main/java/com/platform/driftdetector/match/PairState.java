package com.platform.driftdetector.match;

/**
 * Presence of a resource address on the two sides of the comparison.
 */
public enum PairState {
    MATCHED,    // declared and observed, candidate for diff
    ORPHAN,     // declared only
    UNMANAGED   // observed only
}
