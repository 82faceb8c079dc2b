package com.platform.driftdetector.diff;

/**
 * How a leaf attribute differs between declared and observed state.
 */
public enum ChangeKind {
    ADDED,      // observed only: unexpected attribute
    REMOVED,    // declared only: expected attribute missing
    MODIFIED    // both present, not equivalent
}
