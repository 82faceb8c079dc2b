package com.platform.driftdetector.observability;

/**
 * Event types emitted through {@link StructuredLogger}.
 */
public enum LogEventType {
    DRIFT_RUN_STARTED,
    DRIFT_RUN_COMPLETED,
    DRIFT_RUN_FAILED,
    DRIFT_RUN_CANCELLED,
    RECORD_UNANALYZABLE,
    RULE_TABLE_LOADED
}
