package com.platform.driftdetector.pipeline;

public enum RunOutcome {
    COMPLETED,
    FAILED,
    CANCELLED
}
