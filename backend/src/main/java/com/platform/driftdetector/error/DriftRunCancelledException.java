package com.platform.driftdetector.error;

/**
 * The run was cancelled between two resources.
 */
public class DriftRunCancelledException extends DriftDetectorException {
    
    private final String stage;
    private final int processed;
    
    public DriftRunCancelledException(String stage, int processed) {
        super(ErrorCode.RUN_CANCELLED,
            String.format("Drift run cancelled during %s after %d resources", stage, processed));
        this.stage = stage;
        this.processed = processed;
    }
    
    public String getStage() {
        return stage;
    }
    
    public int getProcessed() {
        return processed;
    }
}
