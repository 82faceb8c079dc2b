package com.platform.driftdetector.pipeline;

import com.platform.driftdetector.error.DriftRunCancelledException;

/**
 * Cooperative cancellation signal, polled by the pipeline between resources.
 */
@FunctionalInterface
public interface Cancellation {
    
    Cancellation NONE = () -> false;
    
    boolean isCancelled();
    
    default void throwIfCancelled(String stage, int processed) {
        if (isCancelled()) {
            throw new DriftRunCancelledException(stage, processed);
        }
    }
}
