package com.platform.driftdetector.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Cancellation} that another thread can trip.
 */
public class CancellationToken implements Cancellation {
    
    private final AtomicBoolean cancelled = new AtomicBoolean();
    
    public void cancel() {
        cancelled.set(true);
    }
    
    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}
