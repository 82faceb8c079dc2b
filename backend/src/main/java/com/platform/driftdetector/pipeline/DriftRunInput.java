package com.platform.driftdetector.pipeline;

import com.platform.driftdetector.resource.RawResourceRecord;

import java.util.List;

/**
 * Raw records of one drift run. Either side may be empty.
 */
public record DriftRunInput(
    List<RawResourceRecord> declared,
    List<RawResourceRecord> observed
) {
    
    public DriftRunInput {
        declared = declared == null ? List.of() : List.copyOf(declared);
        observed = observed == null ? List.of() : List.copyOf(observed);
    }
}
