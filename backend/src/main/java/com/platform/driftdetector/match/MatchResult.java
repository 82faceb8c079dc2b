package com.platform.driftdetector.match;

import com.platform.driftdetector.resource.ResourceModel;

import java.util.List;

/**
 * Partition of all addresses into matched pairs, orphans and unmanaged resources,
 * each list sorted by address.
 */
public record MatchResult(
    List<MatchedPair> pairs,
    List<ResourceModel> orphans,
    List<ResourceModel> unmanaged
) {
    
    public MatchResult {
        pairs = List.copyOf(pairs);
        orphans = List.copyOf(orphans);
        unmanaged = List.copyOf(unmanaged);
    }
}
