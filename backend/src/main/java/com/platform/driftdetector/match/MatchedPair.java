package com.platform.driftdetector.match;

import com.platform.driftdetector.resource.Origin;
import com.platform.driftdetector.resource.ResourceModel;

/**
 * Declared and observed model sharing one address; at least one side is present.
 */
public record MatchedPair(
    String address,
    ResourceModel declared,
    ResourceModel observed
) {
    
    public MatchedPair {
        if (declared == null && observed == null) {
            throw new IllegalArgumentException("A pair needs at least one side: " + address);
        }
        if (declared != null && declared.origin() != Origin.DECLARED) {
            throw new IllegalArgumentException("Declared side of " + address + " has origin " + declared.origin());
        }
        if (observed != null && observed.origin() != Origin.OBSERVED) {
            throw new IllegalArgumentException("Observed side of " + address + " has origin " + observed.origin());
        }
    }
    
    public static MatchedPair matched(ResourceModel declared, ResourceModel observed) {
        return new MatchedPair(declared.address(), declared, observed);
    }
    
    public static MatchedPair orphan(ResourceModel declared) {
        return new MatchedPair(declared.address(), declared, null);
    }
    
    public static MatchedPair unmanaged(ResourceModel observed) {
        return new MatchedPair(observed.address(), null, observed);
    }
    
    public PairState state() {
        if (declared != null && observed != null) {
            return PairState.MATCHED;
        }
        return declared != null ? PairState.ORPHAN : PairState.UNMANAGED;
    }
    
    /**
     * Kind of the resource, taken from the declared side when present.
     */
    public String kind() {
        return declared != null ? declared.kind() : observed.kind();
    }
}
