package com.platform.driftdetector.error;

import com.platform.driftdetector.resource.Origin;

import java.util.List;

/**
 * Two or more resources of the same origin share an address.
 */
public class AmbiguousAddressException extends DriftDetectorException {
    
    private final Origin origin;
    private final List<String> addresses;
    
    public AmbiguousAddressException(Origin origin, List<String> addresses) {
        super(ErrorCode.AMBIGUOUS_ADDRESS,
            String.format("Duplicate %s resource addresses: %s", origin, String.join(", ", addresses)));
        this.origin = origin;
        this.addresses = List.copyOf(addresses);
    }
    
    public Origin getOrigin() {
        return origin;
    }
    
    public List<String> getAddresses() {
        return addresses;
    }
}
