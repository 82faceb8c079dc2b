package com.platform.driftdetector.error;

import com.platform.driftdetector.resource.Origin;

/**
 * A raw record could not be mapped to a valid resource model.
 * Reported per record; the run continues and lists the record as unanalyzable.
 */
public class NormalizationException extends DriftDetectorException {
    
    private final Origin origin;
    private final String addressHint;
    private final String path;
    
    public NormalizationException(ErrorCode errorCode, Origin origin, String addressHint, String path, String message) {
        super(errorCode, message);
        this.origin = origin;
        this.addressHint = addressHint;
        this.path = path;
    }
    
    public NormalizationException(ErrorCode errorCode, Origin origin, String addressHint, String path,
            String message, Throwable cause) {
        super(errorCode, message, cause);
        this.origin = origin;
        this.addressHint = addressHint;
        this.path = path;
    }
    
    public static NormalizationException missingAddress(Origin origin, String kind) {
        return new NormalizationException(
            ErrorCode.MISSING_ADDRESS,
            origin,
            null,
            null,
            String.format("No address derivable for %s record of kind %s", origin, kind)
        );
    }
    
    public static NormalizationException missingKind(Origin origin, String addressHint) {
        return new NormalizationException(
            ErrorCode.MISSING_KIND,
            origin,
            addressHint,
            null,
            String.format("No kind derivable for %s record %s", origin, addressHint)
        );
    }
    
    public static NormalizationException typeViolation(Origin origin, String address, String path,
            String expectedType, Object value) {
        return new NormalizationException(
            ErrorCode.TYPE_VIOLATION,
            origin,
            address,
            path,
            String.format("Value '%s' at %s of %s is not a valid %s", value, path, address, expectedType)
        );
    }
    
    /**
     * Address hint of the failing record, when one was available.
     */
    public String getAddressHint() {
        return addressHint;
    }
    
    public Origin getOrigin() {
        return origin;
    }
    
    /**
     * Attribute path that failed, null for identity failures.
     */
    public String getPath() {
        return path;
    }
}
