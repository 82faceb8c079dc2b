package com.platform.driftdetector.normalize;

import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.SourceDialect;

import java.util.Map;

/**
 * Derives identity and the attribute body of raw records produced by one IaC front-end.
 * Hints carried by the record always take precedence over derived values.
 */
public interface DialectResolver {
    
    SourceDialect getDialect();
    
    /**
     * Normalized resource kind, or null when none can be derived.
     */
    String resolveKind(RawResourceRecord raw);
    
    /**
     * Stable address, or null when none can be derived.
     */
    String resolveAddress(RawResourceRecord raw, String kind);
    
    /**
     * The part of the body that holds comparable attributes.
     */
    Map<String, Object> attributeBody(RawResourceRecord raw);
    
    static String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
    
    static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            String text = text(candidate);
            if (text != null) {
                return text;
            }
        }
        return null;
    }
}
