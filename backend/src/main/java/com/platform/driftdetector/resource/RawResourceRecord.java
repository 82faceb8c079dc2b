package com.platform.driftdetector.resource;

import java.util.Map;

/**
 * Dialect-specific nested structure as handed over by a template parser or live-state collector.
 *
 * @param dialect     front-end that produced the record, GENERIC when unknown
 * @param kindHint    resource type supplied by the adapter, may be null
 * @param addressHint stable identifier supplied by the adapter, may be null
 * @param body        nested maps, lists and scalars
 * @param sourceRef   file/line or API reference, only echoed into reports
 */
public record RawResourceRecord(
    SourceDialect dialect,
    String kindHint,
    String addressHint,
    Map<String, Object> body,
    String sourceRef
) {
    
    public RawResourceRecord {
        dialect = dialect != null ? dialect : SourceDialect.GENERIC;
        body = body != null ? body : Map.of();
    }
    
    public static RawResourceRecord of(SourceDialect dialect, String kindHint, String addressHint,
            Map<String, Object> body) {
        return new RawResourceRecord(dialect, kindHint, addressHint, body, null);
    }
}
