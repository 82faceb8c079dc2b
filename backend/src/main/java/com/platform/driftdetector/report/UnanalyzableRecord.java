package com.platform.driftdetector.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.driftdetector.error.NormalizationException;
import com.platform.driftdetector.resource.Origin;
import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.SourceDialect;

/**
 * Raw record the normalizer rejected, kept in the report instead of being dropped.
 *
 * @param position index of the record within its input list
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnanalyzableRecord(
    Origin origin,
    int position,
    SourceDialect dialect,
    String kindHint,
    String addressHint,
    String sourceRef,
    String path,
    String errorCode,
    String reason
) {
    
    public static UnanalyzableRecord of(Origin origin, int position, RawResourceRecord raw, NormalizationException e) {
        return new UnanalyzableRecord(
            origin,
            position,
            raw.dialect(),
            raw.kindHint(),
            raw.addressHint() != null ? raw.addressHint() : e.getAddressHint(),
            raw.sourceRef(),
            e.getPath(),
            e.getErrorCode().getCode(),
            e.getMessage()
        );
    }
}
