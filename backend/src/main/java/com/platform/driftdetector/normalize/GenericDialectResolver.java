package com.platform.driftdetector.normalize;

import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.SourceDialect;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.platform.driftdetector.normalize.DialectResolver.firstNonBlank;
import static com.platform.driftdetector.normalize.DialectResolver.text;

/**
 * Records from adapters without a dedicated dialect: hints, else {@code kind} and
 * {@code address}/{@code id} body keys.
 */
@Component
public class GenericDialectResolver implements DialectResolver {
    
    @Override
    public SourceDialect getDialect() {
        return SourceDialect.GENERIC;
    }
    
    @Override
    public String resolveKind(RawResourceRecord raw) {
        return firstNonBlank(raw.kindHint(), text(raw.body().get("kind")));
    }
    
    @Override
    public String resolveAddress(RawResourceRecord raw, String kind) {
        return firstNonBlank(raw.addressHint(), text(raw.body().get("address")), text(raw.body().get("id")));
    }
    
    @Override
    public Map<String, Object> attributeBody(RawResourceRecord raw) {
        return raw.body();
    }
}
