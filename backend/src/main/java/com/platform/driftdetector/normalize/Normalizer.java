package com.platform.driftdetector.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.driftdetector.error.NormalizationException;
import com.platform.driftdetector.resource.Origin;
import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.ResourceModel;
import com.platform.driftdetector.resource.SourceDialect;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps dialect-specific raw records onto {@link ResourceModel} instances.
 *
 * <p>Identity comes from the record's {@link DialectResolver}; attribute values are flattened and
 * brought to one canonical representation through the {@link EquivalenceTable}, so that
 * semantically equal values compare equal before any diffing happens.
 */
@Slf4j
public class Normalizer {
    
    private final EquivalenceTable equivalenceTable;
    private final Map<SourceDialect, DialectResolver> resolvers;
    private final AttributeFlattener flattener;
    
    public Normalizer(EquivalenceTable equivalenceTable, List<DialectResolver> resolvers, ObjectMapper objectMapper) {
        this.equivalenceTable = equivalenceTable;
        this.resolvers = new EnumMap<>(SourceDialect.class);
        for (DialectResolver resolver : resolvers) {
            this.resolvers.put(resolver.getDialect(), resolver);
        }
        if (!this.resolvers.containsKey(SourceDialect.GENERIC)) {
            this.resolvers.put(SourceDialect.GENERIC, new GenericDialectResolver());
        }
        this.flattener = new AttributeFlattener(equivalenceTable, objectMapper);
    }
    
    /**
     * Normalize one raw record.
     *
     * @throws NormalizationException when no address or kind can be derived, or a value
     *                                violates the type its equivalence rule declares
     */
    public ResourceModel normalize(RawResourceRecord raw, Origin origin) {
        DialectResolver resolver = resolvers.getOrDefault(raw.dialect(), resolvers.get(SourceDialect.GENERIC));
        
        String kind = resolver.resolveKind(raw);
        if (kind == null) {
            throw NormalizationException.missingKind(origin, raw.addressHint());
        }
        String address = resolver.resolveAddress(raw, kind);
        if (address == null) {
            throw NormalizationException.missingAddress(origin, kind);
        }
        
        TreeMap<String, Object> attributes = flattener.flatten(kind, address, origin, resolver.attributeBody(raw));
        log.trace("Normalized {} {} ({}): {} attributes", origin, address, kind, attributes.size());
        
        return new ResourceModel(address, kind, origin, raw.dialect(), attributes);
    }
    
    public EquivalenceTable getEquivalenceTable() {
        return equivalenceTable;
    }
}
