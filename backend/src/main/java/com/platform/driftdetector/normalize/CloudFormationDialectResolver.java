package com.platform.driftdetector.normalize;

import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.SourceDialect;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.platform.driftdetector.normalize.DialectResolver.firstNonBlank;
import static com.platform.driftdetector.normalize.DialectResolver.text;

/**
 * CloudFormation records, either a template resource ({@code Type} + {@code Properties}, logical
 * id as address hint) or a described stack resource ({@code ResourceType},
 * {@code LogicalResourceId}, {@code PhysicalResourceId}). Only {@code Properties} are compared.
 */
@Component
public class CloudFormationDialectResolver implements DialectResolver {
    
    private static final Set<String> TEMPLATE_KEYS = Set.of(
        "Type", "ResourceType", "LogicalResourceId", "PhysicalResourceId",
        "DependsOn", "Condition", "Metadata", "DeletionPolicy", "UpdateReplacePolicy", "CreationPolicy", "UpdatePolicy"
    );
    
    @Override
    public SourceDialect getDialect() {
        return SourceDialect.CLOUDFORMATION;
    }
    
    @Override
    public String resolveKind(RawResourceRecord raw) {
        return firstNonBlank(raw.kindHint(), text(raw.body().get("Type")), text(raw.body().get("ResourceType")));
    }
    
    @Override
    public String resolveAddress(RawResourceRecord raw, String kind) {
        return firstNonBlank(
            raw.addressHint(),
            text(raw.body().get("LogicalResourceId")),
            text(raw.body().get("PhysicalResourceId"))
        );
    }
    
    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> attributeBody(RawResourceRecord raw) {
        Object properties = raw.body().get("Properties");
        if (properties instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        Map<String, Object> attributes = new LinkedHashMap<>(raw.body());
        TEMPLATE_KEYS.forEach(attributes::remove);
        return attributes;
    }
}
