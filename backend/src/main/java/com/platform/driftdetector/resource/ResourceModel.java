package com.platform.driftdetector.resource;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Dialect-agnostic, flattened representation of one declared or observed resource.
 *
 * <p>Attributes map a flattened path ({@code tags.env}, {@code ingress[0].from_port}) to a
 * canonical value: {@code String}, {@code Boolean}, {@code BigDecimal}, or an immutable
 * {@code List} of those or of canonical sorted maps. There are no null values: a null in the
 * source is an absent attribute. Paths are kept in lexicographic order.
 */
public record ResourceModel(
    String address,
    String kind,
    Origin origin,
    SourceDialect source,
    SortedMap<String, Object> attributes
) {
    
    public ResourceModel {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Resource address must not be empty");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Resource kind must not be empty for " + address);
        }
        Objects.requireNonNull(origin, "origin");
        source = source != null ? source : SourceDialect.GENERIC;
        attributes = Collections.unmodifiableSortedMap(
            attributes != null ? new TreeMap<>(attributes) : new TreeMap<>());
    }
    
    public static ResourceModel of(String address, String kind, Origin origin, Map<String, Object> attributes) {
        return new ResourceModel(address, kind, origin, SourceDialect.GENERIC,
            attributes != null ? new TreeMap<>(attributes) : null);
    }
}
