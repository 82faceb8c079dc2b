package com.platform.driftdetector.normalize;

import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.SourceDialect;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.platform.driftdetector.normalize.DialectResolver.firstNonBlank;
import static com.platform.driftdetector.normalize.DialectResolver.text;

/**
 * Kubernetes manifests and live objects: kind {@code kubernetes.<Kind>}, address
 * {@code <Kind>/<namespace>/<name>} with namespace {@code default} when absent.
 */
@Component
public class KubernetesDialectResolver implements DialectResolver {
    
    static final String KIND_PREFIX = "kubernetes.";
    static final String DEFAULT_NAMESPACE = "default";
    
    @Override
    public SourceDialect getDialect() {
        return SourceDialect.KUBERNETES;
    }
    
    @Override
    public String resolveKind(RawResourceRecord raw) {
        String hint = text(raw.kindHint());
        if (hint != null) {
            return hint;
        }
        String kind = text(raw.body().get("kind"));
        return kind != null ? KIND_PREFIX + kind : null;
    }
    
    @Override
    public String resolveAddress(RawResourceRecord raw, String kind) {
        String hint = text(raw.addressHint());
        if (hint != null) {
            return hint;
        }
        Map<?, ?> metadata = raw.body().get("metadata") instanceof Map<?, ?> m ? m : Map.of();
        String name = text(metadata.get("name"));
        if (name == null || kind == null) {
            return null;
        }
        String namespace = firstNonBlank(text(metadata.get("namespace")), DEFAULT_NAMESPACE);
        String shortKind = kind.startsWith(KIND_PREFIX) ? kind.substring(KIND_PREFIX.length()) : kind;
        return shortKind + "/" + namespace + "/" + name;
    }
    
    @Override
    public Map<String, Object> attributeBody(RawResourceRecord raw) {
        return raw.body();
    }
}
