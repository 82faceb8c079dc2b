package com.platform.driftdetector.normalize;

import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.SourceDialect;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.platform.driftdetector.normalize.DialectResolver.firstNonBlank;
import static com.platform.driftdetector.normalize.DialectResolver.text;

/**
 * Terraform records: {@code type}, {@code name}, optional {@code module} and {@code index_key}
 * identify the resource ({@code module.net.aws_subnet.private[1]}), everything else is attributes.
 *
 * <p>A state instance record carries its attributes nested under {@code attributes} next to the
 * identity keys of its resource; the nested map is the attribute body then.
 */
@Component
public class TerraformDialectResolver implements DialectResolver {
    
    private static final Set<String> IDENTITY_KEYS = Set.of("type", "name", "module", "index_key", "mode", "provider");
    
    private static final String STATE_ATTRIBUTES = "attributes";
    
    @Override
    public SourceDialect getDialect() {
        return SourceDialect.TERRAFORM;
    }
    
    @Override
    public String resolveKind(RawResourceRecord raw) {
        String kind = firstNonBlank(raw.kindHint(), text(raw.body().get("type")));
        return kind != null ? kind.toLowerCase(Locale.ROOT) : null;
    }
    
    @Override
    public String resolveAddress(RawResourceRecord raw, String kind) {
        String hint = text(raw.addressHint());
        if (hint != null) {
            return hint;
        }
        String name = text(raw.body().get("name"));
        if (name == null || kind == null) {
            return null;
        }
        StringBuilder address = new StringBuilder();
        String module = text(raw.body().get("module"));
        if (module != null) {
            address.append(module).append('.');
        }
        if ("data".equals(text(raw.body().get("mode")))) {
            address.append("data.");
        }
        address.append(kind).append('.').append(name);
        Object indexKey = raw.body().get("index_key");
        if (indexKey instanceof Number) {
            address.append('[').append(indexKey).append(']');
        } else if (indexKey != null) {
            address.append("[\"").append(indexKey).append("\"]");
        }
        return address.toString();
    }
    
    @Override
    public Map<String, Object> attributeBody(RawResourceRecord raw) {
        if (isStateInstance(raw.body())) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            ((Map<?, ?>) raw.body().get(STATE_ATTRIBUTES))
                .forEach((key, value) -> attributes.put(String.valueOf(key), value));
            return attributes;
        }
        Map<String, Object> attributes = new LinkedHashMap<>(raw.body());
        IDENTITY_KEYS.forEach(attributes::remove);
        return attributes;
    }
    
    private static boolean isStateInstance(Map<String, Object> body) {
        if (!(body.get(STATE_ATTRIBUTES) instanceof Map<?, ?>) || !body.containsKey("type")) {
            return false;
        }
        for (String key : body.keySet()) {
            if (!STATE_ATTRIBUTES.equals(key) && !IDENTITY_KEYS.contains(key)) {
                return false;
            }
        }
        return true;
    }
}
