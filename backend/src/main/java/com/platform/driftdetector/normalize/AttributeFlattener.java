package com.platform.driftdetector.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.driftdetector.error.ErrorCode;
import com.platform.driftdetector.error.NormalizationException;
import com.platform.driftdetector.path.AttributePath;
import com.platform.driftdetector.resource.Origin;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Walks a raw attribute tree and emits flattened path/value pairs, applying the equivalence
 * rules of the resource kind on the way down.
 *
 * <p>Maps are always flattened. Sequences of scalars and SET sequences stay whole (one path, one
 * list value); other sequences are flattened by index. Explicit nulls are treated as absent.
 */
class AttributeFlattener {
    
    private final EquivalenceTable table;
    private final ObjectMapper objectMapper;
    
    AttributeFlattener(EquivalenceTable table, ObjectMapper objectMapper) {
        this.table = table;
        this.objectMapper = objectMapper;
    }
    
    TreeMap<String, Object> flatten(String kind, String address, Origin origin, Map<String, Object> body) {
        Walk walk = new Walk(kind, address, origin);
        for (Map.Entry<String, Object> entry : body.entrySet()) {
            walk.visit(AttributePath.child("", entry.getKey()), entry.getValue());
        }
        return walk.out;
    }
    
    private final class Walk {
        private final String kind;
        private final String address;
        private final Origin origin;
        private final TreeMap<String, Object> out = new TreeMap<>();
        
        Walk(String kind, String address, Origin origin) {
            this.kind = kind;
            this.address = address;
            this.origin = origin;
        }
        
        void visit(String path, Object value) {
            if (value == null) {
                return;
            }
            if (table.isIgnored(kind, path)) {
                return;
            }
            Map<EquivalenceRuleType, EquivalenceRule> rules = table.rulesAt(kind, path);
            
            Object current = value;
            if (current instanceof String text && rules.containsKey(EquivalenceRuleType.JSON_DOCUMENT)) {
                current = parseDocument(path, text);
            }
            if (current instanceof List<?> list && rules.containsKey(EquivalenceRuleType.KEY_VALUE_LIST)) {
                current = keyValueMap(path, list);
            }
            
            if (current instanceof Map<?, ?> map) {
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    visit(AttributePath.child(path, String.valueOf(entry.getKey())), entry.getValue());
                }
            } else if (current instanceof List<?> list) {
                visitSequence(path, list, rules);
            } else {
                Object scalar = coerce(path, current, rules);
                emit(path, scalar, rules);
            }
        }
        
        private void visitSequence(String path, List<?> list, Map<EquivalenceRuleType, EquivalenceRule> rules) {
            boolean set = rules.containsKey(EquivalenceRuleType.SET);
            if (!set && !allScalars(list)) {
                for (int i = 0; i < list.size(); i++) {
                    visit(AttributePath.index(path, i), list.get(i));
                }
                return;
            }
            List<Object> elements = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                Object element = list.get(i);
                if (element == null) {
                    continue;
                }
                if (element instanceof Map<?, ?> || element instanceof List<?>) {
                    elements.add(canonicalElement(AttributePath.index(path, i), element));
                } else {
                    String elementPath = AttributePath.index(path, i);
                    Map<EquivalenceRuleType, EquivalenceRule> elementRules = table.rulesAt(kind, elementPath);
                    rules.forEach(elementRules::putIfAbsent);
                    elements.add(coerce(elementPath, element, elementRules));
                }
            }
            if (set) {
                elements.sort(ValueCanonicalizer.ORDER);
            }
            emit(path, Collections.unmodifiableList(elements), rules);
        }
        
        private Object canonicalElement(String path, Object element) {
            try {
                return ValueCanonicalizer.canonicalValue(element);
            } catch (NumberFormatException e) {
                NormalizationException violation =
                    NormalizationException.typeViolation(origin, address, path, "finite number", element);
                violation.initCause(e);
                throw violation;
            }
        }
        
        private Object coerce(String path, Object raw, Map<EquivalenceRuleType, EquivalenceRule> rules) {
            if (isNonFinite(raw)) {
                throw NormalizationException.typeViolation(origin, address, path, "finite number", raw);
            }
            Object value = ValueCanonicalizer.canonicalScalar(raw);
            
            EquivalenceRule booleanRule = rules.get(EquivalenceRuleType.BOOLEAN);
            if (booleanRule != null && !(value instanceof Boolean)) {
                Boolean parsed = value instanceof String text ? ValueCanonicalizer.parseBoolean(text) : null;
                if (parsed != null) {
                    value = parsed;
                } else if (booleanRule.strict()) {
                    throw NormalizationException.typeViolation(origin, address, path, "boolean", raw);
                }
            }
            
            EquivalenceRule numberRule = rules.containsKey(EquivalenceRuleType.COMPUTED_NUMERIC)
                ? rules.get(EquivalenceRuleType.COMPUTED_NUMERIC)
                : rules.get(EquivalenceRuleType.NUMBER);
            if (numberRule != null && !(value instanceof BigDecimal)) {
                BigDecimal parsed = value instanceof String text ? ValueCanonicalizer.parseNumber(text) : null;
                if (parsed != null) {
                    value = parsed;
                } else if (numberRule.strict()) {
                    throw NormalizationException.typeViolation(origin, address, path, "number", raw);
                }
            }
            
            if (value instanceof String text) {
                if (rules.containsKey(EquivalenceRuleType.CASE_INSENSITIVE)) {
                    text = text.toLowerCase(Locale.ROOT);
                }
                if (rules.containsKey(EquivalenceRuleType.TRAILING_SLASH)) {
                    while (text.length() > 1 && text.endsWith("/")) {
                        text = text.substring(0, text.length() - 1);
                    }
                }
                value = text;
            }
            return value;
        }
        
        private void emit(String path, Object value, Map<EquivalenceRuleType, EquivalenceRule> rules) {
            EquivalenceRule defaultRule = rules.get(EquivalenceRuleType.DEFAULT);
            if (defaultRule != null) {
                Object defaultValue = defaultValue(path, defaultRule, rules);
                if (ValueCanonicalizer.sameValue(value, defaultValue)) {
                    return;
                }
            }
            out.put(path, value);
        }
        
        private Object defaultValue(String path, EquivalenceRule rule, Map<EquivalenceRuleType, EquivalenceRule> rules) {
            Object configured = rule.defaultValue();
            if (configured instanceof List<?> || configured instanceof Map<?, ?>) {
                return ValueCanonicalizer.canonicalValue(configured);
            }
            return coerce(path, configured, rules);
        }
        
        private Object parseDocument(String path, String text) {
            try {
                return objectMapper.readValue(text, Object.class);
            } catch (JsonProcessingException e) {
                throw new NormalizationException(ErrorCode.TYPE_VIOLATION, origin, address, path,
                    String.format("Value at %s of %s is not a valid JSON document: %s",
                        path, address, e.getOriginalMessage()), e);
            }
        }
        
        private Map<String, Object> keyValueMap(String path, List<?> list) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Object element : list) {
                if (!(element instanceof Map<?, ?> pair)) {
                    throw NormalizationException.typeViolation(origin, address, path, "key/value list", element);
                }
                Object key = firstPresent(pair, "Key", "key", "Name", "name");
                if (key == null) {
                    throw NormalizationException.typeViolation(origin, address, path, "key/value list", element);
                }
                result.put(String.valueOf(key), firstPresent(pair, "Value", "value"));
            }
            return result;
        }
    }
    
    private static Object firstPresent(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            if (map.containsKey(key)) {
                return map.get(key);
            }
        }
        return null;
    }
    
    private static boolean isNonFinite(Object value) {
        if (value instanceof Double d) {
            return d.isNaN() || d.isInfinite();
        }
        if (value instanceof Float f) {
            return f.isNaN() || f.isInfinite();
        }
        return false;
    }
    
    private static boolean allScalars(List<?> list) {
        for (Object element : list) {
            if (element instanceof Map<?, ?> || element instanceof List<?>) {
                return false;
            }
        }
        return true;
    }
}
