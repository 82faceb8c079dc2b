package com.platform.driftdetector.select;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JacksonJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import com.platform.driftdetector.error.ValidationException;
import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.SourceDialect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts raw resource records from a whole state document with a JSONPath expression,
 * e.g. {@code $.resources[*]} over a parsed state file.
 *
 * <p>Every object the expression matches becomes one record; a matched array contributes its
 * elements. Anything else is skipped with a warning. A path that matches nothing yields no records.
 *
 * <p>For Terraform documents, state resources are unwrapped into one record per instance. A match
 * on a resource, on one of its {@code instances} or on an instance's {@code attributes} yields a
 * record carrying the resource's {@code type}, {@code name}, {@code module} and {@code mode}, the
 * instance's {@code index_key} and the instance attributes nested under {@code attributes}.
 */
@Slf4j
@Component
public class RecordSelector {
    
    private static final Configuration JSON_PATH_CONFIG = Configuration.builder()
        .jsonProvider(new JacksonJsonProvider())
        .mappingProvider(new JacksonMappingProvider())
        .options(Option.ALWAYS_RETURN_LIST)
        .build();
    
    private static final List<String> RESOURCE_IDENTITY_KEYS = List.of("mode", "module", "type", "name", "provider");
    private static final String INSTANCES = "instances";
    private static final String ATTRIBUTES = "attributes";
    private static final String INDEX_KEY = "index_key";
    
    /**
     * @throws ValidationException if {@code jsonPath} is not a valid expression
     */
    public List<RawResourceRecord> select(Object document, String jsonPath, SourceDialect dialect) {
        if (jsonPath == null || jsonPath.isBlank()) {
            throw ValidationException.missingField("observedJsonPath");
        }
        
        JsonPath path;
        try {
            requireBalanced(jsonPath);
            path = JsonPath.compile(jsonPath);
        } catch (InvalidPathException e) {
            throw ValidationException.invalidSelector(jsonPath, e);
        }
        
        List<Object> matches;
        try {
            matches = JsonPath.using(JSON_PATH_CONFIG).parse(document).read(path);
        } catch (PathNotFoundException e) {
            log.debug("No match for {}: {}", jsonPath, e.getMessage());
            return List.of();
        } catch (InvalidPathException e) {
            throw ValidationException.invalidSelector(jsonPath, e);
        }
        if (matches == null) {
            return List.of();
        }
        
        Selection selection = new Selection(jsonPath, dialect,
            dialect == SourceDialect.TERRAFORM ? stateInstances(document) : Map.of());
        for (Object match : matches) {
            if (match instanceof List<?> elements) {
                for (Object element : elements) {
                    selection.add(element);
                }
            } else {
                selection.add(match);
            }
        }
        
        log.debug("Selected {} records with {}", selection.records.size(), jsonPath);
        return selection.records;
    }
    
    /**
     * The compiler accepts some unterminated bracket and filter expressions, so they are rejected here.
     */
    private static void requireBalanced(String jsonPath) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < jsonPath.length(); i++) {
            char c = jsonPath.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '[' || c == '(') {
                depth++;
            } else if (c == ']' || c == ')') {
                depth--;
                if (depth < 0) {
                    break;
                }
            }
        }
        if (depth != 0 || quote != 0) {
            throw new InvalidPathException("Unbalanced brackets or quotes in " + jsonPath);
        }
    }
    
    // ==================== STATE INSTANCES ====================
    
    private record StateInstance(Map<?, ?> resource, Map<?, ?> instance) {
    }
    
    /**
     * Indexes every instance of every state resource in the document, and its attribute map, by identity.
     */
    private static Map<Object, StateInstance> stateInstances(Object document) {
        Map<Object, StateInstance> index = new IdentityHashMap<>();
        collect(document, index);
        return index;
    }
    
    private static void collect(Object node, Map<Object, StateInstance> index) {
        if (node instanceof Map<?, ?> map) {
            if (isStateResource(map)) {
                for (Object instance : (List<?>) map.get(INSTANCES)) {
                    if (instance instanceof Map<?, ?> instanceMap) {
                        StateInstance context = new StateInstance(map, instanceMap);
                        index.put(instanceMap, context);
                        if (instanceMap.get(ATTRIBUTES) instanceof Map<?, ?> attributes) {
                            index.put(attributes, context);
                        }
                    }
                }
            }
            map.values().forEach(value -> collect(value, index));
        } else if (node instanceof List<?> list) {
            list.forEach(element -> collect(element, index));
        }
    }
    
    private static boolean isStateResource(Map<?, ?> map) {
        return map.get("type") instanceof String && map.get(INSTANCES) instanceof List<?>;
    }
    
    // ==================== RECORDS ====================
    
    private static final class Selection {
        private final String jsonPath;
        private final SourceDialect dialect;
        private final Map<Object, StateInstance> stateInstances;
        private final List<RawResourceRecord> records = new ArrayList<>();
        
        Selection(String jsonPath, SourceDialect dialect, Map<Object, StateInstance> stateInstances) {
            this.jsonPath = jsonPath;
            this.dialect = dialect;
            this.stateInstances = stateInstances;
        }
        
        void add(Object match) {
            if (!(match instanceof Map<?, ?> map)) {
                log.warn("Skipping non-object match of {}: {}", jsonPath,
                    match == null ? "null" : match.getClass().getSimpleName());
                return;
            }
            
            if (dialect == SourceDialect.TERRAFORM && isStateResource(map)) {
                for (Object instance : (List<?>) map.get(INSTANCES)) {
                    if (instance instanceof Map<?, ?> instanceMap) {
                        addInstance(new StateInstance(map, instanceMap));
                    }
                }
                return;
            }
            StateInstance context = stateInstances.get(map);
            if (context != null) {
                addInstance(context);
                return;
            }
            
            Map<String, Object> body = new LinkedHashMap<>();
            map.forEach((key, value) -> body.put(String.valueOf(key), value));
            append(body);
        }
        
        private void addInstance(StateInstance context) {
            Map<String, Object> body = new LinkedHashMap<>();
            for (String key : RESOURCE_IDENTITY_KEYS) {
                Object value = context.resource().get(key);
                if (value != null) {
                    body.put(key, value);
                }
            }
            Object indexKey = context.instance().get(INDEX_KEY);
            if (indexKey != null) {
                body.put(INDEX_KEY, indexKey);
            }
            Object attributes = context.instance().get(ATTRIBUTES);
            body.put(ATTRIBUTES, attributes instanceof Map<?, ?> ? attributes : Map.of());
            append(body);
        }
        
        private void append(Map<String, Object> body) {
            String sourceRef = jsonPath + "#" + records.size();
            records.add(new RawResourceRecord(dialect, null, null, body, sourceRef));
        }
    }
}
