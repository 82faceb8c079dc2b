package com.platform.driftdetector.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.platform.driftdetector.error.EquivalenceRuleException;
import com.platform.driftdetector.path.GlobPattern;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads an equivalence table from YAML or JSON.
 *
 * <pre>
 * version: "2024.06"
 * rules:
 *   - kind: aws_s3_bucket
 *     path: tags
 *     type: SET
 *   - kind: aws_autoscaling_group
 *     path: desired_capacity
 *     type: COMPUTED_NUMERIC
 *     tolerance: 2
 * </pre>
 */
@Slf4j
public class EquivalenceTableLoader {
    
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    
    /**
     * @throws EquivalenceRuleException on unreadable input or any malformed entry
     */
    public EquivalenceTable load(InputStream input, String sourceName) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(input);
        } catch (IOException e) {
            throw new EquivalenceRuleException("Cannot read equivalence table " + sourceName + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new EquivalenceRuleException("Equivalence table " + sourceName + " is not a mapping");
        }
        
        String version = root.path("version").asText(null);
        if (version == null || version.isBlank()) {
            throw new EquivalenceRuleException("Equivalence table " + sourceName + " has no version");
        }
        
        JsonNode rulesNode = root.path("rules");
        if (!rulesNode.isMissingNode() && !rulesNode.isArray()) {
            throw new EquivalenceRuleException("Equivalence table " + sourceName + ": 'rules' must be a list");
        }
        
        List<EquivalenceRule> rules = new ArrayList<>();
        int position = 0;
        for (JsonNode node : rulesNode) {
            EquivalenceRule rule = parseRule(node, sourceName, position++);
            log.debug("Equivalence rule {}", rule.describe());
            rules.add(rule);
        }
        
        log.info("Loaded equivalence table {} version {} with {} rules", sourceName, version, rules.size());
        return new EquivalenceTable(version, rules);
    }
    
    private EquivalenceRule parseRule(JsonNode node, String sourceName, int position) {
        String where = String.format("%s rule #%d", sourceName, position);
        if (!node.isObject()) {
            throw new EquivalenceRuleException(where + " is not a mapping");
        }
        String kind = requiredText(node, "kind", where);
        String path = requiredText(node, "path", where);
        String typeName = requiredText(node, "type", where);
        
        EquivalenceRuleType type;
        try {
            type = EquivalenceRuleType.valueOf(typeName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new EquivalenceRuleException(where + ": unknown type '" + typeName + "'", e);
        }
        
        Object defaultValue = null;
        if (node.has("default")) {
            if (type != EquivalenceRuleType.DEFAULT) {
                throw new EquivalenceRuleException(where + ": 'default' is only allowed on DEFAULT rules");
            }
            defaultValue = yamlMapper.convertValue(node.get("default"), Object.class);
        }
        if (type == EquivalenceRuleType.DEFAULT && defaultValue == null) {
            throw new EquivalenceRuleException(where + ": DEFAULT rule needs a non-null 'default'");
        }
        
        BigDecimal tolerance = null;
        if (node.has("tolerance")) {
            if (type != EquivalenceRuleType.COMPUTED_NUMERIC) {
                throw new EquivalenceRuleException(where + ": 'tolerance' is only allowed on COMPUTED_NUMERIC rules");
            }
            JsonNode toleranceNode = node.get("tolerance");
            if (!toleranceNode.isNumber() || toleranceNode.decimalValue().signum() < 0) {
                throw new EquivalenceRuleException(where + ": 'tolerance' must be a non-negative number");
            }
            tolerance = toleranceNode.decimalValue();
        }
        
        boolean strict = true;
        if (node.has("strict")) {
            if (type != EquivalenceRuleType.BOOLEAN && type != EquivalenceRuleType.NUMBER) {
                throw new EquivalenceRuleException(where + ": 'strict' is only allowed on BOOLEAN and NUMBER rules");
            }
            if (!node.get("strict").isBoolean()) {
                throw new EquivalenceRuleException(where + ": 'strict' must be true or false");
            }
            strict = node.get("strict").booleanValue();
        }
        
        return new EquivalenceRule(GlobPattern.of(kind), GlobPattern.of(path), type, defaultValue, tolerance, strict);
    }
    
    private static String requiredText(JsonNode node, String field, String where) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new EquivalenceRuleException(where + ": missing '" + field + "'");
        }
        return value.asText().trim();
    }
}
