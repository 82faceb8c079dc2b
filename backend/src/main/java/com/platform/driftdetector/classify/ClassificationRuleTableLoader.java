package com.platform.driftdetector.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.platform.driftdetector.diff.ChangeKind;
import com.platform.driftdetector.error.ClassificationRuleException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads a versioned classification rule table from YAML or JSON.
 *
 * <p>Every entry is validated before the table is returned, so a malformed table fails at
 * configuration-load time, before any resource is processed.
 */
@Slf4j
public class ClassificationRuleTableLoader {
    
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    
    /**
     * @throws ClassificationRuleException on unreadable input or any malformed entry
     */
    public ClassificationRuleTable load(InputStream input, String sourceName) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(input);
        } catch (IOException e) {
            throw new ClassificationRuleException("Cannot read classification table " + sourceName + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ClassificationRuleException(null, "Classification table " + sourceName + " is not a mapping");
        }
        
        String version = root.path("version").asText("");
        if (version.isBlank()) {
            throw new ClassificationRuleException(null, "Classification table " + sourceName + " has no version");
        }
        String framework = root.path("framework").asText("unspecified");
        
        JsonNode rulesNode = root.path("rules");
        if (!rulesNode.isMissingNode() && !rulesNode.isArray()) {
            throw new ClassificationRuleException(null, "Classification table " + sourceName + ": 'rules' must be a list");
        }
        
        List<ClassificationRule> rules = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        Set<String> signatures = new HashSet<>();
        int position = 0;
        for (JsonNode node : rulesNode) {
            ClassificationRule rule = parseRule(node, position++);
            if (!ids.add(rule.id())) {
                throw new ClassificationRuleException(rule.id(), "duplicate rule id");
            }
            String signature = rule.kind() + "|" + rule.match() + "|" + rule.path() + "|" + new TreeSet<>(rule.changeKinds());
            if (!signatures.add(signature)) {
                throw new ClassificationRuleException(rule.id(),
                    "duplicates an earlier rule for the same kind, path and change kinds");
            }
            rules.add(rule);
        }
        
        log.info("Loaded classification table {} version {} ({}) with {} rules",
            sourceName, version, framework, rules.size());
        return new ClassificationRuleTable(version, framework, rules);
    }
    
    private ClassificationRule parseRule(JsonNode node, int position) {
        if (!node.isObject()) {
            throw new ClassificationRuleException(null, "Rule #" + position + " is not a mapping");
        }
        String id = text(node, "id");
        if (id == null) {
            throw new ClassificationRuleException(null, "Rule #" + position + ": missing 'id'");
        }
        String kind = text(node, "kind");
        if (kind == null) {
            throw new ClassificationRuleException(id, "missing 'kind'");
        }
        String path = text(node, "path");
        
        RuleMatchType match = parseMatch(id, text(node, "match"), path);
        if (match == RuleMatchType.WILDCARD) {
            if (path != null && !"*".equals(path)) {
                throw new ClassificationRuleException(id, "WILDCARD rules take no path");
            }
            path = "*";
        } else if (path == null) {
            throw new ClassificationRuleException(id, match + " rules need a 'path'");
        }
        
        String severityName = text(node, "severity");
        if (severityName == null) {
            throw new ClassificationRuleException(id, "missing 'severity'");
        }
        Severity severity;
        try {
            severity = Severity.valueOf(severityName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ClassificationRuleException(id, "unknown severity '" + severityName + "'");
        }
        
        String category = text(node, "category");
        if (category == null) {
            throw new ClassificationRuleException(id, "missing 'category'");
        }
        
        Set<ChangeKind> changeKinds = EnumSet.noneOf(ChangeKind.class);
        JsonNode kindsNode = node.path("changeKinds");
        if (!kindsNode.isMissingNode()) {
            if (!kindsNode.isArray()) {
                throw new ClassificationRuleException(id, "'changeKinds' must be a list");
            }
            for (JsonNode changeKind : kindsNode) {
                try {
                    changeKinds.add(ChangeKind.valueOf(changeKind.asText().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    throw new ClassificationRuleException(id, "unknown change kind '" + changeKind.asText() + "'");
                }
            }
        }
        
        return new ClassificationRule(id, kind, match, path, severity, category, changeKinds, text(node, "description"));
    }
    
    private static RuleMatchType parseMatch(String id, String matchName, String path) {
        if (matchName == null) {
            return "*".equals(path) ? RuleMatchType.WILDCARD : RuleMatchType.EXACT;
        }
        try {
            return RuleMatchType.valueOf(matchName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ClassificationRuleException(id, "unknown match type '" + matchName + "'");
        }
    }
    
    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
