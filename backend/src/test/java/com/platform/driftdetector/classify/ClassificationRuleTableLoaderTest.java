package com.platform.driftdetector.classify;

import com.platform.driftdetector.TestTables;
import com.platform.driftdetector.diff.ChangeKind;
import com.platform.driftdetector.error.ClassificationRuleException;
import com.platform.driftdetector.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassificationRuleTableLoaderTest {

    @Test
    @DisplayName("the bundled table loads with its version and framework")
    void bundledTable() {
        ClassificationRuleTable table = TestTables.defaultClassificationTable();

        assertThat(table.getVersion()).isEqualTo("2024.06");
        assertThat(table.getFramework()).contains("CIS");
        assertThat(table.getRules()).extracting(ClassificationRule::id).contains("s3-encryption", "kind-changed");
        assertThat(new Classifier(table).classify("aws_s3_bucket", "encryption", ChangeKind.MODIFIED))
            .isEqualTo(new Classification(Severity.CRITICAL, "encryption", "s3-encryption"));
    }

    @Test
    @DisplayName("match defaults to EXACT, or WILDCARD for the * path")
    void matchDefaults() {
        ClassificationRuleTable table = TestTables.classificationTable("""
            version: "1"
            rules:
              - id: a
                kind: k
                path: x
                severity: high
                category: c
              - id: b
                kind: k
                path: "*"
                severity: low
                category: c
                changeKinds: [added, removed]
            """);

        assertThat(table.getFramework()).isEqualTo("unspecified");
        assertThat(table.getRules()).extracting(ClassificationRule::match)
            .containsExactly(RuleMatchType.EXACT, RuleMatchType.WILDCARD);
        assertThat(table.getRules().get(1).changeKinds()).containsExactlyInAnyOrder(ChangeKind.ADDED, ChangeKind.REMOVED);
        assertThat(table.getRules().get(1).appliesTo(ChangeKind.MODIFIED)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "rules: []",
        "version: '1'\nrules: {}",
        "version: '1'\nrules:\n  - kind: k\n    path: p\n    severity: LOW\n    category: c",
        "version: '1'\nrules:\n  - id: a\n    path: p\n    severity: LOW\n    category: c",
        "version: '1'\nrules:\n  - id: a\n    kind: k\n    path: p\n    severity: SEVERE\n    category: c",
        "version: '1'\nrules:\n  - id: a\n    kind: k\n    path: p\n    severity: LOW",
        "version: '1'\nrules:\n  - id: a\n    kind: k\n    match: PREFIX\n    severity: LOW\n    category: c",
        "version: '1'\nrules:\n  - id: a\n    kind: k\n    match: WILDCARD\n    path: x\n    severity: LOW\n    category: c",
        "version: '1'\nrules:\n  - id: a\n    kind: k\n    match: FUZZY\n    path: x\n    severity: LOW\n    category: c",
        "version: '1'\nrules:\n  - id: a\n    kind: k\n    path: x\n    severity: LOW\n    category: c\n    changeKinds: [RENAMED]",
        "version: '1'\nrules:\n  - id: a\n    kind: k\n    path: x\n    severity: LOW\n    category: c\n"
            + "  - id: a\n    kind: k\n    path: y\n    severity: LOW\n    category: c",
        "version: '1'\nrules:\n  - id: a\n    kind: k\n    path: x\n    severity: LOW\n    category: c\n"
            + "  - id: b\n    kind: k\n    path: x\n    severity: HIGH\n    category: d",
        "- just a list"
    })
    @DisplayName("malformed tables are rejected at load time")
    void rejectsMalformed(String yaml) {
        assertThatThrownBy(() -> TestTables.classificationTable(yaml))
            .isInstanceOfSatisfying(ClassificationRuleException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.CLASSIFICATION_RULE_INVALID));
    }

    @Test
    @DisplayName("the failing rule id is reported")
    void namesFailingRule() {
        assertThatThrownBy(() -> TestTables.classificationTable("""
                version: "1"
                rules:
                  - id: broken
                    kind: k
                    path: p
                    severity: URGENT
                    category: c
                """))
            .isInstanceOfSatisfying(ClassificationRuleException.class,
                e -> assertThat(e.getRuleId()).isEqualTo("broken"))
            .hasMessageContaining("URGENT");
    }
}
