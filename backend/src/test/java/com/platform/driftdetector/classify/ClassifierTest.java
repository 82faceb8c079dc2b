package com.platform.driftdetector.classify;

import com.platform.driftdetector.TestTables;
import com.platform.driftdetector.diff.ChangeKind;
import com.platform.driftdetector.diff.DiffEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClassifierTest {

    private static final ClassificationRuleTable TABLE = TestTables.classificationTable("""
        version: "t1"
        framework: "unit"
        rules:
          - id: exact-acl
            kind: aws_s3_bucket
            match: EXACT
            path: acl
            severity: HIGH
            category: public-access
          - id: logging
            kind: aws_s3_bucket
            match: PREFIX
            path: logging
            severity: MEDIUM
            category: logging
          - id: logging-target
            kind: aws_s3_bucket
            match: PREFIX
            path: logging.target
            severity: LOW
            category: logging-target
          - id: bucket-other
            kind: aws_s3_bucket
            match: WILDCARD
            severity: LOW
            category: storage
          - id: removed-only
            kind: aws_instance
            match: EXACT
            path: monitoring
            severity: CRITICAL
            category: observability
            changeKinds: [REMOVED]
          - id: any-monitoring
            kind: aws_instance
            match: EXACT
            path: monitoring
            severity: MEDIUM
            category: observability
          - id: global-tags
            kind: "*"
            match: PREFIX
            path: tags
            severity: LOW
            category: tagging
          - id: global-kind
            kind: "*"
            match: EXACT
            path: "@kind"
            severity: HIGH
            category: identity
        """);

    private final Classifier classifier = new Classifier(TABLE);

    // =========================================================================
    // Lookup order
    // =========================================================================

    @Nested
    @DisplayName("lookup order")
    class LookupOrder {

        @Test
        @DisplayName("an exact rule beats prefix and wildcard rules")
        void exactFirst() {
            assertThat(classifier.classify("aws_s3_bucket", "acl", ChangeKind.MODIFIED))
                .isEqualTo(new Classification(Severity.HIGH, "public-access", "exact-acl"));
        }

        @Test
        @DisplayName("the longest matching prefix wins")
        void longestPrefix() {
            assertThat(classifier.classify("aws_s3_bucket", "logging.target_prefix", ChangeKind.MODIFIED).ruleId())
                .isEqualTo("logging");
            assertThat(classifier.classify("aws_s3_bucket", "logging.target.bucket", ChangeKind.MODIFIED).ruleId())
                .isEqualTo("logging-target");
            assertThat(classifier.classify("aws_s3_bucket", "logging", ChangeKind.REMOVED).ruleId())
                .isEqualTo("logging");
        }

        @Test
        @DisplayName("the kind wildcard catches any other path of the kind")
        void wildcard() {
            assertThat(classifier.classify("aws_s3_bucket", "tags.env", ChangeKind.ADDED).ruleId())
                .isEqualTo("bucket-other");
        }

        @Test
        @DisplayName("global rules apply when the kind has no match")
        void globalRules() {
            assertThat(classifier.classify("aws_instance", "tags.env", ChangeKind.ADDED).ruleId())
                .isEqualTo("global-tags");
            assertThat(classifier.classify("aws_instance", "@kind", ChangeKind.MODIFIED).category())
                .isEqualTo("identity");
        }

        @Test
        @DisplayName("anything unmatched is INFORMATIONAL and uncategorized")
        void fallback() {
            Classification classification = classifier.classify("aws_instance", "ami", ChangeKind.MODIFIED);

            assertThat(classification).isEqualTo(Classification.DEFAULT);
            assertThat(classification.severity()).isEqualTo(Severity.INFORMATIONAL);
            assertThat(classification.ruleId()).isNull();
        }

        @Test
        @DisplayName("rules restricted to other change kinds are skipped")
        void changeKindRestriction() {
            assertThat(classifier.classify("aws_instance", "monitoring", ChangeKind.REMOVED).ruleId())
                .isEqualTo("removed-only");
            assertThat(classifier.classify("aws_instance", "monitoring", ChangeKind.MODIFIED).ruleId())
                .isEqualTo("any-monitoring");
        }
    }

    // =========================================================================
    // Entries
    // =========================================================================

    @Nested
    @DisplayName("classifyAll")
    class ClassifyAll {

        @Test
        @DisplayName("keeps entry order and carries the diff values")
        void keepsOrder() {
            List<ClassifiedEntry> entries = classifier.classifyAll("aws_s3_bucket", List.of(
                DiffEntry.modified("acl", "private", "public-read"),
                DiffEntry.removed("logging.target", "logs")));

            assertThat(entries).extracting(ClassifiedEntry::path).containsExactly("acl", "logging.target");
            assertThat(entries.get(0).declaredValue()).isEqualTo("private");
            assertThat(entries.get(0).observedValue()).isEqualTo("public-read");
            assertThat(entries.get(1).changeKind()).isEqualTo(ChangeKind.REMOVED);
            assertThat(entries.get(1).severity()).isEqualTo(Severity.LOW);
        }

        @Test
        @DisplayName("the same input always yields the same classification")
        void deterministic() {
            List<DiffEntry> diff = List.of(DiffEntry.added("tags.team", "core"));

            assertThat(classifier.classifyAll("aws_vpc", diff)).isEqualTo(classifier.classifyAll("aws_vpc", diff));
        }
    }

    @Test
    @DisplayName("severity ordering puts CRITICAL first")
    void severityOrdering() {
        assertThat(Severity.CRITICAL.isMoreSevereThan(Severity.HIGH)).isTrue();
        assertThat(Severity.LOW.isMoreSevereThan(Severity.MEDIUM)).isFalse();
        assertThat(Severity.INFORMATIONAL.isMoreSevereThan(null)).isTrue();
    }
}
