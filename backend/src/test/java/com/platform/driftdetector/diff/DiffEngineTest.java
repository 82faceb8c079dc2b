package com.platform.driftdetector.diff;

import com.platform.driftdetector.TestTables;
import com.platform.driftdetector.normalize.EquivalenceTable;
import com.platform.driftdetector.resource.Origin;
import com.platform.driftdetector.resource.ResourceModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiffEngineTest {

    private static final EquivalenceTable TABLE = TestTables.equivalenceTable("""
        version: "test"
        rules:
          - kind: aws_security_group
            path: ingress
            type: SET
          - kind: aws_autoscaling_group
            path: desired_capacity
            type: COMPUTED_NUMERIC
            tolerance: 2
          - kind: aws_autoscaling_group
            path: min_size
            type: COMPUTED_NUMERIC
        """);

    private final DiffEngine engine = new DiffEngine(TABLE, BigDecimal.ZERO);

    private static ResourceModel declared(String kind, Map<String, Object> attributes) {
        return ResourceModel.of("r1", kind, Origin.DECLARED, attributes);
    }

    private static ResourceModel observed(String kind, Map<String, Object> attributes) {
        return ResourceModel.of("r1", kind, Origin.OBSERVED, attributes);
    }

    // =========================================================================
    // Change kinds
    // =========================================================================

    @Nested
    @DisplayName("change kinds")
    class ChangeKinds {

        @Test
        @DisplayName("identical models produce no entries")
        void identical() {
            Map<String, Object> attributes = Map.of("acl", "private", "versioning.enabled", true);

            assertThat(engine.diff(declared("aws_s3_bucket", attributes), observed("aws_s3_bucket", attributes)))
                .isEmpty();
        }

        @Test
        @DisplayName("declared-only is REMOVED, observed-only is ADDED, differing is MODIFIED")
        void allKinds() {
            List<DiffEntry> entries = engine.diff(
                declared("aws_s3_bucket", Map.of("acl", "private", "logging.target", "logs")),
                observed("aws_s3_bucket", Map.of("acl", "public-read", "website.index", "index.html")));

            assertThat(entries).containsExactly(
                DiffEntry.modified("acl", "private", "public-read"),
                DiffEntry.removed("logging.target", "logs"),
                DiffEntry.added("website.index", "index.html"));
        }

        @Test
        @DisplayName("entries are ordered by path")
        void orderedByPath() {
            List<DiffEntry> entries = engine.diff(
                declared("k", Map.of("c", "1", "a", "1", "b", "1")),
                observed("k", Map.of("c", "2", "a", "2", "b", "2")));

            assertThat(entries).extracting(DiffEntry::path).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("numbers compare by value, not by scale")
        void numbersByValue() {
            assertThat(engine.diff(
                declared("k", Map.of("size", new BigDecimal("10"))),
                observed("k", Map.of("size", new BigDecimal("10.00")))))
                .isEmpty();
        }

        @Test
        @DisplayName("a string and a boolean with the same text differ")
        void typesMatter() {
            assertThat(engine.diff(
                declared("k", Map.of("enabled", "true")),
                observed("k", Map.of("enabled", true))))
                .singleElement()
                .extracting(DiffEntry::changeKind).isEqualTo(ChangeKind.MODIFIED);
        }

        @Test
        @DisplayName("swapping the sides swaps ADDED and REMOVED")
        void symmetry() {
            ResourceModel left = declared("k", Map.of("a", "1", "b", "2"));
            ResourceModel right = observed("k", Map.of("b", "3", "c", "4"));
            ResourceModel leftAsObserved = observed("k", left.attributes());
            ResourceModel rightAsDeclared = declared("k", right.attributes());

            List<DiffEntry> forward = engine.diff(left, right);
            List<DiffEntry> backward = engine.diff(rightAsDeclared, leftAsObserved);

            assertThat(forward).extracting(DiffEntry::path).containsExactly("a", "b", "c");
            assertThat(backward).extracting(DiffEntry::changeKind)
                .containsExactly(ChangeKind.ADDED, ChangeKind.MODIFIED, ChangeKind.REMOVED);
        }
    }

    // =========================================================================
    // Equivalence rules
    // =========================================================================

    @Nested
    @DisplayName("equivalence rules")
    class Rules {

        @Test
        @DisplayName("ordered sequences differ when reordered")
        void orderedSequence() {
            assertThat(engine.diff(
                declared("aws_instance", Map.of("security_groups", List.of("a", "b"))),
                observed("aws_instance", Map.of("security_groups", List.of("b", "a")))))
                .singleElement()
                .extracting(DiffEntry::path).isEqualTo("security_groups");
        }

        @Test
        @DisplayName("SET sequences compare as multisets")
        void setSequence() {
            assertThat(engine.diff(
                declared("aws_security_group", Map.of("ingress", List.of("a", "b", "b"))),
                observed("aws_security_group", Map.of("ingress", List.of("b", "a", "b")))))
                .isEmpty();
            assertThat(engine.diff(
                declared("aws_security_group", Map.of("ingress", List.of("a", "b", "b"))),
                observed("aws_security_group", Map.of("ingress", List.of("a", "a", "b")))))
                .hasSize(1);
        }

        @Test
        @DisplayName("computed numerics tolerate differences within the rule tolerance")
        void tolerance() {
            ResourceModel desired = declared("aws_autoscaling_group", Map.of("desired_capacity", new BigDecimal("4")));

            assertThat(engine.diff(desired,
                observed("aws_autoscaling_group", Map.of("desired_capacity", new BigDecimal("6")))))
                .isEmpty();
            assertThat(engine.diff(desired,
                observed("aws_autoscaling_group", Map.of("desired_capacity", new BigDecimal("7")))))
                .singleElement()
                .isEqualTo(DiffEntry.modified("desired_capacity", new BigDecimal("4"), new BigDecimal("7")));
        }

        @Test
        @DisplayName("computed numerics without their own tolerance use the engine default")
        void defaultTolerance() {
            DiffEngine lenient = new DiffEngine(TABLE, BigDecimal.ONE);

            assertThat(lenient.diff(
                declared("aws_autoscaling_group", Map.of("min_size", new BigDecimal("1"))),
                observed("aws_autoscaling_group", Map.of("min_size", new BigDecimal("2")))))
                .isEmpty();
            assertThat(engine.diff(
                declared("aws_autoscaling_group", Map.of("min_size", new BigDecimal("1"))),
                observed("aws_autoscaling_group", Map.of("min_size", new BigDecimal("2")))))
                .hasSize(1);
        }
    }

    // =========================================================================
    // Preconditions
    // =========================================================================

    @Nested
    @DisplayName("preconditions")
    class Preconditions {

        @Test
        @DisplayName("a kind mismatch is reported at @kind, sorted with the attribute entries")
        void kindMismatch() {
            List<DiffEntry> entries = engine.diff(
                declared("aws_instance", Map.of("ami", "ami-1")),
                observed("aws_spot_instance", Map.of("ami", "ami-2")));

            assertThat(entries).containsExactly(
                DiffEntry.modified("@kind", "aws_instance", "aws_spot_instance"),
                DiffEntry.modified("ami", "ami-1", "ami-2"));
        }

        @Test
        @DisplayName("models of different addresses cannot be diffed")
        void differentAddresses() {
            ResourceModel other = ResourceModel.of("r2", "k", Origin.OBSERVED, Map.of());

            assertThatThrownBy(() -> engine.diff(declared("k", Map.of()), other))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("r2");
        }

        @Test
        @DisplayName("both sides must come from their own origin")
        void origins() {
            assertThatThrownBy(() -> engine.diff(observed("k", Map.of()), observed("k", Map.of())))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("an entry with the wrong side absent is rejected")
        void inconsistentEntry() {
            assertThatThrownBy(() -> new DiffEntry("a", "x", null, ChangeKind.ADDED))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
