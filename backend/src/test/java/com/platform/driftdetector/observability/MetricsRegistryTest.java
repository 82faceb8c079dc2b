package com.platform.driftdetector.observability;

import com.platform.driftdetector.classify.ClassifiedEntry;
import com.platform.driftdetector.classify.Severity;
import com.platform.driftdetector.diff.ChangeKind;
import com.platform.driftdetector.report.DriftReport;
import com.platform.driftdetector.report.DriftReportBuilder;
import com.platform.driftdetector.report.ResourceDrift;
import com.platform.driftdetector.resource.Origin;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private SimpleMeterRegistry meterRegistry;
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new MetricsRegistry(meterRegistry);
    }

    private double count(String name, String tagKey, String tagValue) {
        return meterRegistry.get(name).tag(tagKey, tagValue).counter().count();
    }

    @Test
    @DisplayName("a completed run counts sections and entries per severity")
    void completedRun() {
        DriftReport report = new DriftReportBuilder("e", "c", "f").build(
            List.of(new ResourceDrift("a", "k", List.of(
                new ClassifiedEntry("x", ChangeKind.ADDED, null, "1", Severity.HIGH, "c", "r1"),
                new ClassifiedEntry("y", ChangeKind.ADDED, null, "1", Severity.HIGH, "c", "r1")))),
            List.of(), List.of(), List.of());

        metrics.recordRunCompleted(report, 12);
        metrics.recordRunCompleted(report, 8);

        assertThat(count(MetricsRegistry.RUNS_TOTAL, "outcome", "completed")).isEqualTo(2.0);
        assertThat(count(MetricsRegistry.ENTRIES, "severity", "high")).isEqualTo(4.0);
        assertThat(count(MetricsRegistry.ENTRIES, "severity", "critical")).isZero();
        assertThat(count(MetricsRegistry.RESOURCES, "section", "drifted")).isEqualTo(2.0);
        assertThat(meterRegistry.get(MetricsRegistry.RUN_DURATION).tag("outcome", "completed").timer().count())
            .isEqualTo(2);
    }

    @Test
    @DisplayName("aborted runs, rejected records and API errors have their own counters")
    void otherCounters() {
        metrics.recordRunAborted("cancelled", 3);
        metrics.recordNormalizationFailure(Origin.DECLARED);
        metrics.recordError("DD-100");
        metrics.recordError("DD-100");

        assertThat(count(MetricsRegistry.RUNS_TOTAL, "outcome", "cancelled")).isEqualTo(1.0);
        assertThat(count(MetricsRegistry.NORMALIZATION_FAILURES, "origin", "declared")).isEqualTo(1.0);
        assertThat(count(MetricsRegistry.ERRORS, "code", "DD-100")).isEqualTo(2.0);
    }
}
