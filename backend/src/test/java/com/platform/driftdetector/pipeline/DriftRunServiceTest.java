package com.platform.driftdetector.pipeline;

import com.platform.driftdetector.TestTables;
import com.platform.driftdetector.config.DriftProperties;
import com.platform.driftdetector.error.AmbiguousAddressException;
import com.platform.driftdetector.error.DriftRunCancelledException;
import com.platform.driftdetector.error.ErrorCode;
import com.platform.driftdetector.error.ResourceNotFoundException;
import com.platform.driftdetector.observability.LoggingConfig;
import com.platform.driftdetector.observability.MetricsRegistry;
import com.platform.driftdetector.observability.StructuredLogger;
import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.SourceDialect;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DriftRunServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private DriftRunService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        DriftProperties properties = new DriftProperties();
        properties.getHistory().setMaxEntries(2);
        service = new DriftRunService(
            TestTables.defaultPipeline(),
            new MetricsRegistry(meterRegistry),
            new StructuredLogger(),
            OpenTelemetry.noop().getTracer("test"),
            properties);
    }

    private static DriftRunInput bucketInput(String observedEncryption) {
        return new DriftRunInput(
            List.of(RawResourceRecord.of(SourceDialect.TERRAFORM, "aws_s3_bucket", "logs", Map.of("encryption", "enabled"))),
            List.of(RawResourceRecord.of(SourceDialect.TERRAFORM, "aws_s3_bucket", "logs",
                Map.of("encryption", observedEncryption))));
    }

    @Test
    @DisplayName("a completed run is returned, recorded and counted")
    void completedRun() {
        DriftRunResult result = service.detect(bucketInput("disabled"));

        assertThat(result.runId()).isNotBlank();
        assertThat(result.report().summary().totalEntries()).isEqualTo(1);

        DriftRunSummary summary = service.getRun(result.runId());
        assertThat(summary.outcome()).isEqualTo(RunOutcome.COMPLETED);
        assertThat(summary.summary()).isEqualTo(result.report().summary());
        assertThat(summary.equivalenceTableVersion()).isEqualTo("2024.06");

        assertThat(meterRegistry.get(MetricsRegistry.RUNS_TOTAL).tag("outcome", "completed").counter().count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.get(MetricsRegistry.ENTRIES).tag("severity", "critical").counter().count())
            .isEqualTo(1.0);
        assertThat(MDC.get(LoggingConfig.MDC_RUN_ID)).isNull();
    }

    @Test
    @DisplayName("a failed run is kept in the history and rethrown")
    void failedRun() {
        RawResourceRecord db = RawResourceRecord.of(SourceDialect.GENERIC, "aws_db_instance", "db-1", Map.of());

        assertThatThrownBy(() -> service.detect(new DriftRunInput(List.of(db, db), List.of())))
            .isInstanceOf(AmbiguousAddressException.class);

        DriftRunSummary summary = service.getRecentRuns().get(0);
        assertThat(summary.outcome()).isEqualTo(RunOutcome.FAILED);
        assertThat(summary.errorCode()).isEqualTo(ErrorCode.AMBIGUOUS_ADDRESS.getCode());
        assertThat(summary.summary()).isNull();
        assertThat(meterRegistry.get(MetricsRegistry.RUNS_TOTAL).tag("outcome", "failed").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("a cancelled run is recorded as cancelled")
    void cancelledRun() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> service.detect(bucketInput("enabled"), token))
            .isInstanceOf(DriftRunCancelledException.class);

        assertThat(service.getRecentRuns()).singleElement()
            .extracting(DriftRunSummary::outcome).isEqualTo(RunOutcome.CANCELLED);
    }

    @Test
    @DisplayName("history is bounded and lists the newest run first")
    void boundedHistory() {
        String first = service.detect(bucketInput("enabled")).runId();
        String second = service.detect(bucketInput("enabled")).runId();
        String third = service.detect(bucketInput("disabled")).runId();

        assertThat(service.getRecentRuns()).extracting(DriftRunSummary::runId).containsExactly(third, second);
        assertThatThrownBy(() -> service.getRun(first))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining(first);
    }

    @Test
    @DisplayName("unanalyzable records are counted per origin")
    void unanalyzableCounted() {
        RawResourceRecord noKind = RawResourceRecord.of(SourceDialect.GENERIC, null, "x", Map.of());

        service.detect(new DriftRunInput(List.of(), List.of(noKind)));

        assertThat(meterRegistry.get(MetricsRegistry.NORMALIZATION_FAILURES).tag("origin", "observed").counter().count())
            .isEqualTo(1.0);
    }
}
