package com.platform.driftdetector.observability;

import com.platform.driftdetector.classify.Severity;
import com.platform.driftdetector.report.DriftReport;
import com.platform.driftdetector.report.ReportSummary;
import com.platform.driftdetector.resource.Origin;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for drift detection metrics.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    public static final String RUNS_TOTAL = "drift.runs.total";
    public static final String RESOURCES = "drift.resources";
    public static final String ENTRIES = "drift.entries";
    public static final String NORMALIZATION_FAILURES = "drift.normalization.failures";
    public static final String RUN_DURATION = "drift.run.duration";
    public static final String ERRORS = "drift.errors";
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
    }
    
    /**
     * Record a completed run and the sizes of its report sections.
     */
    public void recordRunCompleted(DriftReport report, long durationMs) {
        ReportSummary summary = report.summary();
        incrementCounter(RUNS_TOTAL, "outcome", "completed");
        
        incrementCounter(RESOURCES, summary.resourcesCompared(), "section", "compared");
        incrementCounter(RESOURCES, summary.driftedResources(), "section", "drifted");
        incrementCounter(RESOURCES, summary.orphans(), "section", "orphan");
        incrementCounter(RESOURCES, summary.unmanaged(), "section", "unmanaged");
        incrementCounter(RESOURCES, summary.unanalyzable(), "section", "unanalyzable");
        
        for (Map.Entry<Severity, Integer> entry : summary.severityCounts().entrySet()) {
            incrementCounter(ENTRIES, entry.getValue(), "severity", entry.getKey().name().toLowerCase());
        }
        
        recordDuration("completed", durationMs);
        log.debug("Recorded completed drift run: {} entries in {}ms", summary.totalEntries(), durationMs);
    }
    
    /**
     * Record a run that ended without a report.
     *
     * @param outcome {@code failed} or {@code cancelled}
     */
    public void recordRunAborted(String outcome, long durationMs) {
        incrementCounter(RUNS_TOTAL, "outcome", outcome);
        recordDuration(outcome, durationMs);
    }
    
    public void recordNormalizationFailure(Origin origin) {
        incrementCounter(NORMALIZATION_FAILURES, "origin", origin.name().toLowerCase());
    }
    
    /**
     * Record an error rendered by the API layer.
     */
    public void recordError(String errorCode) {
        incrementCounter(ERRORS, "code", errorCode);
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        incrementCounter(name, 1, tags);
    }
    
    /**
     * Increment a counter with tags by the given amount.
     */
    public void incrementCounter(String name, double amount, String... tags) {
        String key = name + ":" + String.join(".", tags);
        Counter counter = counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry));
        if (amount > 0) {
            counter.increment(amount);
        }
    }
    
    private void recordDuration(String outcome, long durationMs) {
        Timer timer = timers.computeIfAbsent(outcome, k ->
            Timer.builder(RUN_DURATION)
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        
        timer.record(Duration.ofMillis(durationMs));
    }
}
