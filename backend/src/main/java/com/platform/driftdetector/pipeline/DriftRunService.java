package com.platform.driftdetector.pipeline;

import com.platform.driftdetector.config.DriftProperties;
import com.platform.driftdetector.error.DriftDetectorException;
import com.platform.driftdetector.error.DriftRunCancelledException;
import com.platform.driftdetector.error.ErrorCode;
import com.platform.driftdetector.error.ResourceNotFoundException;
import com.platform.driftdetector.observability.LoggingConfig;
import com.platform.driftdetector.observability.MetricsRegistry;
import com.platform.driftdetector.observability.StructuredLogger;
import com.platform.driftdetector.report.DriftReport;
import com.platform.driftdetector.report.UnanalyzableRecord;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Runs the drift detection pipeline with run-scoped logging, metrics and tracing, and keeps a
 * bounded history of run summaries.
 */
@Slf4j
@Service
public class DriftRunService {
    
    private final DriftDetectionPipeline pipeline;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Tracer tracer;
    private final int maxHistory;
    
    private final List<DriftRunSummary> history = new ArrayList<>();
    
    public DriftRunService(
            DriftDetectionPipeline pipeline,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            Tracer tracer,
            DriftProperties properties) {
        this.pipeline = pipeline;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.tracer = tracer;
        this.maxHistory = Math.max(1, properties.getHistory().getMaxEntries());
    }
    
    public DriftRunResult detect(DriftRunInput input) {
        return detect(input, Cancellation.NONE);
    }
    
    /**
     * Run one drift detection. Recoverable per-record problems end up in the report; everything
     * else is recorded in the history and rethrown.
     */
    public DriftRunResult detect(DriftRunInput input, Cancellation cancellation) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        
        MDC.put(LoggingConfig.MDC_RUN_ID, runId);
        Span span = tracer.spanBuilder("drift.run")
            .setAttribute("drift.run_id", runId)
            .setAttribute("drift.declared_records", input.declared().size())
            .setAttribute("drift.observed_records", input.observed().size())
            .startSpan();
        
        try (Scope scope = span.makeCurrent()) {
            structuredLogger.drift().runStarted(input.declared().size(), input.observed().size());
            
            DriftReport report = pipeline.run(input, cancellation);
            long durationMs = elapsedMs(start);
            
            for (UnanalyzableRecord record : report.unanalyzable()) {
                metricsRegistry.recordNormalizationFailure(record.origin());
                structuredLogger.drift().unanalyzableRecord(record);
            }
            metricsRegistry.recordRunCompleted(report, durationMs);
            structuredLogger.drift().runCompleted(report.summary(), durationMs);
            addToHistory(DriftRunSummary.completed(runId, startedAt, durationMs, report));
            
            span.setAttribute("drift.total_entries", report.summary().totalEntries());
            span.setStatus(StatusCode.OK);
            log.info("Drift run {} completed: {} drifted, {} orphans, {} unmanaged in {}ms",
                runId, report.summary().driftedResources(), report.summary().orphans(),
                report.summary().unmanaged(), durationMs);
            return new DriftRunResult(runId, report);
            
        } catch (DriftRunCancelledException e) {
            long durationMs = elapsedMs(start);
            metricsRegistry.recordRunAborted("cancelled", durationMs);
            structuredLogger.drift().runCancelled(e.getMessage(), durationMs);
            addToHistory(DriftRunSummary.aborted(runId, startedAt, durationMs, RunOutcome.CANCELLED, e));
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
            
        } catch (DriftDetectorException e) {
            recordFailure(runId, startedAt, start, span, e.getErrorCode(), e);
            throw e;
            
        } catch (RuntimeException e) {
            recordFailure(runId, startedAt, start, span, ErrorCode.RUN_FAILED, e);
            throw e;
            
        } finally {
            span.end();
            MDC.remove(LoggingConfig.MDC_RUN_ID);
        }
    }
    
    private void recordFailure(String runId, Instant startedAt, long start, Span span, ErrorCode code,
            RuntimeException e) {
        long durationMs = elapsedMs(start);
        metricsRegistry.recordRunAborted("failed", durationMs);
        structuredLogger.drift().runFailed(code.getCode(), e.getMessage(), durationMs);
        addToHistory(DriftRunSummary.aborted(runId, startedAt, durationMs, RunOutcome.FAILED,
            code.getCode(), e.getMessage()));
        span.setStatus(StatusCode.ERROR, e.getMessage());
        span.recordException(e);
    }
    
    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
    
    private synchronized void addToHistory(DriftRunSummary summary) {
        history.add(summary);
        
        if (history.size() > maxHistory) {
            history.remove(0);
        }
    }
    
    /**
     * Recent runs, newest first.
     */
    public synchronized List<DriftRunSummary> getRecentRuns() {
        List<DriftRunSummary> runs = new ArrayList<>(history);
        Collections.reverse(runs);
        return runs;
    }
    
    /**
     * @throws ResourceNotFoundException if the run is unknown or has left the history
     */
    public synchronized DriftRunSummary getRun(String runId) {
        return history.stream()
            .filter(run -> run.runId().equals(runId))
            .findFirst()
            .orElseThrow(() -> ResourceNotFoundException.run(runId));
    }
}
