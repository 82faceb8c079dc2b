package com.platform.driftdetector.pipeline;

import com.platform.driftdetector.classify.ClassifiedEntry;
import com.platform.driftdetector.classify.Classifier;
import com.platform.driftdetector.diff.DiffEngine;
import com.platform.driftdetector.diff.DiffEntry;
import com.platform.driftdetector.error.DriftRunCancelledException;
import com.platform.driftdetector.error.NormalizationException;
import com.platform.driftdetector.match.MatchResult;
import com.platform.driftdetector.match.MatchedPair;
import com.platform.driftdetector.match.Matcher;
import com.platform.driftdetector.normalize.Normalizer;
import com.platform.driftdetector.report.DriftReport;
import com.platform.driftdetector.report.DriftReportBuilder;
import com.platform.driftdetector.report.ResourceDrift;
import com.platform.driftdetector.report.UnanalyzableRecord;
import com.platform.driftdetector.resource.Origin;
import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.ResourceModel;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.IntFunction;

/**
 * Runs normalize, match, diff, classify and report over one pair of raw record sets.
 *
 * <p>With an executor, normalization and per-pair diffing fan out one task per resource. Results
 * are collected in input order and the report builder sorts every section, so the report is the
 * same whether or not an executor is used.
 */
@Slf4j
public class DriftDetectionPipeline {
    
    static final String STAGE_NORMALIZE = "normalize";
    static final String STAGE_DIFF = "diff";
    
    private final Normalizer normalizer;
    private final Matcher matcher;
    private final DiffEngine diffEngine;
    private final Classifier classifier;
    private final DriftReportBuilder reportBuilder;
    private final ExecutorService executor;
    
    public DriftDetectionPipeline(Normalizer normalizer, Matcher matcher, DiffEngine diffEngine,
            Classifier classifier, DriftReportBuilder reportBuilder) {
        this(normalizer, matcher, diffEngine, classifier, reportBuilder, null);
    }
    
    /**
     * @param executor worker pool for per-resource tasks, or {@code null} to run on the caller's thread
     */
    public DriftDetectionPipeline(Normalizer normalizer, Matcher matcher, DiffEngine diffEngine,
            Classifier classifier, DriftReportBuilder reportBuilder, ExecutorService executor) {
        this.normalizer = normalizer;
        this.matcher = matcher;
        this.diffEngine = diffEngine;
        this.classifier = classifier;
        this.reportBuilder = reportBuilder;
        this.executor = executor;
    }
    
    public DriftReport run(DriftRunInput input) {
        return run(input, Cancellation.NONE);
    }
    
    /**
     * @throws com.platform.driftdetector.error.AmbiguousAddressException if an address repeats within one side
     * @throws DriftRunCancelledException if {@code cancellation} trips between two resources
     */
    public DriftReport run(DriftRunInput input, Cancellation cancellation) {
        List<UnanalyzableRecord> unanalyzable = new ArrayList<>();
        
        List<ResourceModel> declared = normalizeAll(input.declared(), Origin.DECLARED, cancellation, unanalyzable);
        List<ResourceModel> observed = normalizeAll(input.observed(), Origin.OBSERVED, cancellation, unanalyzable);
        log.debug("Normalized {} declared and {} observed resources, {} unanalyzable",
            declared.size(), observed.size(), unanalyzable.size());
        
        MatchResult match = matcher.match(declared, observed);
        
        List<MatchedPair> pairs = match.pairs();
        List<ResourceDrift> drifts = process(pairs.size(), STAGE_DIFF, cancellation,
            i -> compare(pairs.get(i)));
        
        return reportBuilder.build(drifts, match.orphans(), match.unmanaged(), unanalyzable);
    }
    
    private List<ResourceModel> normalizeAll(List<RawResourceRecord> records, Origin origin,
            Cancellation cancellation, List<UnanalyzableRecord> unanalyzable) {
        
        List<Normalized> results = process(records.size(), STAGE_NORMALIZE, cancellation,
            i -> normalizeOne(records.get(i), origin, i));
        
        List<ResourceModel> models = new ArrayList<>(results.size());
        for (Normalized result : results) {
            if (result.model() != null) {
                models.add(result.model());
            } else {
                unanalyzable.add(result.rejected());
            }
        }
        return models;
    }
    
    private Normalized normalizeOne(RawResourceRecord raw, Origin origin, int position) {
        try {
            return new Normalized(normalizer.normalize(raw, origin), null);
        } catch (NormalizationException e) {
            log.warn("Unanalyzable {} record #{}: {}", origin, position, e.getMessage());
            return new Normalized(null, UnanalyzableRecord.of(origin, position, raw, e));
        }
    }
    
    private ResourceDrift compare(MatchedPair pair) {
        List<DiffEntry> entries = diffEngine.diff(pair.declared(), pair.observed());
        List<ClassifiedEntry> classified = classifier.classifyAll(pair.declared().kind(), entries);
        return new ResourceDrift(pair.address(), pair.declared().kind(), classified);
    }
    
    /**
     * Apply {@code task} to every index in {@code [0, count)}, returning results in index order.
     */
    private <R> List<R> process(int count, String stage, Cancellation cancellation, IntFunction<R> task) {
        if (executor == null) {
            List<R> results = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                cancellation.throwIfCancelled(stage, i);
                results.add(task.apply(i));
            }
            return results;
        }
        
        Map<String, String> context = MDC.getCopyOfContextMap();
        List<Future<R>> futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int index = i;
            futures.add(executor.submit(() -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                setContext(context);
                try {
                    cancellation.throwIfCancelled(stage, index);
                    return task.apply(index);
                } finally {
                    setContext(previous);
                }
            }));
        }
        
        List<R> results = new ArrayList<>(count);
        try {
            for (Future<R> future : futures) {
                results.add(await(future, stage, results.size()));
            }
            return results;
        } finally {
            if (results.size() < count) {
                futures.forEach(f -> f.cancel(true));
            }
        }
    }
    
    private static void setContext(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }
    
    private static <R> R await(Future<R> future, String stage, int processed) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriftRunCancelledException(stage, processed);
        } catch (CancellationException e) {
            throw new DriftRunCancelledException(stage, processed);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Drift task failed during " + stage, cause);
        }
    }
    
    private record Normalized(ResourceModel model, UnanalyzableRecord rejected) {
    }
}
