package com.platform.driftdetector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.driftdetector.classify.ClassificationRuleTable;
import com.platform.driftdetector.classify.ClassificationRuleTableLoader;
import com.platform.driftdetector.classify.Classifier;
import com.platform.driftdetector.diff.DiffEngine;
import com.platform.driftdetector.error.ClassificationRuleException;
import com.platform.driftdetector.error.EquivalenceRuleException;
import com.platform.driftdetector.match.Matcher;
import com.platform.driftdetector.normalize.DialectResolver;
import com.platform.driftdetector.normalize.EquivalenceTable;
import com.platform.driftdetector.normalize.EquivalenceTableLoader;
import com.platform.driftdetector.normalize.Normalizer;
import com.platform.driftdetector.observability.StructuredLogger;
import com.platform.driftdetector.pipeline.DriftDetectionPipeline;
import com.platform.driftdetector.report.DriftReportBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the drift detection core. Both rule tables are loaded once at startup; a malformed
 * table fails the application context.
 */
@Slf4j
@Configuration
public class DriftEngineConfig {
    
    private final DriftProperties properties;
    private final ResourceLoader resourceLoader;
    private final StructuredLogger structuredLogger;
    
    public DriftEngineConfig(DriftProperties properties, ResourceLoader resourceLoader,
            StructuredLogger structuredLogger) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.structuredLogger = structuredLogger;
    }
    
    @Bean
    public EquivalenceTable equivalenceTable() {
        String location = properties.getEquivalenceTable();
        EquivalenceTable table;
        try (InputStream input = open(location)) {
            table = new EquivalenceTableLoader().load(input, location);
        } catch (IOException e) {
            throw new EquivalenceRuleException("Cannot read equivalence table " + location + ": " + e.getMessage(), e);
        }
        structuredLogger.tables().tableLoaded("equivalence", location, table.getVersion(), table.getRules().size());
        return table;
    }
    
    @Bean
    public ClassificationRuleTable classificationRuleTable() {
        String location = properties.getClassificationTable();
        ClassificationRuleTable table;
        try (InputStream input = open(location)) {
            table = new ClassificationRuleTableLoader().load(input, location);
        } catch (IOException e) {
            throw new ClassificationRuleException("Cannot read classification table " + location + ": " + e.getMessage(), e);
        }
        structuredLogger.tables().tableLoaded("classification", location, table.getVersion(), table.getRules().size());
        return table;
    }
    
    @Bean
    public Normalizer normalizer(EquivalenceTable equivalenceTable, List<DialectResolver> resolvers,
            ObjectMapper objectMapper) {
        return new Normalizer(equivalenceTable, resolvers, objectMapper);
    }
    
    @Bean
    public Matcher matcher() {
        return new Matcher();
    }
    
    @Bean
    public DiffEngine diffEngine(EquivalenceTable equivalenceTable) {
        BigDecimal tolerance = properties.getDiff().getDefaultNumericTolerance();
        return new DiffEngine(equivalenceTable, tolerance != null ? tolerance : BigDecimal.ZERO);
    }
    
    @Bean
    public Classifier classifier(ClassificationRuleTable classificationRuleTable) {
        return new Classifier(classificationRuleTable);
    }
    
    @Bean
    public DriftReportBuilder driftReportBuilder(EquivalenceTable equivalenceTable,
            ClassificationRuleTable classificationRuleTable) {
        return new DriftReportBuilder(
            equivalenceTable.getVersion(),
            classificationRuleTable.getVersion(),
            classificationRuleTable.getFramework());
    }
    
    /**
     * Worker pool for parallel runs. Threads are only started once a task is submitted.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService driftWorkerPool() {
        int threads = Math.max(1, properties.getPipeline().getParallelism());
        return Executors.newFixedThreadPool(threads, new DriftWorkerThreadFactory());
    }
    
    @Bean
    public DriftDetectionPipeline driftDetectionPipeline(Normalizer normalizer, Matcher matcher,
            DiffEngine diffEngine, Classifier classifier, DriftReportBuilder driftReportBuilder,
            ExecutorService driftWorkerPool) {
        int parallelism = properties.getPipeline().getParallelism();
        log.info("Drift pipeline configured with parallelism {}", parallelism);
        return new DriftDetectionPipeline(normalizer, matcher, diffEngine, classifier, driftReportBuilder,
            parallelism > 1 ? driftWorkerPool : null);
    }
    
    private InputStream open(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IOException("resource not found");
        }
        return resource.getInputStream();
    }
    
    private static class DriftWorkerThreadFactory implements ThreadFactory {
        
        private final AtomicInteger counter = new AtomicInteger();
        
        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "drift-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
