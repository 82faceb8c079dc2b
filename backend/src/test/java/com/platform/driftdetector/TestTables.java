package com.platform.driftdetector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.driftdetector.classify.ClassificationRuleTable;
import com.platform.driftdetector.classify.ClassificationRuleTableLoader;
import com.platform.driftdetector.classify.Classifier;
import com.platform.driftdetector.diff.DiffEngine;
import com.platform.driftdetector.match.Matcher;
import com.platform.driftdetector.normalize.CloudFormationDialectResolver;
import com.platform.driftdetector.normalize.EquivalenceTable;
import com.platform.driftdetector.normalize.EquivalenceTableLoader;
import com.platform.driftdetector.normalize.GenericDialectResolver;
import com.platform.driftdetector.normalize.KubernetesDialectResolver;
import com.platform.driftdetector.normalize.Normalizer;
import com.platform.driftdetector.normalize.TerraformDialectResolver;
import com.platform.driftdetector.pipeline.DriftDetectionPipeline;
import com.platform.driftdetector.report.DriftReportBuilder;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Builds engine components over the bundled rule tables, or over inline YAML.
 */
public final class TestTables {
    
    private TestTables() {
    }
    
    public static EquivalenceTable defaultEquivalenceTable() {
        try (InputStream input = resource("/drift/equivalence-table.yaml")) {
            return new EquivalenceTableLoader().load(input, "equivalence-table.yaml");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
    
    public static ClassificationRuleTable defaultClassificationTable() {
        try (InputStream input = resource("/drift/classification-rules.yaml")) {
            return new ClassificationRuleTableLoader().load(input, "classification-rules.yaml");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
    
    public static EquivalenceTable equivalenceTable(String yaml) {
        return new EquivalenceTableLoader().load(stream(yaml), "inline");
    }
    
    public static ClassificationRuleTable classificationTable(String yaml) {
        return new ClassificationRuleTableLoader().load(stream(yaml), "inline");
    }
    
    public static Normalizer normalizer(EquivalenceTable table) {
        return new Normalizer(table, List.of(
            new TerraformDialectResolver(),
            new CloudFormationDialectResolver(),
            new KubernetesDialectResolver(),
            new GenericDialectResolver()
        ), new ObjectMapper());
    }
    
    public static DriftDetectionPipeline defaultPipeline() {
        return pipeline(defaultEquivalenceTable(), defaultClassificationTable(), null);
    }
    
    public static DriftDetectionPipeline pipeline(EquivalenceTable equivalence, ClassificationRuleTable classification,
            ExecutorService executor) {
        return new DriftDetectionPipeline(
            normalizer(equivalence),
            new Matcher(),
            new DiffEngine(equivalence, BigDecimal.ZERO),
            new Classifier(classification),
            new DriftReportBuilder(equivalence.getVersion(), classification.getVersion(), classification.getFramework()),
            executor
        );
    }
    
    public static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
    
    private static InputStream resource(String name) {
        InputStream input = TestTables.class.getResourceAsStream(name);
        if (input == null) {
            throw new IllegalStateException("Missing test resource " + name);
        }
        return input;
    }
}
