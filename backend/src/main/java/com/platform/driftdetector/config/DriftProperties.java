package com.platform.driftdetector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Configuration properties for the drift detection engine.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "drift")
public class DriftProperties {
    
    /**
     * Location of the equivalence table (YAML or JSON).
     */
    private String equivalenceTable = "classpath:drift/equivalence-table.yaml";
    
    /**
     * Location of the classification rule table (YAML or JSON).
     */
    private String classificationTable = "classpath:drift/classification-rules.yaml";
    
    private Diff diff = new Diff();
    
    private Pipeline pipeline = new Pipeline();
    
    private History history = new History();
    
    @Data
    public static class Diff {
        /**
         * Tolerance for computed numeric attributes whose rule declares none.
         */
        private BigDecimal defaultNumericTolerance = BigDecimal.ZERO;
    }
    
    @Data
    public static class Pipeline {
        /**
         * Worker threads for per-resource normalization and diffing; 1 runs on the caller's thread.
         */
        private int parallelism = 1;
    }
    
    @Data
    public static class History {
        /**
         * Number of run summaries kept in memory.
         */
        private int maxEntries = 100;
    }
}
