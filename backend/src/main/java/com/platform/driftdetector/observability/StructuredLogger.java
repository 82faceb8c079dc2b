package com.platform.driftdetector.observability;

import com.platform.driftdetector.report.ReportSummary;
import com.platform.driftdetector.report.UnanalyzableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logger for drift detection events.
 * 
 * All events are JSON-formatted and machine-parsable.
 */
@Component
public class StructuredLogger {
    
    @Value("${spring.application.name:iac-drift-detector}")
    private String serviceName;
    
    @Value("${drift.environment:development}")
    private String environment;
    
    /**
     * Get drift run event logger.
     */
    public DriftLogger drift() {
        return new DriftLogger(serviceName, environment);
    }
    
    /**
     * Get rule table event logger.
     */
    public TableLogger tables() {
        return new TableLogger(serviceName, environment);
    }
    
    // ==================== DRIFT LOGGER ====================
    
    public static class DriftLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.drift");
        private final String service;
        private final String environment;
        
        DriftLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void runStarted(int declaredRecords, int observedRecords) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DRIFT_RUN_STARTED, "INFO")
                .context(Map.of("declared_records", declaredRecords, "observed_records", observedRecords))
                .build();
            log.info(event.toJson());
        }
        
        public void runCompleted(ReportSummary summary, long durationMs) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("resources_compared", summary.resourcesCompared());
            context.put("drifted_resources", summary.driftedResources());
            context.put("orphans", summary.orphans());
            context.put("unmanaged", summary.unmanaged());
            context.put("unanalyzable", summary.unanalyzable());
            context.put("total_entries", summary.totalEntries());
            if (summary.highestSeverity() != null) {
                context.put("highest_severity", summary.highestSeverity().name());
            }
            
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DRIFT_RUN_COMPLETED, "INFO")
                .success(true)
                .durationMs(durationMs)
                .context(context)
                .build();
            log.info(event.toJson());
        }
        
        public void runFailed(String errorCode, String errorMessage, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DRIFT_RUN_FAILED, "ERROR")
                .success(false)
                .durationMs(durationMs)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
            log.error(event.toJson());
        }
        
        public void runCancelled(String message, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.DRIFT_RUN_CANCELLED, "WARN")
                .success(false)
                .durationMs(durationMs)
                .message(message)
                .build();
            log.warn(event.toJson());
        }
        
        public void unanalyzableRecord(UnanalyzableRecord record) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RECORD_UNANALYZABLE, "WARN")
                .origin(record.origin().name())
                .resourceKind(record.kindHint())
                .resourceAddress(record.addressHint())
                .errorCode(record.errorCode())
                .errorMessage(record.reason())
                .context(Map.of("position", record.position()))
                .build();
            log.warn(event.toJson());
        }
    }
    
    // ==================== TABLE LOGGER ====================
    
    public static class TableLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.tables");
        private final String service;
        private final String environment;
        
        TableLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void tableLoaded(String table, String location, String version, int ruleCount) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RULE_TABLE_LOADED, "INFO")
                .message(table)
                .tableVersion(version)
                .context(Map.of("location", location, "rule_count", ruleCount))
                .build();
            log.info(event.toJson());
        }
    }
}
