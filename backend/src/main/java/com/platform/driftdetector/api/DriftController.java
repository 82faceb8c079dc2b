package com.platform.driftdetector.api;

import com.platform.driftdetector.classify.ClassificationRuleTable;
import com.platform.driftdetector.error.ValidationException;
import com.platform.driftdetector.normalize.EquivalenceTable;
import com.platform.driftdetector.pipeline.DriftRunInput;
import com.platform.driftdetector.pipeline.DriftRunResult;
import com.platform.driftdetector.pipeline.DriftRunService;
import com.platform.driftdetector.pipeline.DriftRunSummary;
import com.platform.driftdetector.report.DriftReport;
import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.SourceDialect;
import com.platform.driftdetector.select.RecordSelector;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for drift detection runs and their history.
 */
@RestController
@RequestMapping("/api/drift")
public class DriftController {
    
    public static final String RUN_ID_HEADER = "X-Drift-Run-Id";
    
    private final DriftRunService driftRunService;
    private final RecordSelector recordSelector;
    private final ClassificationRuleTable classificationRuleTable;
    private final EquivalenceTable equivalenceTable;
    
    public DriftController(
            DriftRunService driftRunService,
            RecordSelector recordSelector,
            ClassificationRuleTable classificationRuleTable,
            EquivalenceTable equivalenceTable) {
        this.driftRunService = driftRunService;
        this.recordSelector = recordSelector;
        this.classificationRuleTable = classificationRuleTable;
        this.equivalenceTable = equivalenceTable;
    }
    
    @PostMapping("/reports")
    public ResponseEntity<DriftReport> createReport(@Valid @RequestBody DriftRunRequest request) {
        DriftRunResult result = driftRunService.detect(toInput(request));
        return ResponseEntity.ok()
            .header(RUN_ID_HEADER, result.runId())
            .body(result.report());
    }
    
    @GetMapping("/runs")
    public List<DriftRunSummary> getRuns() {
        return driftRunService.getRecentRuns();
    }
    
    @GetMapping("/runs/{runId}")
    public DriftRunSummary getRun(@PathVariable String runId) {
        return driftRunService.getRun(runId);
    }
    
    @GetMapping("/rules")
    public RuleTablesInfo getRules() {
        return new RuleTablesInfo(
            classificationRuleTable.getVersion(),
            classificationRuleTable.getFramework(),
            classificationRuleTable.getRules().size(),
            equivalenceTable.getVersion(),
            equivalenceTable.getRules().size()
        );
    }
    
    private DriftRunInput toInput(DriftRunRequest request) {
        if (request.getObservedDocument() == null) {
            if (request.getObservedJsonPath() != null) {
                throw ValidationException.missingField("observedDocument");
            }
            return new DriftRunInput(request.getDeclared(), request.getObserved());
        }
        
        if (request.getObserved() != null && !request.getObserved().isEmpty()) {
            throw ValidationException.invalidField("observed", request.getObserved().size() + " records",
                "cannot be combined with observedDocument");
        }
        SourceDialect dialect = request.getObservedDialect() != null
            ? request.getObservedDialect()
            : SourceDialect.GENERIC;
        List<RawResourceRecord> observed = recordSelector.select(
            request.getObservedDocument(), request.getObservedJsonPath(), dialect);
        return new DriftRunInput(request.getDeclared(), observed);
    }
}
