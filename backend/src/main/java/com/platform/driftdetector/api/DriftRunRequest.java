package com.platform.driftdetector.api;

import com.platform.driftdetector.resource.RawResourceRecord;
import com.platform.driftdetector.resource.SourceDialect;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/drift/reports}.
 * 
 * The observed side is either a record list ({@code observed}) or a whole state document with a
 * JSONPath expression selecting its records ({@code observedDocument} + {@code observedJsonPath}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftRunRequest {
    
    @NotNull(message = "declared records are required, use an empty list for none")
    private List<RawResourceRecord> declared;
    
    private List<RawResourceRecord> observed;
    
    private Map<String, Object> observedDocument;
    
    private String observedJsonPath;
    
    /**
     * Dialect of the records selected from {@code observedDocument}.
     */
    private SourceDialect observedDialect;
}
