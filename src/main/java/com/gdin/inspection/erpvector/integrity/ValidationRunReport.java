package com.gdin.inspection.erpvector.integrity;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class ValidationRunReport {
    private String runId;
    private String timestamp;
    private ValidationOptions options;
    @Builder.Default
    private List<ModelIntegrityReport> models = new ArrayList<>();
    private long totalOrphans;
    private long totalRepaired;
    private long totalStructuralErrors;
    private long totalDriftFlags;
    private int failedModels;
    private boolean incomplete;
    private long durationMillis;

    public void summarize() {
        totalOrphans = 0;
        totalRepaired = 0;
        totalStructuralErrors = 0;
        totalDriftFlags = 0;
        failedModels = 0;
        for (ModelIntegrityReport m : models) {
            totalOrphans += m.getTotalOrphans();
            totalRepaired += m.getRepaired();
            totalStructuralErrors += m.getStructuralErrorCount();
            totalDriftFlags += m.getDriftCount();
            if (m.isFailed()) failedModels++;
            if (m.isIncomplete()) incomplete = true;
        }
    }

    public ModelIntegrityReport model(String name) {
        for (ModelIntegrityReport m : models) {
            if (m.getModel().equals(name)) return m;
        }
        return null;
    }
}
