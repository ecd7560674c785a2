package com.gdin.inspection.erpvector.integrity;

import lombok.Data;

@Data
public class FieldStats {
    private String fkField;
    private String targetModel;
    private long edges;
    private long uniqueTargets;
    private long orphans;
    /** 目标模型不在 schema 中，无法修复 */
    private boolean targetModelMissing;

    public FieldStats(String fkField, String targetModel) {
        this.fkField = fkField;
        this.targetModel = targetModel;
    }
}
