package com.gdin.inspection.erpvector.integrity;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class ModelIntegrityReport {
    private String model;
    private long recordsScanned;
    private long totalEdges;
    private long totalOrphans;
    private long structuralErrorCount;
    private long driftCount;
    @Builder.Default
    private List<FieldStats> fields = new ArrayList<>();
    /** 最多 orphanLimit 条 */
    @Builder.Default
    private List<OrphanRecord> orphans = new ArrayList<>();
    /** 明细与孤儿一样受 orphanLimit 限制 */
    @Builder.Default
    private List<StructuralError> structuralErrors = new ArrayList<>();
    @Builder.Default
    private List<DriftFlag> driftFlags = new ArrayList<>();
    @Builder.Default
    private List<CardinalityHint> cardinalityHints = new ArrayList<>();
    private long repaired;
    @Builder.Default
    private List<String> unrepairable = new ArrayList<>();
    /** 取消或超时未修复的缺失目标数 */
    private long repairDeferred;
    private long graphPointsRefreshed;
    private double integrityScore;
    private boolean incomplete;
    /** 该模型校验失败时的原因，其余字段为已完成部分 */
    private String error;
    private long durationMillis;

    public static double score(long edges, long orphans) {
        if (edges <= 0) return 100.0;
        return Math.round((edges - orphans) * 10000.0 / edges) / 100.0;
    }

    public boolean isFailed() {
        return error != null;
    }
}
