package com.gdin.inspection.erpvector.integrity;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class FixOrphansResult {
    private long orphansBefore;
    private long orphansAfter;
    @Builder.Default
    private List<TargetSummary> targets = new ArrayList<>();
    /** 目标模型不在 schema 中的缺失目标 */
    @Builder.Default
    private List<String> skippedTargetIds = new ArrayList<>();
    private boolean incomplete;
    private ValidationRunReport after;

    @Data
    @Builder
    public static class TargetSummary {
        private String targetModel;
        private int missing;
        private int synced;
        private int failed;
        /** 超出单模型上限或被取消、超时打断，留待下次处理 */
        private int deferred;
    }
}
