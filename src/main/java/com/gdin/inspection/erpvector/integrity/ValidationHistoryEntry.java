package com.gdin.inspection.erpvector.integrity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 历史文件中的一行，对应一次校验。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ValidationHistoryEntry {
    private String runId;
    private String timestamp;
    private List<ModelHistory> models = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ModelHistory {
        private String model;
        private String timestamp;
        private long edges;
        private long orphans;
        private long drift;
        private long structuralErrors;
        private long repaired;
        private double integrityScore;
        /** 与该模型上一次记录的分数差，首次为空 */
        private Double deltaFromPrevious;
        private String error;
    }
}
