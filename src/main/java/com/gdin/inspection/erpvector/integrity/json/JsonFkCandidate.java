package com.gdin.inspection.erpvector.integrity.json;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * JSON 字段是否承载外键的判定结果。
 */
@Value
@Builder
public class JsonFkCandidate {
    String sourceModel;
    String fieldName;
    /** 0.0 - 1.0 */
    double confidence;
    JsonFieldClass classification;
    /** naming / data_sampling / both */
    String detectionMethod;
    String likelyTargetModel;
    List<String> reasons;

    public boolean isFk() {
        return classification == JsonFieldClass.FK;
    }
}
