package com.gdin.inspection.erpvector.integrity;

import lombok.Builder;
import lombok.Value;

/**
 * 某个 (model, fk_field) 的观测基数。
 */
@Value
@Builder
public class CardinalityHint {
    String fkField;
    long edges;
    long uniqueTargets;
    double ratio;
    Cardinality cardinality;
    /** 单个源记录最多指向的目标数，大于 1 即 to-many */
    int maxTargetsPerSource;
    double avgTargetsPerSource;

    public boolean isToMany() {
        return maxTargetsPerSource > 1;
    }

    /** 写到 graph edge 上的提示值 */
    public String edgeHint() {
        return (isToMany() ? "to_many:" : "to_one:") + cardinality.code();
    }
}
