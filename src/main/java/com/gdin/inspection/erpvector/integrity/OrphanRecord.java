package com.gdin.inspection.erpvector.integrity;

import lombok.Builder;
import lombok.Value;

/**
 * 指针能解码，但目标点位不存在。
 */
@Value
@Builder
public class OrphanRecord {
    String sourceModel;
    String sourceId;
    Long sourceRecordId;
    String fkField;
    String targetId;
    String targetModel;
    Long targetRecordId;
}
