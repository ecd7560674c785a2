package com.gdin.inspection.erpvector.codec;

import lombok.Value;

/**
 * 解码后的点位身份三元组。
 */
@Value
public class PointAddress {
    PointNamespace namespace;
    int modelId;
    long recordId;
    /** 是否来自旧版两段式 ID */
    boolean legacy;

    public static PointAddress of(PointNamespace namespace, int modelId, long recordId) {
        return new PointAddress(namespace, modelId, recordId, false);
    }

    /** 同一身份（忽略 legacy 标记） */
    public boolean sameIdentity(PointAddress other) {
        return other != null
                && namespace == other.namespace
                && modelId == other.modelId
                && recordId == other.recordId;
    }
}
