package com.gdin.inspection.erpvector.codec;

import lombok.Getter;

/**
 * 点位所属命名空间，code 即 ID 第一段的数值。
 */
@Getter
public enum PointNamespace {
    GRAPH_EDGE(1, "graph"),
    DATA_RECORD(2, "data"),
    SCHEMA_METADATA(3, "schema");

    private final int code;
    /** 写入 payload.point_type 的值 */
    private final String pointType;

    PointNamespace(int code, String pointType) {
        this.code = code;
        this.pointType = pointType;
    }

    public static PointNamespace fromCode(int code) {
        for (PointNamespace ns : values()) {
            if (ns.code == code) return ns;
        }
        return null;
    }

    public static PointNamespace fromPointType(String pointType) {
        for (PointNamespace ns : values()) {
            if (ns.pointType.equals(pointType)) return ns;
        }
        return null;
    }
}
