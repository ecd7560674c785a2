package com.gdin.inspection.erpvector.integrity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DriftType {
    /** graph edge 中有数据指针里没有的目标 */
    STALE_GRAPH("stale_graph"),
    /** 数据指针的目标在 graph edge 中缺失 */
    ORPHAN_FKS("orphan_fks"),
    BOTH("both");

    private final String code;

    DriftType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static DriftType of(boolean staleGraph, boolean orphanFks) {
        if (staleGraph && orphanFks) return BOTH;
        if (staleGraph) return STALE_GRAPH;
        if (orphanFks) return ORPHAN_FKS;
        return null;
    }
}
