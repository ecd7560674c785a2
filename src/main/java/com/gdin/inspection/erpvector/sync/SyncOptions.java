package com.gdin.inspection.erpvector.sync;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SyncOptions {
    /** 为空用配置默认值 */
    Integer batchSize;
    /** 只同步这些记录（修复孤儿时使用） */
    List<Long> specificIds;
    /** 基于 write_date 的增量同步 */
    boolean incremental;
    /** 同时刷新 graph edge 点位 */
    @Builder.Default
    boolean updateGraph = true;
    /** 最多同步条数，为空不限 */
    Integer maxRecords;
}
