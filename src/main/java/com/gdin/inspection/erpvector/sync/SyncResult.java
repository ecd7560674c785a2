package com.gdin.inspection.erpvector.sync;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SyncResult {
    String model;
    long fetched;
    long uploaded;
    long failed;
    long edgePoints;
    /** 数据已写入但 graph 点位写入失败的条数 */
    long failedEdgePoints;
    int batches;
    int failedBatches;
    boolean incomplete;
    long durationMillis;
    List<String> errors;
}
