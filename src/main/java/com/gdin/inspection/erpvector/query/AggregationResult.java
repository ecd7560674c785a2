package com.gdin.inspection.erpvector.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * truncated=true 时结果只覆盖已扫描的子集，只能当下界/部分结果使用。
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AggregationResult {
    /** alias -> 值（无分组时） */
    Map<String, Double> results;
    /** 有 groupBy 时按分组键排序 */
    List<GroupResult> groups;
    /** 计入聚合的记录数（残余过滤后、受上限约束） */
    long totalRecords;
    /** 从存储读出的记录数（残余过滤前） */
    long totalScanned;
    boolean truncated;
    /** 被取消或超时 */
    boolean incomplete;
    String stopReason;

    @Value
    public static class GroupResult {
        Map<String, Object> key;
        Map<String, Double> values;
        long count;
    }
}
