package com.gdin.inspection.erpvector.integrity;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class ValidationOptions {
    /** 为空时校验所有带外键字段的模型 */
    List<String> models;
    /** 用当前指针重建 graph edge 点位 */
    boolean fix;
    /** 比对数据点位指针和 graph edge */
    boolean bidirectional;
    /** 统计基数并写回 graph edge */
    boolean extractPatterns;
    /** 写入校验历史 */
    boolean trackHistory;
    /** 从 ERP 拉取缺失的目标记录 */
    boolean autoRepair;
    /** 每个模型最多返回的孤儿明细条数，计数不受限制 */
    Integer orphanLimit;
}
