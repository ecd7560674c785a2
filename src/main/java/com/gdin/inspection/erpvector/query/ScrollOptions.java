package com.gdin.inspection.erpvector.query;

import com.gdin.inspection.erpvector.filter.ResidualPredicate;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ScrollOptions {
    @Builder.Default
    int limit = 50;
    @Builder.Default
    List<ResidualPredicate> residual = List.of();
    /** 上一页返回的 nextCursor */
    String cursor;
    /**
     * 单次调用最多从存储读取的记录数。残余过滤很稀疏时到达上限就先返回，
     * hasMore=true，下次从 nextCursor 继续。
     */
    @Builder.Default
    int maxScan = 50_000;
    @Builder.Default
    boolean withVector = false;
}
