package com.gdin.inspection.erpvector.query;

import com.gdin.inspection.erpvector.store.StorePoint;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ScrollResult {
    List<StorePoint> records;
    boolean hasMore;
    /** 下一次调用的游标：本次最后消费（不一定返回）的点位 ID */
    String nextCursor;
    long totalScanned;
    boolean incomplete;
}
