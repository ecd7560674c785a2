package com.gdin.inspection.erpvector.store;

import lombok.Value;

import java.util.List;

@Value
public class ScrollPage {
    List<StorePoint> points;
    /** 为空表示没有下一页 */
    String nextCursor;

    public boolean hasMore() {
        return nextCursor != null;
    }
}
