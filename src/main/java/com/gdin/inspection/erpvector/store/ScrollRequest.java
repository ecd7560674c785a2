package com.gdin.inspection.erpvector.store;

import com.gdin.inspection.erpvector.filter.NativeFilter;
import lombok.Builder;
import lombok.Value;

/**
 * 存储层分页读取。结果按点位 ID 升序，cursor 为上一页最后一个 ID（不含）。
 */
@Value
@Builder
public class ScrollRequest {
    @Builder.Default
    NativeFilter filter = NativeFilter.empty();
    @Builder.Default
    int limit = 1000;
    String cursor;
    @Builder.Default
    boolean withPayload = true;
    @Builder.Default
    boolean withVector = false;
}
