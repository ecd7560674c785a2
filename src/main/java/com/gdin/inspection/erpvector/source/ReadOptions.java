package com.gdin.inspection.erpvector.source;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReadOptions {
    Integer limit;
    @Builder.Default
    int offset = 0;
    @Builder.Default
    String order = "id asc";
}
