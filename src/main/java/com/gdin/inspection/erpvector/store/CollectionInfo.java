package com.gdin.inspection.erpvector.store;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CollectionInfo {
    String name;
    long pointCount;
    Integer vectorDimension;
    List<String> indexedFields;
    boolean dynamicFieldEnabled;
}
