package com.gdin.inspection.erpvector.integrity;

import lombok.Value;

import java.util.List;

@Value
public class DriftFlag {
    String sourceId;
    String fkField;
    DriftType type;
    List<String> pointerTargets;
    List<String> edgeTargets;
}
