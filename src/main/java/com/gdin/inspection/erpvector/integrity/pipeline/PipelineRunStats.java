package com.gdin.inspection.erpvector.integrity.pipeline;

import lombok.Getter;
import lombok.Setter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Getter
public class PipelineRunStats {

    private final Map<String, Double> stepSeconds = new ConcurrentHashMap<>();

    @Setter
    private double totalSeconds;
}
