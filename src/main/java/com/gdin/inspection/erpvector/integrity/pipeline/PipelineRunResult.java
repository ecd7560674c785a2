package com.gdin.inspection.erpvector.integrity.pipeline;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PipelineRunResult {
    String step;
    Object result;
    List<Exception> errors;

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
