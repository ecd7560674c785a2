package com.gdin.inspection.erpvector.integrity.pipeline;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkflowFunctionOutput {
    Object result;
    /** 跳过后续阶段 */
    @Builder.Default
    boolean stop = false;

    public static WorkflowFunctionOutput of(Object result) {
        return WorkflowFunctionOutput.builder().result(result).build();
    }

    public static WorkflowFunctionOutput halt(Object result) {
        return WorkflowFunctionOutput.builder().result(result).stop(true).build();
    }
}
