package com.gdin.inspection.erpvector.integrity.pipeline;

/**
 * 流水线中的一个阶段。阶段之间通过 {@link PipelineRunContext} 传递中间结果。
 */
@FunctionalInterface
public interface WorkflowFunction<C> {
    WorkflowFunctionOutput run(C task, PipelineRunContext context) throws Exception;
}
