package com.gdin.inspection.erpvector.integrity.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 顺序执行各阶段。阶段抛出的异常记录在结果里，不向外抛；
 * 取消或超时后只执行 always 阶段。
 */
@Slf4j
public class RunPipeline<C> {

    public List<PipelineRunResult> run(Pipeline<C> pipeline, C task, PipelineRunContext context) {
        long start = System.nanoTime();
        List<PipelineRunResult> results = new ArrayList<>();
        boolean halted = false;

        for (Pipeline.Step<C> step : pipeline) {
            String name = step.getName();
            if (halted && !step.isAlways()) continue;
            if (!halted && !step.isAlways() && context.getControl().shouldStop()) {
                log.warn("pipeline stopped before step {}: {}", name, context.getControl().stopReason());
                halted = true;
                continue;
            }

            long t0 = System.nanoTime();
            try {
                WorkflowFunctionOutput out = step.getFn().run(task, context);
                results.add(PipelineRunResult.builder()
                        .step(name)
                        .result(out == null ? null : out.getResult())
                        .build());
                if (out != null && out.isStop()) {
                    log.debug("pipeline halted by step {}", name);
                    halted = true;
                }
            } catch (Exception e) {
                log.error("error running step {}", name, e);
                results.add(PipelineRunResult.builder()
                        .step(name)
                        .errors(List.of(e))
                        .build());
                halted = true;
            } finally {
                context.getStats().getStepSeconds().put(name, (System.nanoTime() - t0) / 1_000_000_000.0);
            }
        }

        context.getStats().setTotalSeconds((System.nanoTime() - start) / 1_000_000_000.0);
        return results;
    }
}
