package com.gdin.inspection.erpvector.integrity.pipeline;

import lombok.Value;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 按添加顺序执行的阶段列表。
 */
public class Pipeline<C> implements Iterable<Pipeline.Step<C>> {

    @Value
    public static class Step<C> {
        String name;
        WorkflowFunction<C> fn;
        /** 阶段被取消/超时打断时仍然执行（用于汇总报告） */
        boolean always;
    }

    private final List<Step<C>> steps = new ArrayList<>();

    public Pipeline<C> add(String name, WorkflowFunction<C> fn) {
        steps.add(new Step<>(name, fn, false));
        return this;
    }

    public Pipeline<C> addFinally(String name, WorkflowFunction<C> fn) {
        steps.add(new Step<>(name, fn, true));
        return this;
    }

    public List<String> stepNames() {
        List<String> names = new ArrayList<>(steps.size());
        for (Step<C> step : steps) names.add(step.getName());
        return names;
    }

    @Override
    public Iterator<Step<C>> iterator() {
        return steps.iterator();
    }
}
