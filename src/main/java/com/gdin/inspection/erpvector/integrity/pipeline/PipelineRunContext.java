package com.gdin.inspection.erpvector.integrity.pipeline;

import com.gdin.inspection.erpvector.query.OperationControl;
import lombok.Getter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Getter
public class PipelineRunContext {

    private final PipelineRunStats stats = new PipelineRunStats();
    private final Map<String, Object> state = new ConcurrentHashMap<>();
    private final OperationControl control;

    public PipelineRunContext(OperationControl control) {
        this.control = control == null ? OperationControl.unbounded() : control;
    }

    public void put(String key, Object value) {
        state.put(key, value);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T) state.get(key);
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrDefault(String key, T defaultValue) {
        Object value = state.get(key);
        return value == null ? defaultValue : (T) value;
    }
}
