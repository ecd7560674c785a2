package com.gdin.inspection.erpvector.filter;

import lombok.Value;

import java.util.List;

@Value
public class CompiledFilter {
    String model;
    NativeFilter nativeFilter;
    List<ResidualPredicate> residual;

    public boolean hasResidual() {
        return !residual.isEmpty();
    }
}
