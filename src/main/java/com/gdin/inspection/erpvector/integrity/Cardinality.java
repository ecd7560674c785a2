package com.gdin.inspection.erpvector.integrity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Cardinality {
    ONE_TO_ONE("one_to_one"),
    ONE_TO_FEW("one_to_few"),
    ONE_TO_MANY("one_to_many");

    public static final double ONE_TO_ONE_RATIO = 0.95;
    public static final double ONE_TO_FEW_RATIO = 0.2;

    private final String code;

    Cardinality(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * @param ratio 去重后的目标数 / 边数
     */
    public static Cardinality classify(double ratio) {
        if (ratio >= ONE_TO_ONE_RATIO) return ONE_TO_ONE;
        if (ratio >= ONE_TO_FEW_RATIO) return ONE_TO_FEW;
        return ONE_TO_MANY;
    }
}
