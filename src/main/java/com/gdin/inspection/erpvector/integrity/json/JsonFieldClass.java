package com.gdin.inspection.erpvector.integrity.json;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JsonFieldClass {
    FK("fk"),
    METADATA("metadata");

    private final String code;

    JsonFieldClass(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
