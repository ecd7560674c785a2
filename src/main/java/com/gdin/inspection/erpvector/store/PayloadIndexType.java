package com.gdin.inspection.erpvector.store;

public enum PayloadIndexType {
    KEYWORD, INTEGER, FLOAT, DATETIME, TEXT, BOOL
}
