package com.gdin.inspection.erpvector.integrity;

import lombok.Value;

/**
 * 指针本身无法解码或指向了错误的命名空间。与孤儿分开统计。
 */
@Value
public class StructuralError {
    String sourceId;
    String fkField;
    String rawTarget;
    String message;
}
