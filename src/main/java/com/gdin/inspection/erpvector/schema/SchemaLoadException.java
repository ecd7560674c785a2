package com.gdin.inspection.erpvector.schema;

/**
 * schema 加载失败，属于配置级错误，整个运行终止。
 */
public class SchemaLoadException extends RuntimeException {
    public SchemaLoadException(String message) {
        super(message);
    }

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
