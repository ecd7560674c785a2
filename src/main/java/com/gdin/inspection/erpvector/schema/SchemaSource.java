package com.gdin.inspection.erpvector.schema;

import java.util.List;

/**
 * schema 数据来源。
 */
public interface SchemaSource {
    /**
     * 加载全部模型定义
     * @throws SchemaLoadException 无法读取或格式错误
     */
    List<ModelSchema> load();
}
