package com.gdin.inspection.erpvector.embedding;

public enum EmbeddingMode {
    /** 入库文档 */
    DOCUMENT,
    /** 检索查询 */
    QUERY
}
