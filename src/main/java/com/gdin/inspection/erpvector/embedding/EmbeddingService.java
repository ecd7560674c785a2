package com.gdin.inspection.erpvector.embedding;

import java.util.List;

public interface EmbeddingService {

    List<Float> embed(String text, EmbeddingMode mode);

    /**
     * 结果顺序与输入一致
     */
    List<List<Float>> embedBatch(List<String> texts, EmbeddingMode mode);
}
