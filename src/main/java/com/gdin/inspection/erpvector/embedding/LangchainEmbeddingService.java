package com.gdin.inspection.erpvector.embedding;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.erpvector.exception.TransientIoException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 langchain4j EmbeddingModel。文档/查询模式通过前缀区分（如 bge、nomic 系列的指令前缀）。
 */
@Slf4j
public class LangchainEmbeddingService implements EmbeddingService {
    private final EmbeddingModel embeddingModel;
    private final String documentPrefix;
    private final String queryPrefix;
    private final int batchSize;

    public LangchainEmbeddingService(EmbeddingModel embeddingModel, String documentPrefix, String queryPrefix, int batchSize) {
        this.embeddingModel = embeddingModel;
        this.documentPrefix = documentPrefix == null ? "" : documentPrefix;
        this.queryPrefix = queryPrefix == null ? "" : queryPrefix;
        this.batchSize = Math.max(1, batchSize);
    }

    @Override
    public List<Float> embed(String text, EmbeddingMode mode) {
        try {
            return embeddingModel.embed(prefix(mode) + text).content().vectorAsList();
        } catch (RuntimeException e) {
            throw new TransientIoException("embedding failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<List<Float>> embedBatch(List<String> texts, EmbeddingMode mode) {
        if (CollectionUtil.isEmpty(texts)) return List.of();
        List<List<Float>> vectors = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i += batchSize) {
            List<TextSegment> segments = new ArrayList<>();
            for (String t : texts.subList(i, Math.min(i + batchSize, texts.size()))) {
                segments.add(TextSegment.from(prefix(mode) + t));
            }
            List<Embedding> embeddings;
            try {
                embeddings = embeddingModel.embedAll(segments).content();
            } catch (RuntimeException e) {
                throw new TransientIoException("embedding batch failed: " + e.getMessage(), e);
            }
            if (embeddings.size() != segments.size()) {
                throw new TransientIoException("embedding batch returned " + embeddings.size() + " vectors for " + segments.size() + " texts");
            }
            for (Embedding e : embeddings) vectors.add(e.vectorAsList());
        }
        return vectors;
    }

    private String prefix(EmbeddingMode mode) {
        return mode == EmbeddingMode.QUERY ? queryPrefix : documentPrefix;
    }
}
