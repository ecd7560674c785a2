package com.gdin.inspection.erpvector.config;

import com.gdin.inspection.erpvector.config.properties.MilvusProperties;
import com.gdin.inspection.erpvector.config.properties.StoreProperties;
import com.gdin.inspection.erpvector.store.InMemoryVectorStore;
import com.gdin.inspection.erpvector.store.MilvusVectorStore;
import com.gdin.inspection.erpvector.store.PayloadIndexType;
import com.gdin.inspection.erpvector.store.VectorStore;
import io.milvus.v2.client.MilvusClientV2;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.Map;

/**
 * 向量库：milvus 或 memory（本地调试用）。启动时建 collection 并创建配置的 payload 索引。
 */
@Slf4j
@Configuration
public class StoreConfig {
    @Resource
    private StoreProperties storeProperties;
    @Resource
    private MilvusProperties milvusProperties;

    @Bean
    public VectorStore vectorStore(ObjectProvider<MilvusClientV2> milvusClient) {
        VectorStore store;
        if ("memory".equalsIgnoreCase(storeProperties.getType())) {
            store = new InMemoryVectorStore(milvusProperties.getCollectionName());
        } else {
            MilvusVectorStore milvusStore = new MilvusVectorStore(milvusClient.getObject(),
                    milvusProperties.getCollectionName(), milvusProperties.getDimension());
            milvusStore.ensureCollection();
            store = milvusStore;
        }
        for (Map.Entry<String, String> e : storeProperties.getIndexedFields().entrySet()) {
            store.createPayloadIndex(e.getKey(), PayloadIndexType.valueOf(e.getValue().toUpperCase(Locale.ROOT)));
        }
        log.info("vector store {} ready, {} payload index(es)", storeProperties.getType(), storeProperties.getIndexedFields().size());
        return store;
    }
}
