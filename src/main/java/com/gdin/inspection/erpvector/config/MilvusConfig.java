package com.gdin.inspection.erpvector.config;

import com.gdin.inspection.erpvector.config.properties.MilvusProperties;
import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import jakarta.annotation.Resource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
@ConditionalOnProperty(prefix = "gdin.ai.store", name = "type", havingValue = "milvus", matchIfMissing = true)
public class MilvusConfig {
    @Resource
    private MilvusProperties milvusProperties;

    @Bean
    public MilvusClientV2 milvusClientV2() {
        ConnectConfig connectConfig = ConnectConfig.builder()
                .uri(milvusProperties.getUri())
                .token(milvusProperties.getToken())
                .connectTimeoutMs(TimeUnit.SECONDS.toMillis(milvusProperties.getConnectTimeoutSeconds()))
                .build();
        return new MilvusClientV2(connectConfig);
    }
}
