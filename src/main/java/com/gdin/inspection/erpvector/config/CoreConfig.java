package com.gdin.inspection.erpvector.config;

import com.gdin.inspection.erpvector.config.properties.IntegrityProperties;
import com.gdin.inspection.erpvector.config.properties.OdooProperties;
import com.gdin.inspection.erpvector.config.properties.QueryProperties;
import com.gdin.inspection.erpvector.config.properties.StoreProperties;
import com.gdin.inspection.erpvector.config.properties.SyncProperties;
import com.gdin.inspection.erpvector.embedding.EmbeddingService;
import com.gdin.inspection.erpvector.filter.FilterCompiler;
import com.gdin.inspection.erpvector.integrity.*;
import com.gdin.inspection.erpvector.integrity.json.JsonFkConfigStore;
import com.gdin.inspection.erpvector.integrity.json.JsonFkDetector;
import com.gdin.inspection.erpvector.query.AggregationEngine;
import com.gdin.inspection.erpvector.query.ScrollEngine;
import com.gdin.inspection.erpvector.schema.JsonFileSchemaSource;
import com.gdin.inspection.erpvector.schema.OdooSchemaSource;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.schema.SchemaSource;
import com.gdin.inspection.erpvector.source.ErpSourceClient;
import com.gdin.inspection.erpvector.source.OdooSourceClient;
import com.gdin.inspection.erpvector.store.VectorStore;
import com.gdin.inspection.erpvector.sync.DataSyncService;
import com.gdin.inspection.erpvector.sync.DeadLetterQueue;
import com.gdin.inspection.erpvector.sync.SyncMetadataStore;
import com.gdin.inspection.erpvector.sync.SyncTargetRepairer;
import com.gdin.inspection.erpvector.util.AsyncQueryLogSink;
import com.gdin.inspection.erpvector.util.RetryUtil;
import jakarta.annotation.Resource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CoreConfig {
    @Resource
    private StoreProperties storeProperties;
    @Resource
    private SyncProperties syncProperties;
    @Resource
    private QueryProperties queryProperties;
    @Resource
    private IntegrityProperties integrityProperties;

    private RetryUtil.Policy retryPolicy() {
        return RetryUtil.Policy.of(syncProperties.getMaxAttempts(), syncProperties.getBackoffMillis());
    }

    @Bean
    public ErpSourceClient erpSourceClient(OdooProperties odooProperties) {
        return new OdooSourceClient(odooProperties);
    }

    @Bean
    public SchemaCatalog schemaCatalog(ErpSourceClient erpSourceClient) {
        SchemaSource source = "odoo".equalsIgnoreCase(storeProperties.getSchemaSource())
                ? new OdooSchemaSource(erpSourceClient)
                : new JsonFileSchemaSource(storeProperties.getSchemaLocation());
        SchemaCatalog catalog = new SchemaCatalog(source);
        catalog.initialize();
        return catalog;
    }

    @Bean
    public FilterCompiler filterCompiler(SchemaCatalog schemaCatalog) {
        return new FilterCompiler(schemaCatalog, storeProperties.getIndexedFields().keySet());
    }

    @Bean
    public AggregationEngine aggregationEngine(VectorStore vectorStore) {
        return new AggregationEngine(vectorStore, queryProperties.getPageSize(), retryPolicy());
    }

    @Bean
    public ScrollEngine scrollEngine(VectorStore vectorStore) {
        return new ScrollEngine(vectorStore, queryProperties.getPageSize(), retryPolicy());
    }

    @Bean(destroyMethod = "close")
    public AsyncQueryLogSink asyncQueryLogSink() {
        return new AsyncQueryLogSink(queryProperties.getLogQueueCapacity(), queryProperties.getLogFile());
    }

    @Bean
    public DeadLetterQueue deadLetterQueue() {
        return new DeadLetterQueue(syncProperties.getDeadLetterFile());
    }

    @Bean
    public SyncMetadataStore syncMetadataStore() {
        return new SyncMetadataStore(syncProperties.getMetadataFile());
    }

    @Bean
    public DataSyncService dataSyncService(ErpSourceClient erpSourceClient, SchemaCatalog schemaCatalog,
                                           VectorStore vectorStore, EmbeddingService embeddingService,
                                           DeadLetterQueue deadLetterQueue, SyncMetadataStore syncMetadataStore,
                                           JsonFkConfigStore jsonFkConfigStore) {
        return new DataSyncService(erpSourceClient, schemaCatalog, vectorStore, embeddingService,
                syncProperties, deadLetterQueue, syncMetadataStore, jsonFkConfigStore);
    }

    @Bean
    public RepairCoordinator repairCoordinator(DataSyncService dataSyncService, VectorStore vectorStore) {
        return new RepairCoordinator(new SyncTargetRepairer(dataSyncService), vectorStore,
                integrityProperties.getExistenceBatchSize(), retryPolicy());
    }

    @Bean
    public ValidationHistorySink validationHistorySink() {
        return new JsonlValidationHistorySink(integrityProperties.getHistoryFile(), integrityProperties.getHistoryKeep());
    }

    @Bean
    public FkGraphIntegrityEngine fkGraphIntegrityEngine(SchemaCatalog schemaCatalog, VectorStore vectorStore,
                                                         RepairCoordinator repairCoordinator,
                                                         ValidationHistorySink validationHistorySink,
                                                         JsonFkConfigStore jsonFkConfigStore) {
        return new FkGraphIntegrityEngine(schemaCatalog, vectorStore, repairCoordinator, validationHistorySink,
                integrityProperties, retryPolicy(), jsonFkConfigStore);
    }

    @Bean
    public OrphanRepairService orphanRepairService(FkGraphIntegrityEngine engine, RepairCoordinator repairCoordinator) {
        return new OrphanRepairService(engine, repairCoordinator, syncProperties.getRepairSyncLimit());
    }

    @Bean
    public JsonFkDetector jsonFkDetector(SchemaCatalog schemaCatalog, ErpSourceClient erpSourceClient) {
        return new JsonFkDetector(schemaCatalog, erpSourceClient);
    }

    @Bean
    public JsonFkConfigStore jsonFkConfigStore() {
        return new JsonFkConfigStore(integrityProperties.getFkConfigFile());
    }
}
