package com.gdin.inspection.erpvector.store;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.erpvector.exception.TransientIoException;
import com.gdin.inspection.erpvector.filter.NativeFilter;
import com.gdin.inspection.erpvector.util.MilvusUtil;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import io.milvus.response.QueryResultsWrapper;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.ConsistencyLevel;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.exception.MilvusClientException;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.DescribeCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import io.milvus.v2.service.collection.response.DescribeCollectionResp;
import io.milvus.v2.service.index.request.CreateIndexReq;
import io.milvus.v2.service.index.request.ListIndexesReq;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.GetReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.response.DeleteResp;
import io.milvus.v2.service.vector.response.GetResp;
import io.milvus.v2.service.vector.response.QueryResp;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.function.Supplier;

/**
 * 基于 Milvus 的 {@link VectorStore}。
 *
 * 固定字段：point_id（主键）、point_type、model_name、model_id、record_id、sync_timestamp、vector_text、embedding，
 * 其余业务字段、外键指针、graph edges 走动态字段。
 * 分页用主键游标：(expr) and point_id > cursor，配合 QueryIterator 保证按主键升序。
 */
@Slf4j
public class MilvusVectorStore implements VectorStore {
    public static final String VECTOR_FIELD = "embedding";
    private static final Set<String> SCALAR_FIELDS = Set.of(
            PointPayload.POINT_TYPE, PointPayload.MODEL_NAME, PointPayload.MODEL_ID,
            PointPayload.RECORD_ID, PointPayload.SYNC_TIMESTAMP, PointPayload.VECTOR_TEXT);

    private final MilvusClientV2 client;
    private final String collectionName;
    private final int dimension;
    private final Gson gson = new Gson();

    public MilvusVectorStore(MilvusClientV2 client, String collectionName, int dimension) {
        this.client = client;
        this.collectionName = collectionName;
        this.dimension = dimension;
    }

    /**
     * collection 不存在时创建，启动时调用。这里失败属于启动期致命错误，不包装成可重试异常。
     */
    public void ensureCollection() {
        if (Boolean.TRUE.equals(client.hasCollection(HasCollectionReq.builder()
                .collectionName(collectionName)
                .build()))) {
            return;
        }
        CreateCollectionReq.CollectionSchema schema = client.createSchema();
        schema.setEnableDynamicField(true);
        // 内置主键 - point_id
        schema.addField(AddFieldReq.builder()
                .fieldName(StorePoint.POINT_ID)
                .dataType(DataType.VarChar)
                .maxLength(64)
                .isPrimaryKey(true)
                .autoID(false)
                .build());
        schema.addField(AddFieldReq.builder().fieldName(PointPayload.POINT_TYPE).dataType(DataType.VarChar).maxLength(16).build());
        schema.addField(AddFieldReq.builder().fieldName(PointPayload.MODEL_NAME).dataType(DataType.VarChar).maxLength(128).build());
        schema.addField(AddFieldReq.builder().fieldName(PointPayload.MODEL_ID).dataType(DataType.Int64).build());
        schema.addField(AddFieldReq.builder().fieldName(PointPayload.RECORD_ID).dataType(DataType.Int64).build());
        schema.addField(AddFieldReq.builder().fieldName(PointPayload.SYNC_TIMESTAMP).dataType(DataType.VarChar).maxLength(32).build());
        schema.addField(AddFieldReq.builder().fieldName(PointPayload.VECTOR_TEXT).dataType(DataType.VarChar).maxLength(65535).build());
        schema.addField(AddFieldReq.builder()
                .fieldName(VECTOR_FIELD)
                .dataType(DataType.FloatVector)
                .dimension(dimension)
                .build());

        // 创建索引
        List<IndexParam> indexParams = new ArrayList<>();
        indexParams.add(IndexParam.builder()
                .fieldName(VECTOR_FIELD)
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.IP)
                .extraParams(Map.of("M", 16, "efConstruction", 128))
                .build());
        for (String field : List.of(PointPayload.POINT_TYPE, PointPayload.MODEL_NAME, PointPayload.MODEL_ID, PointPayload.RECORD_ID)) {
            indexParams.add(IndexParam.builder().fieldName(field).indexType(IndexParam.IndexType.INVERTED).build());
        }
        client.createCollection(CreateCollectionReq.builder()
                .collectionName(collectionName)
                .collectionSchema(schema)
                .indexParams(indexParams)
                .build());
        log.info("Created Milvus collection {} (dim={})", collectionName, dimension);
    }

    @Override
    public long upsert(List<StorePoint> points, int chunkSize) {
        if (CollectionUtil.isEmpty(points)) return 0L;
        List<JsonObject> rows = new ArrayList<>(points.size());
        for (StorePoint p : points) rows.add(toRow(p.getId(), p.getVector(),
                p.getPayload() == null ? Map.of() : p.getPayload().toMap()));
        return call("upsert", () -> MilvusUtil.upsertByBatch(client, collectionName, rows, Math.max(1, chunkSize)));
    }

    @Override
    public ScrollPage scroll(ScrollRequest request) {
        String expr = MilvusFilterRenderer.renderAfter(request.getFilter(), request.getCursor());
        List<String> outputFields = outputFields(request.isWithPayload(), request.isWithVector());
        // 多取一条判断是否还有下一页
        List<QueryResultsWrapper.RowRecord> rows = call("scroll",
                () -> MilvusUtil.queryOrderedPage(client, collectionName, expr, outputFields, request.getLimit() + 1));

        List<StorePoint> points = new ArrayList<>();
        for (QueryResultsWrapper.RowRecord row : rows) points.add(fromEntity(row.getFieldValues(), request.isWithPayload()));
        points.sort(Comparator.comparing(StorePoint::getId));

        boolean more = points.size() > request.getLimit();
        if (more) points = new ArrayList<>(points.subList(0, request.getLimit()));
        String next = more ? points.get(points.size() - 1).getId() : null;
        return new ScrollPage(points, next);
    }

    @Override
    public long count(NativeFilter filter, boolean exact) {
        QueryResp resp = call("count", () -> client.query(QueryReq.builder()
                .collectionName(collectionName)
                .filter(MilvusFilterRenderer.render(filter))
                .outputFields(Collections.singletonList("count(*)"))
                .consistencyLevel(exact ? ConsistencyLevel.STRONG : ConsistencyLevel.BOUNDED)
                .build()));
        if (resp == null || CollectionUtil.isEmpty(resp.getQueryResults())) return 0L;
        Object value = resp.getQueryResults().get(0).getEntity().get("count(*)");
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    @Override
    public long deleteByFilter(NativeFilter filter) {
        DeleteResp resp = call("delete", () -> client.delete(DeleteReq.builder()
                .collectionName(collectionName)
                .filter(MilvusFilterRenderer.render(filter))
                .build()));
        return resp == null ? -1L : resp.getDeleteCnt();
    }

    @Override
    public void createPayloadIndex(String field, PayloadIndexType type) {
        IndexParam.IndexParamBuilder builder = IndexParam.builder()
                .indexName(field + "_idx")
                .indexType(IndexParam.IndexType.INVERTED);
        if (SCALAR_FIELDS.contains(field)) {
            builder.fieldName(field);
        } else {
            // 动态字段上建 JSON path 索引
            builder.fieldName("$meta").extraParams(Map.of(
                    "json_path", field,
                    "json_cast_type", jsonCastType(type)));
        }
        IndexParam param = builder.build();
        call("createIndex", () -> {
            client.createIndex(CreateIndexReq.builder()
                    .collectionName(collectionName)
                    .indexParams(Collections.singletonList(param))
                    .build());
            return null;
        });
        log.info("Payload index created: {} ({})", field, type);
    }

    @Override
    public CollectionInfo getCollectionInfo() {
        DescribeCollectionResp describe = call("describe", () -> client.describeCollection(DescribeCollectionReq.builder()
                .collectionName(collectionName)
                .build()));
        List<String> indexes = call("listIndexes", () -> client.listIndexes(ListIndexesReq.builder()
                .collectionName(collectionName)
                .build()));
        Integer dim = null;
        for (CreateCollectionReq.FieldSchema f : describe.getCollectionSchema().getFieldSchemaList()) {
            if (f.getDataType() == DataType.FloatVector) dim = f.getDimension();
        }
        return CollectionInfo.builder()
                .name(collectionName)
                .pointCount(count(NativeFilter.empty(), false))
                .vectorDimension(dim)
                .indexedFields(indexes)
                .dynamicFieldEnabled(describe.getCollectionSchema().isEnableDynamicField())
                .build();
    }

    @Override
    public List<StorePoint> retrieve(Collection<String> ids, boolean withPayload) {
        if (CollectionUtil.isEmpty(ids)) return List.of();
        GetResp resp = call("get", () -> client.get(GetReq.builder()
                .collectionName(collectionName)
                .ids(new ArrayList<>(new LinkedHashSet<>(ids)))
                .outputFields(outputFields(withPayload, false))
                .build()));
        List<StorePoint> points = new ArrayList<>();
        if (resp == null || resp.getGetResults() == null) return points;
        for (QueryResp.QueryResult r : resp.getGetResults()) points.add(fromEntity(r.getEntity(), withPayload));
        return points;
    }

    @Override
    public boolean setPayload(String id, Map<String, Object> values) {
        // Milvus 没有局部更新：取回整行（含向量）合并后 upsert
        GetResp resp = call("get", () -> client.get(GetReq.builder()
                .collectionName(collectionName)
                .ids(Collections.singletonList(id))
                .outputFields(outputFields(true, true))
                .build()));
        if (resp == null || CollectionUtil.isEmpty(resp.getGetResults())) return false;
        StorePoint existing = fromEntity(resp.getGetResults().get(0).getEntity(), true);
        Map<String, Object> merged = new LinkedHashMap<>(existing.getPayload().toMap());
        merged.putAll(values);
        JsonObject row = toRow(id, existing.getVector(), merged);
        call("upsert", () -> MilvusUtil.upsertByBatch(client, collectionName, Collections.singletonList(row), 1));
        return true;
    }

    private JsonObject toRow(String id, List<Float> vector, Map<String, Object> payload) {
        JsonObject row = gson.toJsonTree(payload).getAsJsonObject();
        row.addProperty(StorePoint.POINT_ID, id);
        // 固定字段不允许缺失
        if (!row.has(PointPayload.POINT_TYPE)) row.addProperty(PointPayload.POINT_TYPE, "");
        if (!row.has(PointPayload.MODEL_NAME)) row.addProperty(PointPayload.MODEL_NAME, "");
        if (!row.has(PointPayload.SYNC_TIMESTAMP)) row.addProperty(PointPayload.SYNC_TIMESTAMP, "");
        if (!row.has(PointPayload.VECTOR_TEXT)) row.addProperty(PointPayload.VECTOR_TEXT, "");
        row.addProperty(PointPayload.MODEL_ID, payload.get(PointPayload.MODEL_ID) == null ? 0L
                : ((Number) payload.get(PointPayload.MODEL_ID)).longValue());
        row.addProperty(PointPayload.RECORD_ID, payload.get(PointPayload.RECORD_ID) == null ? 0L
                : ((Number) payload.get(PointPayload.RECORD_ID)).longValue());
        // 没有向量的点位（graph/schema）写零向量
        List<Float> v = vector;
        if (v == null) v = Collections.nCopies(dimension, 0f);
        row.add(VECTOR_FIELD, gson.toJsonTree(v));
        return row;
    }

    @SuppressWarnings("unchecked")
    private StorePoint fromEntity(Map<String, Object> entity, boolean withPayload) {
        Map<String, Object> payload = new LinkedHashMap<>(entity);
        String id = String.valueOf(payload.remove(StorePoint.POINT_ID));
        Object vector = payload.remove(VECTOR_FIELD);
        payload.remove("$meta");
        List<Float> floats = null;
        if (vector instanceof List) {
            floats = new ArrayList<>();
            for (Object o : (List<Object>) vector) floats.add(((Number) o).floatValue());
        }
        return StorePoint.builder()
                .id(id)
                .vector(floats)
                .payload(withPayload ? PointPayload.fromMap(payload) : null)
                .build();
    }

    private List<String> outputFields(boolean withPayload, boolean withVector) {
        List<String> fields = new ArrayList<>();
        fields.add(StorePoint.POINT_ID);
        if (withPayload) fields.add("*");
        if (withVector) fields.add(VECTOR_FIELD);
        return fields;
    }

    private static String jsonCastType(PayloadIndexType type) {
        switch (type) {
            case INTEGER:
            case FLOAT:
                return "double";
            case BOOL:
                return "bool";
            default:
                return "varchar";
        }
    }

    private <T> T call(String op, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (MilvusClientException e) {
            throw new TransientIoException("milvus " + op + " failed: " + e.getMessage(), e);
        }
    }
}
