package com.gdin.inspection.erpvector.store;

import com.gdin.inspection.erpvector.util.IOUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.*;

/**
 * 点位 payload：已知的系统键和外键指针强类型，业务字段放进 extras。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointPayload {
    public static final String POINT_TYPE = "point_type";
    public static final String MODEL_NAME = "model_name";
    public static final String MODEL_ID = "model_id";
    public static final String RECORD_ID = "record_id";
    public static final String SYNC_TIMESTAMP = "sync_timestamp";
    public static final String VECTOR_TEXT = "vector_text";
    public static final String EDGES = "edges";
    public static final String POINTER_SUFFIX = "_ptr";

    private String pointType;
    private String modelName;
    private Integer modelId;
    private Long recordId;
    private String syncTimestamp;
    private String vectorText;
    /** 源字段名 -> 指针 */
    @Builder.Default
    private Map<String, FkPointer> pointers = new LinkedHashMap<>();
    /** 仅 graph 点位使用 */
    @Builder.Default
    private List<GraphEdge> edges = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> extras = new LinkedHashMap<>();

    public PointPayload putPointer(String fieldName, FkPointer pointer) {
        // 空的 to-many 关系不落盘
        if (pointer == null) pointers.remove(fieldName);
        else pointers.put(fieldName, pointer);
        return this;
    }

    public PointPayload putExtra(String key, Object value) {
        if (value == null) extras.remove(key);
        else extras.put(key, value);
        return this;
    }

    public FkPointer getPointer(String fieldName) {
        return pointers.get(fieldName);
    }

    /**
     * 扁平化为存储层的 payload
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(extras);
        putIfNotNull(map, POINT_TYPE, pointType);
        putIfNotNull(map, MODEL_NAME, modelName);
        putIfNotNull(map, MODEL_ID, modelId);
        putIfNotNull(map, RECORD_ID, recordId);
        putIfNotNull(map, SYNC_TIMESTAMP, syncTimestamp);
        putIfNotNull(map, VECTOR_TEXT, vectorText);
        for (Map.Entry<String, FkPointer> e : pointers.entrySet()) {
            map.put(e.getKey() + POINTER_SUFFIX, e.getValue().toRaw());
        }
        if (!edges.isEmpty()) {
            List<Map<String, Object>> raw = new ArrayList<>();
            for (GraphEdge edge : edges) raw.add(IOUtil.toMap(edge));
            map.put(EDGES, raw);
        }
        return map;
    }

    public static PointPayload fromMap(Map<String, Object> map) {
        PointPayload payload = new PointPayload();
        if (map == null) return payload;
        for (Map.Entry<String, Object> e : map.entrySet()) {
            String key = e.getKey();
            Object value = e.getValue();
            if (value == null) continue;
            switch (key) {
                case POINT_TYPE: payload.pointType = value.toString(); break;
                case MODEL_NAME: payload.modelName = value.toString(); break;
                case MODEL_ID: payload.modelId = ((Number) toNumber(value)).intValue(); break;
                case RECORD_ID: payload.recordId = ((Number) toNumber(value)).longValue(); break;
                case SYNC_TIMESTAMP: payload.syncTimestamp = value.toString(); break;
                case VECTOR_TEXT: payload.vectorText = value.toString(); break;
                case EDGES:
                    if (value instanceof Collection) {
                        for (Object o : (Collection<?>) value) payload.edges.add(IOUtil.convert(o, GraphEdge.class));
                    }
                    break;
                default:
                    if (key.endsWith(POINTER_SUFFIX) && key.length() > POINTER_SUFFIX.length()) {
                        FkPointer pointer = FkPointer.fromRaw(value);
                        if (pointer != null) {
                            payload.pointers.put(key.substring(0, key.length() - POINTER_SUFFIX.length()), pointer);
                            break;
                        }
                    }
                    payload.extras.put(key, value);
            }
        }
        return payload;
    }

    private static Object toNumber(Object value) {
        if (value instanceof Number) return value;
        return Long.parseLong(value.toString());
    }

    private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) map.put(key, value);
    }
}
