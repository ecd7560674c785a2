package com.gdin.inspection.erpvector.sync;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.erpvector.codec.DecodingException;
import com.gdin.inspection.erpvector.codec.PointAddressCodec;
import com.gdin.inspection.erpvector.codec.PointNamespace;
import com.gdin.inspection.erpvector.integrity.json.JsonFkConfigStore;
import com.gdin.inspection.erpvector.integrity.json.JsonFkMapping;
import com.gdin.inspection.erpvector.schema.FieldDescriptor;
import com.gdin.inspection.erpvector.schema.FieldType;
import com.gdin.inspection.erpvector.schema.ModelSchema;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.store.FkPointer;
import com.gdin.inspection.erpvector.store.GraphEdge;
import com.gdin.inspection.erpvector.store.PointPayload;
import com.gdin.inspection.erpvector.store.StorePoint;

import java.time.Instant;
import java.util.*;

/**
 * ERP 记录 -> 点位。
 *
 * many2one 拆成 &lt;f&gt;_id / &lt;f&gt;_name 和指针 &lt;f&gt;_ptr；to-many 保留 id 列表并写指针列表（空列表不写）。
 * 配置为外键的 JSON 字段（如 analytic_distribution）按键生成 to-many 指针。
 * ERP 对空值返回 false，非布尔字段遇到 false 直接跳过。
 */
public class PointBuilder {
    private static final int VECTOR_TEXT_MAX = 4000;

    private final SchemaCatalog catalog;
    private final JsonFkConfigStore jsonFkConfig;

    public PointBuilder(SchemaCatalog catalog) {
        this(catalog, null);
    }

    /**
     * @param jsonFkConfig 为空时 JSON 字段只按原值保存
     */
    public PointBuilder(SchemaCatalog catalog, JsonFkConfigStore jsonFkConfig) {
        this.catalog = catalog;
        this.jsonFkConfig = jsonFkConfig;
    }

    /**
     * @throws com.gdin.inspection.erpvector.codec.EncodingException 记录号或模型号超出 ID 段容量
     */
    public StorePoint buildDataPoint(ModelSchema model, Map<String, Object> record, String syncTimestamp) {
        long recordId = ((Number) record.get("id")).longValue();
        String id = PointAddressCodec.encodeData(model.getModelId(), recordId);

        PointPayload payload = PointPayload.builder()
                .pointType(PointNamespace.DATA_RECORD.getPointType())
                .modelName(model.getModelName())
                .modelId(model.getModelId())
                .recordId(recordId)
                .syncTimestamp(syncTimestamp)
                .build();

        StringBuilder text = new StringBuilder();
        text.append(model.getModelName()).append(" #").append(recordId);

        for (FieldDescriptor field : model.getFields()) {
            String name = field.getFieldName();
            if ("id".equals(name) || !record.containsKey(name)) continue;
            Object value = record.get(name);
            FieldType type = field.getFieldType() == null ? FieldType.UNKNOWN : field.getFieldType();
            if (Boolean.FALSE.equals(value) && type != FieldType.BOOLEAN) continue;
            if (value == null || type == FieldType.BINARY) continue;

            if (type == FieldType.MANY2ONE) {
                putMany2one(payload, field, value, text);
            } else if (type.isToMany()) {
                putToMany(payload, field, value);
            } else if (type == FieldType.JSON) {
                payload.putExtra(name, value);
                putJsonFk(payload, model, field, value);
            } else {
                payload.putExtra(name, value);
                if (type.isText() || type.isNumeric() || type.isTemporal()) {
                    text.append(" | ").append(label(field)).append(": ").append(value);
                }
            }
        }
        payload.setVectorText(StrUtil.maxLength(text.toString(), VECTOR_TEXT_MAX));
        return StorePoint.builder().id(id).payload(payload).build();
    }

    /**
     * 由数据点位的指针生成 graph edge 点位，没有指针时返回 null
     */
    public StorePoint buildEdgePoint(StorePoint dataPoint, String validatedAt) {
        PointPayload data = dataPoint.getPayload();
        if (data.getPointers().isEmpty()) return null;
        List<GraphEdge> edges = new ArrayList<>();
        StringBuilder text = new StringBuilder(data.getModelName()).append(" #").append(data.getRecordId()).append(" ->");
        for (Map.Entry<String, FkPointer> e : data.getPointers().entrySet()) {
            String fieldTarget = catalog.getField(data.getModelName(), e.getKey())
                    .map(FieldDescriptor::getFkTargetModel).orElse(null);
            String shown = fieldTarget;
            for (String target : e.getValue().getTargetIds()) {
                // JSON 外键字段在 schema 里没有目标模型，按地址里的模型号反查
                String targetModel = fieldTarget != null ? fieldTarget : modelOf(target);
                if (shown == null) shown = targetModel;
                edges.add(GraphEdge.builder()
                        .sourceId(dataPoint.getId())
                        .fkField(e.getKey())
                        .targetId(target)
                        .targetModel(targetModel)
                        .lastValidatedAt(validatedAt)
                        .build());
            }
            text.append(' ').append(e.getKey()).append('(').append(shown).append(')');
        }
        PointPayload payload = PointPayload.builder()
                .pointType(PointNamespace.GRAPH_EDGE.getPointType())
                .modelName(data.getModelName())
                .modelId(data.getModelId())
                .recordId(data.getRecordId())
                .syncTimestamp(validatedAt)
                .vectorText(text.toString())
                .edges(edges)
                .build();
        String id = PointAddressCodec.encodeGraphEdge(data.getModelId(), data.getRecordId());
        return StorePoint.builder().id(id).payload(payload).build();
    }

    /**
     * 每个字段一个 schema 点位，记录号用 ir.model.fields 的 id
     */
    public StorePoint buildSchemaPoint(ModelSchema model, FieldDescriptor field) {
        String type = field.getFieldType() == null ? FieldType.UNKNOWN.code() : field.getFieldType().code();
        String text = model.getModelName() + "." + field.getFieldName() + " (" + type + ")"
                + (field.getFieldLabel() == null ? "" : " " + field.getFieldLabel())
                + (field.getFkTargetModel() == null ? "" : " -> " + field.getFkTargetModel());
        PointPayload payload = PointPayload.builder()
                .pointType(PointNamespace.SCHEMA_METADATA.getPointType())
                .modelName(model.getModelName())
                .modelId(model.getModelId())
                .recordId(field.getFieldId())
                .syncTimestamp(Instant.now().toString())
                .vectorText(text)
                .build();
        payload.putExtra("field_name", field.getFieldName());
        payload.putExtra("field_type", type);
        payload.putExtra("stored", field.isStored());
        payload.putExtra("fk_target_model", field.getFkTargetModel());
        return StorePoint.builder().id(PointAddressCodec.encodeSchema(field.getFieldId())).payload(payload).build();
    }

    private void putMany2one(PointPayload payload, FieldDescriptor field, Object value, StringBuilder text) {
        // ERP 返回 [id, display_name]
        Long targetId = null;
        String displayName = null;
        if (value instanceof List && !((List<?>) value).isEmpty()) {
            List<?> pair = (List<?>) value;
            if (pair.get(0) instanceof Number) targetId = ((Number) pair.get(0)).longValue();
            if (pair.size() > 1 && pair.get(1) != null) displayName = String.valueOf(pair.get(1));
        } else if (value instanceof Number) {
            targetId = ((Number) value).longValue();
        }
        if (targetId == null) return;

        String name = field.getFieldName();
        payload.putExtra(name + "_id", targetId);
        if (displayName != null) {
            payload.putExtra(name + "_name", displayName);
            text.append(" | ").append(label(field)).append(": ").append(displayName);
        }
        Integer targetModelId = targetModelId(field);
        if (targetModelId != null) {
            payload.putPointer(name, FkPointer.toOne(PointAddressCodec.encodeData(targetModelId, targetId)));
        }
    }

    private void putToMany(PointPayload payload, FieldDescriptor field, Object value) {
        if (!(value instanceof Collection)) return;
        List<Long> ids = new ArrayList<>();
        for (Object o : (Collection<?>) value) {
            if (o instanceof Number) ids.add(((Number) o).longValue());
        }
        if (ids.isEmpty()) return;
        payload.putExtra(field.getFieldName(), ids);
        Integer targetModelId = targetModelId(field);
        if (targetModelId == null) return;
        List<String> targets = new ArrayList<>(ids.size());
        for (Long target : ids) targets.add(PointAddressCodec.encodeData(targetModelId, target));
        payload.putPointer(field.getFieldName(), FkPointer.toMany(targets));
    }

    private void putJsonFk(PointPayload payload, ModelSchema model, FieldDescriptor field, Object value) {
        if (jsonFkConfig == null || !(value instanceof Map)) return;
        JsonFkMapping mapping = jsonFkConfig.fkMappings(model.getModelName()).get(field.getFieldName());
        if (mapping == null) return;
        Integer targetModelId = mapping.getKeyTargetModelId();
        if (targetModelId == null && mapping.getKeyTargetModel() != null) {
            targetModelId = catalog.resolveModelId(mapping.getKeyTargetModel()).orElse(null);
        }
        if (targetModelId == null) return;

        Set<String> targets = new LinkedHashSet<>();
        for (Object key : ((Map<?, ?>) value).keySet()) {
            // 多维分析分布的键形如 "12,15"
            for (String part : StrUtil.split(String.valueOf(key), ',')) {
                String id = part.trim();
                if (!StrUtil.isNumeric(id)) continue;
                long recordId = Long.parseLong(id);
                if (recordId > 0) targets.add(PointAddressCodec.encodeData(targetModelId, recordId));
            }
        }
        if (!targets.isEmpty()) payload.putPointer(field.getFieldName(), FkPointer.toMany(new ArrayList<>(targets)));
    }

    private String modelOf(String targetId) {
        try {
            return catalog.resolveModelById(PointAddressCodec.decode(targetId).getModelId()).orElse(null);
        } catch (DecodingException e) {
            return null;
        }
    }

    private Integer targetModelId(FieldDescriptor field) {
        if (field.getFkTargetModelId() != null) return field.getFkTargetModelId();
        if (field.getFkTargetModel() == null) return null;
        return catalog.resolveModelId(field.getFkTargetModel()).orElse(null);
    }

    private static String label(FieldDescriptor field) {
        return StrUtil.isBlank(field.getFieldLabel()) ? field.getFieldName() : field.getFieldLabel();
    }
}
