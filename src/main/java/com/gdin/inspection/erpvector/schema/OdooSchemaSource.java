package com.gdin.inspection.erpvector.schema;

import com.gdin.inspection.erpvector.exception.TransientIoException;
import com.gdin.inspection.erpvector.source.ErpSourceClient;
import com.gdin.inspection.erpvector.source.ErpSourceException;
import com.gdin.inspection.erpvector.source.ReadOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 直接从 ERP 的 ir.model / ir.model.fields 读取 schema。
 */
@Slf4j
public class OdooSchemaSource implements SchemaSource {
    private static final int PAGE = 5000;

    private final ErpSourceClient client;

    public OdooSchemaSource(ErpSourceClient client) {
        this.client = client;
    }

    @Override
    public List<ModelSchema> load() {
        try {
            return doLoad();
        } catch (TransientIoException | ErpSourceException e) {
            throw new SchemaLoadException("failed to load schema from ERP: " + e.getMessage(), e);
        }
    }

    private List<ModelSchema> doLoad() {
        Map<String, Integer> modelIds = new LinkedHashMap<>();
        for (Map<String, Object> row : readAll("ir.model", List.of("id", "model"))) {
            modelIds.put(String.valueOf(row.get("model")), ((Number) row.get("id")).intValue());
        }

        Map<String, List<FieldDescriptor>> fieldsByModel = new HashMap<>();
        Map<String, Long> pkFieldIds = new HashMap<>();
        List<String> fieldCols = List.of("id", "name", "field_description", "ttype", "store", "relation", "model");
        for (Map<String, Object> row : readAll("ir.model.fields", fieldCols)) {
            String model = String.valueOf(row.get("model"));
            String name = String.valueOf(row.get("name"));
            long fieldId = ((Number) row.get("id")).longValue();
            String relation = row.get("relation") instanceof String ? (String) row.get("relation") : null;
            if ("id".equals(name)) pkFieldIds.put(model, fieldId);
            fieldsByModel.computeIfAbsent(model, k -> new ArrayList<>()).add(FieldDescriptor.builder()
                    .fieldId(fieldId)
                    .fieldName(name)
                    .fieldLabel(row.get("field_description") instanceof String ? (String) row.get("field_description") : name)
                    .fieldType(FieldType.parse(String.valueOf(row.get("ttype"))))
                    .stored(Boolean.TRUE.equals(row.get("store")))
                    .fkTargetModel(relation)
                    .fkTargetModelId(relation == null ? null : modelIds.get(relation))
                    .build());
        }

        List<ModelSchema> models = new ArrayList<>();
        for (Map.Entry<String, Integer> e : modelIds.entrySet()) {
            models.add(ModelSchema.builder()
                    .modelId(e.getValue())
                    .modelName(e.getKey())
                    .primaryKeyFieldId(pkFieldIds.get(e.getKey()))
                    .fields(fieldsByModel.getOrDefault(e.getKey(), List.of()))
                    .build());
        }
        log.info("Loaded {} models from ERP", models.size());
        return models;
    }

    private List<Map<String, Object>> readAll(String model, List<String> fields) {
        List<Map<String, Object>> all = new ArrayList<>();
        int offset = 0;
        while (true) {
            List<Map<String, Object>> page = client.searchRead(model, List.of(), fields,
                    ReadOptions.builder().limit(PAGE).offset(offset).build());
            all.addAll(page);
            if (page.size() < PAGE) return all;
            offset += PAGE;
        }
    }
}
