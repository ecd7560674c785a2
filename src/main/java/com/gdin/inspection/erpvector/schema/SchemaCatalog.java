package com.gdin.inspection.erpvector.schema;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.erpvector.filter.FilterOperator;
import com.gdin.inspection.erpvector.util.TextDistanceUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 模型/字段元数据的内存索引。
 *
 * 初始化一次后只读；reload() 会整体替换快照，读方看到的要么是旧快照要么是新快照。
 * 未知模型的查询返回 {@link ModelLookup}，不抛异常。
 */
@Slf4j
public class SchemaCatalog {
    public static final int FIELD_SUGGEST_DISTANCE = 3;
    public static final int MODEL_SUGGEST_DISTANCE = 4;
    public static final int SUGGEST_LIMIT = 3;

    private final SchemaSource source;
    private volatile Snapshot snapshot;

    public SchemaCatalog(SchemaSource source) {
        this.source = source;
    }

    /**
     * 幂等，已初始化时直接返回
     */
    public void initialize() {
        if (snapshot != null) return;
        synchronized (this) {
            if (snapshot != null) return;
            snapshot = build(source.load());
        }
    }

    public synchronized void reload() {
        snapshot = build(source.load());
    }

    public boolean isInitialized() {
        return snapshot != null;
    }

    public ModelLookup lookupModel(String modelName) {
        Snapshot s = current();
        ModelSchema schema = modelName == null ? null : s.byName.get(modelName);
        if (schema != null) return ModelLookup.found(modelName, schema);
        return ModelLookup.notFound(modelName,
                TextDistanceUtil.closest(modelName, s.byName.keySet(), MODEL_SUGGEST_DISTANCE, SUGGEST_LIMIT));
    }

    public Optional<ModelSchema> getModel(String modelName) {
        return Optional.ofNullable(current().byName.get(modelName));
    }

    public List<String> getModelNames() {
        return new ArrayList<>(current().byName.keySet());
    }

    public List<ModelSchema> getModels() {
        return new ArrayList<>(current().byName.values());
    }

    public List<FieldDescriptor> getFields(String modelName) {
        ModelSchema schema = current().byName.get(modelName);
        return schema == null ? List.of() : schema.getFields();
    }

    public Optional<FieldDescriptor> getField(String modelName, String fieldName) {
        Map<String, FieldDescriptor> fields = current().fieldsByModel.get(modelName);
        if (fields == null) return Optional.empty();
        return Optional.ofNullable(fields.get(fieldName));
    }

    public List<FieldDescriptor> getFkFields(String modelName) {
        ModelSchema schema = current().byName.get(modelName);
        return schema == null ? List.of() : schema.getFkFields();
    }

    public Optional<String> resolveModelById(int modelId) {
        ModelSchema schema = current().byId.get(modelId);
        return schema == null ? Optional.empty() : Optional.of(schema.getModelName());
    }

    public Optional<Integer> resolveModelId(String modelName) {
        ModelSchema schema = current().byName.get(modelName);
        return schema == null ? Optional.empty() : Optional.of(schema.getModelId());
    }

    public boolean isSystemField(String name) {
        return SystemField.of(name) != null;
    }

    /**
     * 解析过滤字段：系统字段、业务字段，以及外键派生字段 (&lt;fk&gt;_id / _ids / _name / _ptr)
     */
    public Optional<ResolvedField> resolveField(String modelName, String fieldName) {
        SystemField system = SystemField.of(fieldName);
        if (system != null) return Optional.of(ResolvedField.system(system));

        Map<String, FieldDescriptor> fields = current().fieldsByModel.get(modelName);
        if (fields == null || fieldName == null) return Optional.empty();

        FieldDescriptor direct = fields.get(fieldName);
        if (direct != null) {
            // many2one 在 payload 里以 <field>_id 存整数 id
            if (direct.getFieldType() == FieldType.MANY2ONE) {
                return Optional.of(ResolvedField.business(fieldName, fieldName + "_id", FieldType.INTEGER, direct));
            }
            return Optional.of(ResolvedField.business(fieldName, fieldName, direct.getFieldType(), direct));
        }

        FieldDescriptor fk;
        if ((fk = derivedBase(fields, fieldName, "_ptr")) != null) {
            return Optional.of(ResolvedField.business(fieldName, fieldName,
                    fk.getFieldType().isToMany() ? FieldType.MANY2MANY : FieldType.KEYWORD, fk));
        }
        if ((fk = derivedBase(fields, fieldName, "_name")) != null && fk.getFieldType() == FieldType.MANY2ONE) {
            return Optional.of(ResolvedField.business(fieldName, fieldName, FieldType.CHAR, fk));
        }
        if ((fk = derivedBase(fields, fieldName, "_id")) != null && fk.getFieldType() == FieldType.MANY2ONE) {
            return Optional.of(ResolvedField.business(fieldName, fieldName, FieldType.INTEGER, fk));
        }
        if ((fk = derivedBase(fields, fieldName, "_ids")) != null && fk.getFieldType().isToMany()) {
            // to-many 的 id 列表就存放在字段本名下
            return Optional.of(ResolvedField.business(fieldName, fk.getFieldName(), FieldType.MANY2MANY, fk));
        }
        return Optional.empty();
    }

    public Set<FilterOperator> validOperatorsFor(String modelName, String fieldName) {
        return resolveField(modelName, fieldName)
                .map(ResolvedField::legalOperators)
                .orElse(Set.of());
    }

    public List<String> suggestSimilar(String modelName, String typoField) {
        Map<String, FieldDescriptor> fields = current().fieldsByModel.get(modelName);
        if (fields == null) return List.of();
        return TextDistanceUtil.closest(typoField, fields.keySet(), FIELD_SUGGEST_DISTANCE, SUGGEST_LIMIT);
    }

    private FieldDescriptor derivedBase(Map<String, FieldDescriptor> fields, String name, String suffix) {
        if (!name.endsWith(suffix) || name.length() == suffix.length()) return null;
        FieldDescriptor base = fields.get(name.substring(0, name.length() - suffix.length()));
        return base != null && base.getFieldType() != null && base.getFieldType().isRelational() ? base : null;
    }

    private Snapshot current() {
        Snapshot s = snapshot;
        if (s == null) throw new IllegalStateException("schema catalog not initialized");
        return s;
    }

    private Snapshot build(List<ModelSchema> models) {
        if (CollectionUtil.isEmpty(models)) throw new SchemaLoadException("schema source returned no models");
        Map<String, ModelSchema> byName = new TreeMap<>();
        Map<Integer, ModelSchema> byId = new HashMap<>();
        Map<String, Map<String, FieldDescriptor>> fieldsByModel = new HashMap<>();
        for (ModelSchema model : models) {
            ModelSchema dup = byId.put(model.getModelId(), model);
            if (dup != null && !dup.getModelName().equals(model.getModelName())) {
                throw new SchemaLoadException("duplicate model id " + model.getModelId()
                        + " for " + dup.getModelName() + " and " + model.getModelName());
            }
            byName.put(model.getModelName(), model);
            Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
            for (FieldDescriptor f : model.getFields()) {
                if (StrUtil.isBlank(f.getFieldName()) || f.getFieldType() == null) {
                    throw new SchemaLoadException("field " + model.getModelName() + "." + f.getFieldName()
                            + " has no name or type");
                }
                fields.put(f.getFieldName(), f);
            }
            fieldsByModel.put(model.getModelName(), Collections.unmodifiableMap(fields));
        }
        int fieldCount = fieldsByModel.values().stream().mapToInt(Map::size).sum();
        log.info("Schema catalog loaded: {} models, {} fields", byName.size(), fieldCount);
        return new Snapshot(Collections.unmodifiableMap(byName), Collections.unmodifiableMap(byId),
                Collections.unmodifiableMap(fieldsByModel));
    }

    private static class Snapshot {
        final Map<String, ModelSchema> byName;
        final Map<Integer, ModelSchema> byId;
        final Map<String, Map<String, FieldDescriptor>> fieldsByModel;

        Snapshot(Map<String, ModelSchema> byName, Map<Integer, ModelSchema> byId,
                 Map<String, Map<String, FieldDescriptor>> fieldsByModel) {
            this.byName = byName;
            this.byId = byId;
            this.fieldsByModel = fieldsByModel;
        }
    }

    /** 测试用：直接由内存模型构建 */
    public static SchemaCatalog of(List<ModelSchema> models) {
        SchemaCatalog catalog = new SchemaCatalog(() -> models);
        catalog.initialize();
        return catalog;
    }

}
