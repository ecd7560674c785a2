package com.gdin.inspection.erpvector.integrity.json;

import com.gdin.inspection.erpvector.exception.TransientIoException;
import com.gdin.inspection.erpvector.schema.FieldDescriptor;
import com.gdin.inspection.erpvector.schema.FieldType;
import com.gdin.inspection.erpvector.schema.ModelSchema;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.source.ErpSourceClient;
import com.gdin.inspection.erpvector.source.ErpSourceException;
import com.gdin.inspection.erpvector.source.ReadOptions;
import com.gdin.inspection.erpvector.util.IOUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.*;
import java.util.regex.Pattern;

/**
 * 找出实际存放外键的 JSON 字段（如 analytic_distribution: {"5029": 100}）。
 *
 * 先看字段名，再抽样看数据：键是数字、值像百分比/金额的偏向外键；
 * 键是普通字符串或值是嵌套对象的偏向元数据。
 */
@Slf4j
public class JsonFkDetector {
    public static final int DEFAULT_SAMPLE_SIZE = 5;

    private static final List<NamePattern> FK_PATTERNS = List.of(
            new NamePattern(Pattern.compile("^analytic_distribution$"), 0.95, "account.analytic.account", null, false),
            new NamePattern(Pattern.compile("_distribution$"), 0.85, "account.analytic.account", null, false),
            new NamePattern(Pattern.compile("_tag_ids$"), 0.8, null, null, false),
            new NamePattern(Pattern.compile("_ids$"), 0.7, null, null, false));

    private static final List<NamePattern> NON_FK_PATTERNS = List.of(
            new NamePattern(Pattern.compile("_search$"), 0, null, "Computed search index", true),
            new NamePattern(Pattern.compile("^display_"), 0, null, "Display helper field", false),
            new NamePattern(Pattern.compile("_settings$"), 0, null, "Settings field", false),
            new NamePattern(Pattern.compile("_config$"), 0, null, "Configuration field", false),
            new NamePattern(Pattern.compile("_options$"), 0, null, "Options field", false),
            new NamePattern(Pattern.compile("_widget$"), 0, null, "UI widget state", false));

    private final SchemaCatalog catalog;
    private final ErpSourceClient source;

    /**
     * @param source 为空时只按字段名判断
     */
    public JsonFkDetector(SchemaCatalog catalog, ErpSourceClient source) {
        this.catalog = catalog;
        this.source = source;
    }

    /**
     * 扫描 schema 中的 JSON 字段
     *
     * @param modelFilter   只看这个模型，为空看全部
     * @param minConfidence 低于该置信度的候选不返回
     * @param skip          已配置的 "model:field"，跳过
     */
    public List<JsonFkCandidate> detect(String modelFilter, double minConfidence, int sampleSize, Set<String> skip) {
        List<JsonFkCandidate> candidates = new ArrayList<>();
        for (ModelSchema model : catalog.getModels()) {
            if (modelFilter != null && !modelFilter.equals(model.getModelName())) continue;
            for (FieldDescriptor field : model.getFields()) {
                if (field.getFieldType() != FieldType.JSON) continue;
                if (skip != null && skip.contains(model.getModelName() + ":" + field.getFieldName())) continue;
                List<Map<String, Object>> samples = source == null ? null
                        : sample(model.getModelName(), field.getFieldName(), sampleSize);
                JsonFkCandidate candidate = evaluate(model.getModelName(), field.getFieldName(), samples);
                if (candidate != null && candidate.getConfidence() >= minConfidence) candidates.add(candidate);
            }
        }
        candidates.sort(Comparator.comparingDouble(JsonFkCandidate::getConfidence).reversed());
        log.info("json fk detection: {} candidate(s) at >= {}", candidates.size(), minConfidence);
        return candidates;
    }

    /**
     * @param samples 为空表示没有做抽样
     * @return 被直接排除的字段返回 null
     */
    public JsonFkCandidate evaluate(String model, String field, List<Map<String, Object>> samples) {
        NamePattern nonFk = match(NON_FK_PATTERNS, field);
        if (nonFk != null && nonFk.exclude) return null;
        NamePattern fk = nonFk == null ? match(FK_PATTERNS, field) : null;

        List<String> reasons = new ArrayList<>();
        double confidence;
        boolean metadata;
        String method = "naming";
        if (nonFk != null) {
            metadata = true;
            confidence = 0.7;
            reasons.add("Non-FK pattern: " + nonFk.reason);
        } else if (fk != null) {
            metadata = false;
            confidence = fk.confidence;
            reasons.add("FK pattern matched (confidence: " + fk.confidence + ")");
        } else {
            metadata = false;
            confidence = 0.5;
            reasons.add("Unknown pattern - requires data sampling");
        }

        if (samples != null && !samples.isEmpty()) {
            SampleAnalysis analysis = analyze(samples);
            if (fk != null && analysis.fk) {
                confidence = Math.min(0.98, confidence + 0.1);
                method = "both";
            } else if (fk == null && !analysis.fk) {
                metadata = true;
                confidence = analysis.confidence;
                method = "both";
            } else if (analysis.fk) {
                metadata = false;
                confidence = analysis.confidence * 0.8;
                method = "data_sampling";
            } else {
                metadata = true;
                confidence = analysis.confidence * 0.9;
                method = "data_sampling";
            }
            reasons.addAll(analysis.reasons);
        }

        return JsonFkCandidate.builder()
                .sourceModel(model)
                .fieldName(field)
                .confidence(Math.round(confidence * 1000.0) / 1000.0)
                .classification(metadata ? JsonFieldClass.METADATA : JsonFieldClass.FK)
                .detectionMethod(method)
                .likelyTargetModel(metadata || fk == null ? null : fk.likelyTarget)
                .reasons(reasons)
                .build();
    }

    /**
     * 把候选转成配置条目，低于阈值的忽略
     */
    public List<JsonFkMapping> toMappings(List<JsonFkCandidate> candidates, double minConfidence) {
        List<JsonFkMapping> mappings = new ArrayList<>();
        for (JsonFkCandidate c : candidates) {
            if (c.getConfidence() < minConfidence) continue;
            JsonFkMapping.JsonFkMappingBuilder b = JsonFkMapping.builder()
                    .sourceModel(c.getSourceModel())
                    .fieldName(c.getFieldName())
                    .mappingType(c.getClassification());
            if (c.isFk()) {
                String target = c.getLikelyTargetModel();
                b.keyTargetModel(target)
                        .keyTargetModelId(target == null ? null : catalog.resolveModelId(target).orElse(null))
                        .keyType("record_id")
                        .valueType("percentage");
            } else {
                b.keyType("string").valueType("mixed").description(String.join("; ", c.getReasons()));
            }
            mappings.add(b.build());
        }
        return mappings;
    }

    static SampleAnalysis analyze(List<Map<String, Object>> samples) {
        List<String> reasons = new ArrayList<>();
        int fkScore = 0;
        int nonFkScore = 0;
        for (Map<String, Object> sample : samples) {
            if (sample == null || sample.isEmpty()) continue;

            long numericKeys = sample.keySet().stream().filter(k -> k.matches("\\d+")).count();
            double keyRatio = (double) numericKeys / sample.size();
            if (keyRatio > 0.8) {
                fkScore += 30;
                reasons.add("Keys are numeric (" + numericKeys + "/" + sample.size() + ")");
            } else if (numericKeys == 0) {
                nonFkScore += 30;
                reasons.add("Keys are non-numeric (likely stage names or field names)");
            }

            List<Double> numbers = new ArrayList<>();
            boolean nested = false;
            for (Object v : sample.values()) {
                if (v instanceof Number) numbers.add(((Number) v).doubleValue());
                if (v instanceof Map || v instanceof Collection) nested = true;
            }
            if ((double) numbers.size() / sample.size() > 0.8) {
                boolean allPositive = numbers.stream().allMatch(n -> n >= 0);
                double max = numbers.stream().mapToDouble(Double::doubleValue).max().orElse(0);
                if (allPositive && max <= 100) {
                    fkScore += 20;
                    reasons.add("Values look like percentages (max: " + max + ")");
                } else if (allPositive) {
                    fkScore += 10;
                    reasons.add("Values are positive numbers (could be amounts)");
                }
            }
            if (nested) {
                nonFkScore += 20;
                reasons.add("Contains nested objects (suggests metadata)");
            }
        }

        int total = fkScore + nonFkScore;
        if (total == 0) return new SampleAnalysis(false, 0.5, List.of("Inconclusive data"));
        double fkConfidence = (double) fkScore / total;
        return new SampleAnalysis(fkConfidence > 0.6, Math.max(fkConfidence, 1 - fkConfidence), reasons);
    }

    private List<Map<String, Object>> sample(String model, String field, int sampleSize) {
        List<Map<String, Object>> samples = new ArrayList<>();
        List<Map<String, Object>> rows;
        try {
            rows = source.searchRead(model, List.of(List.of(field, "!=", false)), List.of(field),
                    ReadOptions.builder().limit(sampleSize > 0 ? sampleSize : DEFAULT_SAMPLE_SIZE).build());
        } catch (TransientIoException | ErpSourceException e) {
            log.warn("failed to sample {}.{}: {}", model, field, e.getMessage());
            return samples;
        }
        for (Map<String, Object> row : rows) {
            Object value = row.get(field);
            if (value instanceof Map) {
                samples.add(IOUtil.toMap(value));
            } else if (value instanceof String) {
                try {
                    samples.add(IOUtil.jsonDeserializeWithNoType((String) value, LinkedHashMap.class));
                } catch (IOException e) {
                    log.debug("{}.{} sample is not a JSON object", model, field);
                }
            }
        }
        return samples;
    }

    private static NamePattern match(List<NamePattern> patterns, String field) {
        for (NamePattern p : patterns) {
            if (p.pattern.matcher(field).find()) return p;
        }
        return null;
    }

    static class SampleAnalysis {
        final boolean fk;
        final double confidence;
        final List<String> reasons;

        SampleAnalysis(boolean fk, double confidence, List<String> reasons) {
            this.fk = fk;
            this.confidence = confidence;
            this.reasons = reasons;
        }
    }

    private static class NamePattern {
        final Pattern pattern;
        final double confidence;
        final String likelyTarget;
        final String reason;
        final boolean exclude;

        NamePattern(Pattern pattern, double confidence, String likelyTarget, String reason, boolean exclude) {
            this.pattern = pattern;
            this.confidence = confidence;
            this.likelyTarget = likelyTarget;
            this.reason = reason;
            this.exclude = exclude;
        }
    }
}
