package com.gdin.inspection.erpvector.service;

import com.gdin.inspection.erpvector.config.properties.QueryProperties;
import com.gdin.inspection.erpvector.filter.*;
import com.gdin.inspection.erpvector.query.*;
import com.gdin.inspection.erpvector.req.AggregateReq;
import com.gdin.inspection.erpvector.req.ScrollReq;
import com.gdin.inspection.erpvector.req.ValidateFiltersReq;
import com.gdin.inspection.erpvector.schema.ResolvedField;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.codec.PointNamespace;
import com.gdin.inspection.erpvector.store.PointPayload;
import com.gdin.inspection.erpvector.util.AsyncQueryLogSink;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * 精确查询：过滤校验、聚合、分页读取。只查数据命名空间的点位。
 */
@Slf4j
@Service
public class QueryService {
    private static final Set<String> RECORD_COUNT_FIELDS = Set.of("id", "*", PointPayload.RECORD_ID);

    @Resource
    private SchemaCatalog schemaCatalog;
    @Resource
    private FilterCompiler filterCompiler;
    @Resource
    private AggregationEngine aggregationEngine;
    @Resource
    private ScrollEngine scrollEngine;
    @Resource
    private QueryProperties queryProperties;
    @Resource
    private AsyncQueryLogSink asyncQueryLogSink;

    public List<ValidationError> validate(ValidateFiltersReq req) {
        return filterCompiler.validateFilters(req.getModel(), req.getFilters());
    }

    public AggregationResult aggregate(AggregateReq req) {
        CompiledFilter compiled = filterCompiler.compile(req.getModel(), req.getFilters());
        List<ValidationError> errors = new ArrayList<>();
        List<Aggregation> aggregations = resolveAggregations(req.getModel(), req.getAggregations(), errors);
        List<String> groupBy = resolveFields(req.getModel(), req.getGroupBy(), errors);
        if (!errors.isEmpty()) throw new FilterValidationException(errors);

        int maxRecords = req.getMaxRecords() != null ? req.getMaxRecords() : queryProperties.getMaxRecords();
        OperationControl control = OperationControl.withTimeoutMillis(
                req.getTimeoutMillis() != null ? req.getTimeoutMillis() : queryProperties.getTimeoutMillis());
        long t0 = System.currentTimeMillis();
        AggregationResult result = aggregationEngine.aggregate(dataOnly(compiled), aggregations, groupBy,
                maxRecords, compiled.getResidual(), control);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("model", req.getModel());
        details.put("native", compiled.getNativeFilter().toString());
        details.put("residual", compiled.getResidual().size());
        details.put("records", result.getTotalRecords());
        details.put("truncated", result.isTruncated());
        details.put("millis", System.currentTimeMillis() - t0);
        asyncQueryLogSink.offer("aggregate", details);
        return result;
    }

    public ScrollResult scroll(ScrollReq req) {
        CompiledFilter compiled = filterCompiler.compile(req.getModel(), req.getFilters());
        int limit = req.getLimit() != null && req.getLimit() > 0 ? req.getLimit() : queryProperties.getDefaultScrollLimit();
        OperationControl control = OperationControl.withTimeoutMillis(
                req.getTimeoutMillis() != null ? req.getTimeoutMillis() : queryProperties.getTimeoutMillis());
        ScrollResult result = scrollEngine.scroll(dataOnly(compiled), ScrollOptions.builder()
                .limit(limit)
                .residual(compiled.getResidual())
                .cursor(req.getCursor())
                .withVector(req.isWithVector())
                .build(), control);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("model", req.getModel());
        details.put("native", compiled.getNativeFilter().toString());
        details.put("returned", result.getRecords().size());
        details.put("scanned", result.getTotalScanned());
        asyncQueryLogSink.offer("scroll", details);
        return result;
    }

    private static NativeFilter dataOnly(CompiledFilter compiled) {
        return compiled.getNativeFilter().with(FilterClause.eq(PointPayload.POINT_TYPE, PointNamespace.DATA_RECORD.getPointType()));
    }

    private List<Aggregation> resolveAggregations(String model, List<Aggregation> requested, List<ValidationError> errors) {
        List<Aggregation> resolved = new ArrayList<>();
        if (requested == null || requested.isEmpty()) {
            errors.add(ValidationError.of(null, null, "at least one aggregation is required"));
            return resolved;
        }
        for (Aggregation agg : requested) {
            if (agg.getOp() == null) {
                errors.add(ValidationError.of(agg.getField(), null, "aggregation op is required (sum, count, avg, min, max)"));
                continue;
            }
            if (agg.getOp() == AggregationOp.COUNT && (agg.getField() == null || RECORD_COUNT_FIELDS.contains(agg.getField()))) {
                resolved.add(Aggregation.of(PointPayload.RECORD_ID, AggregationOp.COUNT,
                        agg.getAlias() != null ? agg.getAlias() : "count"));
                continue;
            }
            Optional<ResolvedField> field = schemaCatalog.resolveField(model, agg.getField());
            if (field.isEmpty()) {
                errors.add(ValidationError.withSuggestions(agg.getField(), null,
                        "unknown aggregation field '" + agg.getField() + "'", schemaCatalog.suggestSimilar(model, agg.getField())));
                continue;
            }
            if (agg.getOp() != AggregationOp.COUNT && !field.get().getEffectiveType().isNumeric()) {
                errors.add(ValidationError.of(agg.getField(), null,
                        agg.getOp().code() + " requires a numeric field, '" + agg.getField() + "' is " + field.get().getEffectiveType().code()));
                continue;
            }
            resolved.add(Aggregation.of(field.get().getPayloadKey(), agg.getOp(), agg.resolvedAlias()));
        }
        return resolved;
    }

    private List<String> resolveFields(String model, List<String> names, List<ValidationError> errors) {
        List<String> keys = new ArrayList<>();
        if (names == null) return keys;
        for (String name : names) {
            Optional<ResolvedField> field = schemaCatalog.resolveField(model, name);
            if (field.isPresent()) {
                keys.add(field.get().getPayloadKey());
            } else {
                errors.add(ValidationError.withSuggestions(name, null,
                        "unknown group by field '" + name + "'", schemaCatalog.suggestSimilar(model, name)));
            }
        }
        return keys;
    }
}
