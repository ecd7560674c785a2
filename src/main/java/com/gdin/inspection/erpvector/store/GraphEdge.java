package com.gdin.inspection.erpvector.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * 一条已发现的外键关系实例，存放在 graph 命名空间点位的 edges 列表中。
 * 与目标点位当前是否存在无关。
 */
@Value
@Builder
@Jacksonized
public class GraphEdge {
    @JsonProperty("source_id")
    String sourceId;
    @JsonProperty("fk_field")
    String fkField;
    @JsonProperty("target_id")
    String targetId;
    @JsonProperty("target_model")
    String targetModel;
    @With
    @JsonProperty("last_validated_at")
    String lastValidatedAt;
    @With
    @JsonProperty("cardinality_hint")
    String cardinalityHint;
}
