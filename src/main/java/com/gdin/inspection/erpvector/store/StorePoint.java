package com.gdin.inspection.erpvector.store;

import com.gdin.inspection.erpvector.codec.PointAddress;
import com.gdin.inspection.erpvector.codec.PointAddressCodec;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorePoint {
    public static final String POINT_ID = "point_id";

    private String id;
    /** 未取向量时为空 */
    private List<Float> vector;
    private PointPayload payload;

    /**
     * 供过滤使用的扁平视图，包含 point_id
     */
    public Map<String, Object> payloadView() {
        Map<String, Object> view = new LinkedHashMap<>(payload == null ? Map.of() : payload.toMap());
        view.put(POINT_ID, id);
        return view;
    }

    public PointAddress address() {
        return PointAddressCodec.decode(id);
    }
}
