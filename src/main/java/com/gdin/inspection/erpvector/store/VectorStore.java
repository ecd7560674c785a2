package com.gdin.inspection.erpvector.store;

import com.gdin.inspection.erpvector.filter.NativeFilter;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 向量库最小契约。所有模型的点位放在同一个 collection 中。
 * 实现方的每个方法都可能因网络失败抛 {@link com.gdin.inspection.erpvector.exception.TransientIoException}，由调用方决定重试。
 */
public interface VectorStore {

    /**
     * 按 chunkSize 分批写入（同 ID 覆盖）
     * @return 写入条数
     */
    long upsert(List<StorePoint> points, int chunkSize);

    /**
     * 按点位 ID 升序分页读取
     */
    ScrollPage scroll(ScrollRequest request);

    /**
     * 统计匹配点位数
     * @param exact false 时允许返回估计值
     */
    long count(NativeFilter filter, boolean exact);

    /**
     * @return 删除条数（实现无法给出时返回 -1）
     */
    long deleteByFilter(NativeFilter filter);

    void createPayloadIndex(String field, PayloadIndexType type);

    CollectionInfo getCollectionInfo();

    /**
     * 按 ID 批量取回，不存在的 ID 不出现在结果中
     */
    List<StorePoint> retrieve(Collection<String> ids, boolean withPayload);

    /**
     * 只更新 payload，不重新计算向量
     * @return 点位不存在时返回 false
     */
    boolean setPayload(String id, Map<String, Object> values);
}
