package com.gdin.inspection.erpvector.util;

import cn.hutool.core.collection.CollectionUtil;
import com.google.gson.JsonObject;
import io.milvus.orm.iterator.QueryIterator;
import io.milvus.response.QueryResultsWrapper;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.QueryIteratorReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.response.UpsertResp;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class MilvusUtil {

    public static long upsertByBatch(MilvusClientV2 client, String collectionName, List<JsonObject> datas, int batchSize) {
        if (CollectionUtil.isEmpty(datas)) return 0L;

        long total = 0L;
        for (int i = 0; i < datas.size(); i += batchSize) {
            List<JsonObject> subList = datas.subList(i, Math.min(i + batchSize, datas.size()));
            UpsertResp resp = client.upsert(UpsertReq.builder()
                    .collectionName(collectionName)
                    .data(subList)
                    .build());
            total += resp.getUpsertCnt();
        }
        return total;
    }

    /**
     * 用 QueryIterator 取一页，结果按主键升序
     */
    public static List<QueryResultsWrapper.RowRecord> queryOrderedPage(MilvusClientV2 client, String collectionName,
                                                                       String expr, List<String> outputFields, int size) {
        QueryIteratorReq req = QueryIteratorReq.builder()
                .collectionName(collectionName)
                .expr(expr)
                .outputFields(outputFields)
                .batchSize(size)
                .limit(size)
                .build();
        QueryIterator iterator = client.queryIterator(req);
        List<QueryResultsWrapper.RowRecord> rows = new ArrayList<>();
        try {
            while (rows.size() < size) {
                List<QueryResultsWrapper.RowRecord> batch = iterator.next();
                if (CollectionUtil.isEmpty(batch)) break;
                rows.addAll(batch);
            }
        } finally {
            iterator.close();
        }
        return rows.size() > size ? rows.subList(0, size) : rows;
    }
}
