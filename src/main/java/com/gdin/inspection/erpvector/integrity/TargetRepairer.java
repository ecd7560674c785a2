package com.gdin.inspection.erpvector.integrity;

import com.gdin.inspection.erpvector.query.OperationControl;

import java.util.List;

/**
 * 从 ERP 拉取指定记录并写入向量库。
 */
public interface TargetRepairer {

    /**
     * 源记录已删除的不会写入，调用方需回查向量库确认哪些已修复
     * @param control 取消或超时后在批次边界停止，已写入的保留
     * @return 写入条数
     */
    long fetchAndUpsert(String targetModel, List<Long> recordIds, OperationControl control);
}
