package com.gdin.inspection.erpvector.source;

import java.util.List;
import java.util.Map;

/**
 * ERP 数据源。网络失败抛 {@link com.gdin.inspection.erpvector.exception.TransientIoException}，
 * 业务错误（权限、模型不存在等）抛 {@link ErpSourceException}。
 */
public interface ErpSourceClient {

    ErpSession authenticate();

    /**
     * @param domain ERP 域表达式，例如 [["id","in",[1,2]]]
     */
    List<Map<String, Object>> searchRead(String model, List<Object> domain, List<String> fields, ReadOptions options);

    long searchCount(String model, List<Object> domain);
}
