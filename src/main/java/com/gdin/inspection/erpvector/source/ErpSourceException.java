package com.gdin.inspection.erpvector.source;

/**
 * ERP 返回的业务错误，不重试。
 */
public class ErpSourceException extends RuntimeException {
    public ErpSourceException(String message) {
        super(message);
    }
}
