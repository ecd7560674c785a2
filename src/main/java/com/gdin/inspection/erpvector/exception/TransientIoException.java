package com.gdin.inspection.erpvector.exception;

/**
 * 外部调用（向量库、embedding、ERP）的暂时性失败，可在调用点重试。
 */
public class TransientIoException extends RuntimeException {
    public TransientIoException(String message) {
        super(message);
    }

    public TransientIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
