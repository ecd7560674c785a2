package com.gdin.inspection.erpvector.codec;

/**
 * 身份分量超出所在段容量。对单条记录是致命的，同步会将该记录标记为失败后继续。
 */
public class EncodingException extends RuntimeException {
    public EncodingException(String message) {
        super(message);
    }
}
