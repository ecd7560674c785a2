package com.gdin.inspection.erpvector.codec;

import lombok.Getter;

/**
 * 存储中的 ID 格式不合法。
 */
@Getter
public class DecodingException extends RuntimeException {
    private final String rawId;

    public DecodingException(String rawId, String message) {
        super(message + ": '" + rawId + "'");
        this.rawId = rawId;
    }
}
