package com.gdin.inspection.erpvector.resp;

import lombok.Data;
import lombok.experimental.Accessors;
import org.springframework.http.HttpStatus;

@Data
@Accessors(chain = true)
public class ResultData<T> {

    private int code;

    private String message;

    private T data;

    private long timestamp = System.currentTimeMillis();

    public static <T> ResultData<T> success(T data) {
        return new ResultData<T>()
                .setCode(HttpStatus.OK.value())
                .setMessage(HttpStatus.OK.getReasonPhrase())
                .setData(data);
    }

    public static <T> ResultData<T> fail(int code, String message) {
        return new ResultData<T>().setCode(code).setMessage(message);
    }

    public static <T> ResultData<T> fail(int code, String message, T data) {
        return new ResultData<T>().setCode(code).setMessage(message).setData(data);
    }
}
