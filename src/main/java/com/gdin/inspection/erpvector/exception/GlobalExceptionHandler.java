package com.gdin.inspection.erpvector.exception;

import com.gdin.inspection.erpvector.codec.DecodingException;
import com.gdin.inspection.erpvector.codec.EncodingException;
import com.gdin.inspection.erpvector.filter.FilterValidationException;
import com.gdin.inspection.erpvector.filter.ValidationError;
import com.gdin.inspection.erpvector.resp.ResultData;
import com.gdin.inspection.erpvector.schema.SchemaLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FilterValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ResultData<List<ValidationError>> handleFilterValidation(FilterValidationException e) {
        return ResultData.fail(HttpStatus.BAD_REQUEST.value(), e.getMessage(), e.getErrors());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ResultData<Void> handleBeanValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResultData.fail(HttpStatus.BAD_REQUEST.value(), message);
    }

    @ExceptionHandler({IllegalArgumentException.class, EncodingException.class, DecodingException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ResultData<Void> handleBadRequest(RuntimeException e) {
        return ResultData.fail(HttpStatus.BAD_REQUEST.value(), e.getMessage());
    }

    @ExceptionHandler(ClearDataRefusedException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ResultData<Void> handleRefused(ClearDataRefusedException e) {
        return ResultData.fail(HttpStatus.CONFLICT.value(), e.getMessage());
    }

    @ExceptionHandler(TransientIoException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ResultData<Void> handleTransient(TransientIoException e) {
        log.warn("upstream unavailable: {}", e.getMessage());
        return ResultData.fail(HttpStatus.SERVICE_UNAVAILABLE.value(), e.getMessage());
    }

    @ExceptionHandler({SchemaLoadException.class, IllegalStateException.class})
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ResultData<Void> handleFatal(RuntimeException e) {
        log.error("request failed", e);
        return ResultData.fail(HttpStatus.INTERNAL_SERVER_ERROR.value(), e.getMessage());
    }
}
