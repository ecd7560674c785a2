package com.gdin.inspection.erpvector.filter;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 过滤条件校验失败，整个请求不做任何部分应用。
 */
@Getter
public class FilterValidationException extends RuntimeException {
    private final List<ValidationError> errors;

    public FilterValidationException(List<ValidationError> errors) {
        super(errors.stream().map(ValidationError::toString).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }
}
