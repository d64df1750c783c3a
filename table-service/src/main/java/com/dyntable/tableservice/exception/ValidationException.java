package com.dyntable.tableservice.exception;

import com.dyntable.tableservice.dto.FieldError;
import com.dyntable.tableservice.enums.StatusCategory;

import java.util.List;

/**
 * 输入未通过类型转换、必填校验或其他业务规则时抛出
 * 携带发现的全部字段错误，而不只是第一个
 */
public class ValidationException extends TableEngineException {

    private final List<FieldError> errors;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<FieldError> errors) {
        super(StatusCategory.VALIDATION_FAILED, message);
        this.errors = List.copyOf(errors);
    }

    public static ValidationException forFields(List<FieldError> errors) {
        return new ValidationException(
                String.format("Validation failed for %d field(s)", errors.size()), errors);
    }

    @Override
    public List<FieldError> getErrors() {
        return errors;
    }
}
