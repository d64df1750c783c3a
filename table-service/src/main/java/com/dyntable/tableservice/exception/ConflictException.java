package com.dyntable.tableservice.exception;

import com.dyntable.tableservice.dto.FieldError;
import com.dyntable.tableservice.enums.StatusCategory;

import java.util.List;

/**
 * 写入违反唯一性规则时抛出（重复的列值或列名）
 */
public class ConflictException extends TableEngineException {

    private final List<FieldError> errors;

    public ConflictException(String message) {
        this(message, List.of());
    }

    public ConflictException(String message, List<FieldError> errors) {
        super(StatusCategory.CONFLICT, message);
        this.errors = List.copyOf(errors);
    }

    @Override
    public List<FieldError> getErrors() {
        return errors;
    }
}
