package com.dyntable.tableservice.service.registry.builtin;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.module.spi.ValueGenerator;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 用单个谓词校验的字符串类型：email、url、phone、color
 */
public class PatternColumnType implements ColumnTypeHandler {

    private final String typeId;
    private final String displayName;
    private final Predicate<String> accepts;
    private final String error;
    private final Function<String, String> suggestion;
    private final ValueGenerator generator;

    public PatternColumnType(String typeId, String displayName, Predicate<String> accepts, String error,
                             Function<String, String> suggestion, ValueGenerator generator) {
        this.typeId = typeId;
        this.displayName = displayName;
        this.accepts = accepts;
        this.error = error;
        this.suggestion = suggestion;
        this.generator = generator;
    }

    @Override
    public String typeId() {
        return typeId;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public String category() {
        return "Contact & Web";
    }

    @Override
    public ValidationResult validate(Object value, Map<String, Object> options) {
        String text = String.valueOf(value);
        if (accepts.test(text)) {
            return ValidationResult.ok();
        }
        return ValidationResult.failure(error, suggestion.apply(text));
    }

    @Override
    public String format(Object value, Map<String, Object> options) {
        return value == null ? "" : String.valueOf(value);
    }

    @Override
    public Optional<ValueGenerator> generator() {
        return Optional.ofNullable(generator);
    }
}
