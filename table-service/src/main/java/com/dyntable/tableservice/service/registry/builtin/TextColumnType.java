package com.dyntable.tableservice.service.registry.builtin;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.module.spi.ValueGenerator;

import java.util.Map;
import java.util.Optional;

/**
 * 自由文本类型：{@code text}、{@code textarea} 和 {@code select}
 */
public class TextColumnType implements ColumnTypeHandler {

    private final String typeId;
    private final String displayName;
    private final int maxLength;
    private final ValueGenerator generator;

    public TextColumnType(String typeId, String displayName, int maxLength, ValueGenerator generator) {
        this.typeId = typeId;
        this.displayName = displayName;
        this.maxLength = maxLength;
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
        return "Text";
    }

    @Override
    public ValidationResult validate(Object value, Map<String, Object> options) {
        String text = String.valueOf(value);
        if (text.length() > maxLength) {
            return ValidationResult.failure(
                    String.format("Text is too long (%d characters, max %d)", text.length(), maxLength),
                    "Shorten the value");
        }
        return ValidationResult.ok();
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
