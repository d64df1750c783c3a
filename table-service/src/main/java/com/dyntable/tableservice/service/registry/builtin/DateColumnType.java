package com.dyntable.tableservice.service.registry.builtin;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.module.spi.ValueGenerator;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * 日历日期，以 ISO {@code yyyy-MM-dd} 字符串存储
 */
public class DateColumnType implements ColumnTypeHandler {

    @Override
    public String typeId() {
        return "date";
    }

    @Override
    public String displayName() {
        return "Date";
    }

    @Override
    public String category() {
        return "Date & Time";
    }

    @Override
    public ValidationResult validate(Object value, Map<String, Object> options) {
        if (value instanceof LocalDate || DateFormats.parse(String.valueOf(value)).isPresent()) {
            return ValidationResult.ok();
        }
        return ValidationResult.failure("Invalid date format (use YYYY-MM-DD)",
                "Use format: YYYY-MM-DD (e.g., 2024-01-15)");
    }

    @Override
    public Object parse(String input, Map<String, Object> options) {
        return DateFormats.parse(input)
                .map(DateFormats::toIso)
                .orElseThrow(() -> new IllegalArgumentException("Not a date: " + input));
    }

    @Override
    public String format(Object value, Map<String, Object> options) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDate date) {
            return DateFormats.toIso(date);
        }
        return DateFormats.parse(String.valueOf(value)).map(DateFormats::toIso).orElse(String.valueOf(value));
    }

    @Override
    public Optional<ValueGenerator> generator() {
        return Optional.of(context -> DateFormats.toIso(
                LocalDate.of(2024, 1, 1).plusDays(context.getRandom().nextInt(730))));
    }
}
