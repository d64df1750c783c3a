package com.dyntable.tableservice.service.registry.builtin;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.module.spi.ValueGenerator;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * ISO-8601 时间戳，可带或不带时区偏移，规范化为 ISO 形式存储
 */
public class DateTimeColumnType implements ColumnTypeHandler {

    @Override
    public String typeId() {
        return "datetime";
    }

    @Override
    public String displayName() {
        return "Date & Time";
    }

    @Override
    public String category() {
        return "Date & Time";
    }

    @Override
    public ValidationResult validate(Object value, Map<String, Object> options) {
        if (normalize(String.valueOf(value)).isEmpty()) {
            return ValidationResult.failure("Invalid datetime format",
                    "Use ISO format: YYYY-MM-DDTHH:MM:SS (e.g., 2024-01-15T14:30:00)");
        }
        return ValidationResult.ok();
    }

    @Override
    public Object parse(String input, Map<String, Object> options) {
        return normalize(input).orElseThrow(() -> new IllegalArgumentException("Not a datetime: " + input));
    }

    @Override
    public String format(Object value, Map<String, Object> options) {
        return value == null ? "" : String.valueOf(value);
    }

    @Override
    public Optional<ValueGenerator> generator() {
        return Optional.of(context -> LocalDateTime.of(2024, 1, 1, 9, 0)
                .plusMinutes(context.getRandom().nextInt(60 * 24 * 365))
                .toString());
    }

    private static Optional<String> normalize(String text) {
        String value = text.trim();
        try {
            return Optional.of(OffsetDateTime.parse(value).toString());
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(value.replace(' ', 'T')).toString());
            } catch (DateTimeParseException nested) {
                return Optional.empty();
            }
        }
    }
}
