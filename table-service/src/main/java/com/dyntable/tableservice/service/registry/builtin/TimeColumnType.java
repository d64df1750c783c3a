package com.dyntable.tableservice.service.registry.builtin;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.module.spi.ValueGenerator;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

public class TimeColumnType implements ColumnTypeHandler {

    private static final Pattern TIME = Pattern.compile("^([01]?[0-9]|2[0-3]):[0-5][0-9](:[0-5][0-9])?$");

    @Override
    public String typeId() {
        return "time";
    }

    @Override
    public String displayName() {
        return "Time";
    }

    @Override
    public String category() {
        return "Date & Time";
    }

    @Override
    public ValidationResult validate(Object value, Map<String, Object> options) {
        if (!TIME.matcher(String.valueOf(value)).matches()) {
            return ValidationResult.failure("Invalid time format (use HH:MM or HH:MM:SS)",
                    "Use format: HH:MM or HH:MM:SS (e.g., 14:30)");
        }
        return ValidationResult.ok();
    }

    @Override
    public String format(Object value, Map<String, Object> options) {
        return value == null ? "" : String.valueOf(value);
    }

    @Override
    public Optional<ValueGenerator> generator() {
        return Optional.of(context -> String.format("%02d:%02d",
                8 + context.getRandom().nextInt(10), context.getRandom().nextInt(4) * 15));
    }
}
