package com.dyntable.tableservice.service.registry.builtin;

import com.dyntable.module.spi.ColumnTypeHandler;
import com.dyntable.module.spi.ValidationResult;
import com.dyntable.module.spi.ValueGenerator;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class BooleanColumnType implements ColumnTypeHandler {

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "1", "y", "on");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "0", "n", "off");

    @Override
    public String typeId() {
        return "boolean";
    }

    @Override
    public String displayName() {
        return "Yes / No";
    }

    /**
     * @return {@code value} 表示的布尔值，不是可识别的写法时为空
     */
    public static Optional<Boolean> read(Object value) {
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value == null) {
            return Optional.empty();
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(text)) {
            return Optional.of(Boolean.TRUE);
        }
        if (FALSE_VALUES.contains(text)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    @Override
    public ValidationResult validate(Object value, Map<String, Object> options) {
        if (read(value).isEmpty()) {
            return ValidationResult.failure("Must be true/false, yes/no, or 1/0",
                    "Use one of: true, false, yes, no, 1, 0");
        }
        return ValidationResult.ok();
    }

    @Override
    public Object parse(String input, Map<String, Object> options) {
        return read(input).orElseThrow(() -> new IllegalArgumentException("Not a boolean: " + input));
    }

    @Override
    public String format(Object value, Map<String, Object> options) {
        return read(value).map(b -> b ? "Yes" : "No").orElse("");
    }

    @Override
    public Optional<ValueGenerator> generator() {
        return Optional.of(context -> context.getRandom().nextBoolean());
    }
}
