package com.dyntable.module.spi;

import java.util.Map;
import java.util.Optional;

/**
 * Behaviour attached to a column type identifier.
 *
 * Built-in handlers use their plain tag as {@link #typeId()}; handlers contributed by a
 * module declare only the local tag and are registered as {@code moduleId:tag}.
 */
public interface ColumnTypeHandler {

    /**
     * Local type tag, e.g. {@code email} or {@code did}.
     */
    String typeId();

    String displayName();

    default String category() {
        return "General";
    }

    /**
     * Checks a value that has already been trimmed and is never blank.
     */
    ValidationResult validate(Object value, Map<String, Object> options);

    /**
     * Renders a stored value for display. Blank for {@code null}.
     */
    String format(Object value, Map<String, Object> options);

    /**
     * Converts a validated raw string to the value that gets stored.
     */
    default Object parse(String input, Map<String, Object> options) {
        return input.trim();
    }

    default Optional<ValueGenerator> generator() {
        return Optional.empty();
    }

    default ValidationResult validate(Object value) {
        return validate(value, Map.of());
    }

    default String format(Object value) {
        return format(value, Map.of());
    }
}
