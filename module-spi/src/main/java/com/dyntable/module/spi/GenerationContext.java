package com.dyntable.module.spi;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Random;

/**
 * Input handed to a {@link ValueGenerator} for every generated cell.
 */
@Value
@Builder
public class GenerationContext {

    Random random;
    int rowIndex;
    String columnName;
    @Singular
    Map<String, Object> options;

    public String stringOption(String key, String fallback) {
        Object value = options.get(key);
        return value != null ? String.valueOf(value) : fallback;
    }

    public int intOption(String key, int fallback) {
        Object value = options.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(String.valueOf(value).trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }
}
