package com.dyntable.tableservice.util;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 比较和读取带类型行值的工具方法
 */
public final class RowValues {

    private RowValues() {
    }

    public static boolean isBlank(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    /**
     * 数值按数值比较（5 与 5.0 相等），其他按字符串形式比较
     */
    public static boolean sameValue(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number && b instanceof Number) {
            return toDecimal(a).map(x -> toDecimal(b).map(y -> x.compareTo(y) == 0).orElse(false)).orElse(false);
        }
        return String.valueOf(a).equals(String.valueOf(b));
    }

    public static Optional<BigDecimal> toDecimal(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof BigDecimal d) {
            return Optional.of(d);
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return Optional.empty();
        }
        if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return Optional.empty();
        }
        String text = String.valueOf(value).trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * 数值的规范存储形式：整数为 Long，小数为 Double
     */
    public static Number normalize(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0 && stripped.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0
                && stripped.compareTo(BigDecimal.valueOf(Long.MIN_VALUE)) >= 0) {
            return stripped.longValueExact();
        }
        return value.doubleValue();
    }
}
