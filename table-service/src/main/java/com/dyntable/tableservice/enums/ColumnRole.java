package com.dyntable.tableservice.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 列的商业含义，按约定由列名推断
 */
public enum ColumnRole {
    PRICE("price"),
    QUANTITY("qty", "quantity"),
    FEE("fee"),
    USED("used"),
    AVAILABLE("available");

    private final List<String> names;

    ColumnRole(String... names) {
        this.names = Arrays.asList(names);
    }

    public String canonicalName() {
        return names.get(0);
    }

    public boolean matches(String columnName) {
        return columnName != null && names.stream().anyMatch(name -> name.equalsIgnoreCase(columnName));
    }

    /**
     * 查找行中第一个带有该角色名称的键
     */
    public Optional<String> findKey(Map<String, ?> row) {
        if (row == null) {
            return Optional.empty();
        }
        return row.keySet().stream().filter(this::matches).findFirst();
    }

    public static Optional<ColumnRole> of(String columnName) {
        return Arrays.stream(values()).filter(role -> role.matches(columnName)).findFirst();
    }
}
