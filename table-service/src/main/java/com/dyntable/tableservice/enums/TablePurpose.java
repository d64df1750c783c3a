package com.dyntable.tableservice.enums;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 表的用途。销售表和租赁表带有受保护的商业列
 */
public enum TablePurpose {
    DEFAULT(EnumSet.noneOf(ColumnRole.class)),
    SALE(EnumSet.of(ColumnRole.PRICE, ColumnRole.QUANTITY)),
    RENT(EnumSet.of(ColumnRole.PRICE, ColumnRole.FEE, ColumnRole.USED, ColumnRole.AVAILABLE));

    private final Set<ColumnRole> protectedRoles;

    TablePurpose(Set<ColumnRole> protectedRoles) {
        this.protectedRoles = protectedRoles;
    }

    public Set<ColumnRole> getProtectedRoles() {
        return protectedRoles;
    }

    public boolean isProtected(String columnName) {
        return protectedRoles.stream().anyMatch(role -> role.matches(columnName));
    }

    /**
     * 兼容模块表模板使用的小写名称
     */
    public static TablePurpose fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
