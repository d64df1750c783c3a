package com.dyntable.tableservice.enums;

public enum FilterOperator {
    EQ,
    CONTAINS,
    GT,
    LT,
    EMPTY,
    NOT_EMPTY
}
