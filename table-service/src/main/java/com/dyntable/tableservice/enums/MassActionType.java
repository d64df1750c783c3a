package com.dyntable.tableservice.enums;

public enum MassActionType {
    DELETE,
    SET_FIELD_VALUE
}
