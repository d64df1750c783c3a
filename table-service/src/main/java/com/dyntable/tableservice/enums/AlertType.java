package com.dyntable.tableservice.enums;

public enum AlertType {
    LOW_STOCK,
    OUT_OF_STOCK,
    NEGATIVE_STOCK
}
