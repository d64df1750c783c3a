package com.dyntable.tableservice.enums;

/**
 * PRIVATE: 仅所有者可见
 * PUBLIC: 所有人可读，公开列出
 * SHARED: 持有链接者可读
 */
public enum TableVisibility {
    PRIVATE,
    PUBLIC,
    SHARED;

    public boolean isPubliclyReadable() {
        return this == PUBLIC || this == SHARED;
    }
}
