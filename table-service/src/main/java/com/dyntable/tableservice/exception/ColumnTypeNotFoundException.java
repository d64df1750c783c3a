package com.dyntable.tableservice.exception;

import com.dyntable.tableservice.enums.StatusCategory;

/**
 * 列类型 id 既不是内置类型，
 * 也不属于当前已激活的模块时抛出
 */
public class ColumnTypeNotFoundException extends TableEngineException {

    private final String typeId;

    public ColumnTypeNotFoundException(String typeId) {
        super(StatusCategory.NOT_FOUND, String.format("Column type not found: %s", typeId));
        this.typeId = typeId;
    }

    public String getTypeId() {
        return typeId;
    }
}
