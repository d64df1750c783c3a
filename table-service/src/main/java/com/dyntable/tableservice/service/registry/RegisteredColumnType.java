package com.dyntable.tableservice.service.registry;

import com.dyntable.module.spi.ColumnTypeHandler;
import lombok.Value;

/**
 * 注册表视角下的列类型处理器：可解析的 id，
 * 以及模块类型所属的模块
 */
@Value
public class RegisteredColumnType {

    String typeId;
    String moduleId;
    ColumnTypeHandler handler;

    public boolean isBuiltIn() {
        return moduleId == null;
    }
}
