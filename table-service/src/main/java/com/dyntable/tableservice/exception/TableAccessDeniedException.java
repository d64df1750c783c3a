package com.dyntable.tableservice.exception;

import com.dyntable.tableservice.enums.StatusCategory;

/**
 * 操作者无权读写目标时抛出。默认消息
 * 不会透露目标是否存在
 */
public class TableAccessDeniedException extends TableEngineException {

    public TableAccessDeniedException() {
        this("Access denied");
    }

    public TableAccessDeniedException(String message) {
        super(StatusCategory.ACCESS_DENIED, message);
    }
}
