package com.dyntable.tableservice.exception;

import com.dyntable.tableservice.dto.FieldError;
import com.dyntable.tableservice.enums.StatusCategory;

import java.util.List;

/**
 * 引擎向调用方报告的所有失败的基类
 * 每个子类固定 REST 层使用的状态类别
 */
public abstract class TableEngineException extends RuntimeException {

    private final StatusCategory status;

    protected TableEngineException(StatusCategory status, String message) {
        super(message);
        this.status = status;
    }

    protected TableEngineException(StatusCategory status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public StatusCategory getStatus() {
        return status;
    }

    /**
     * 字段级错误明细，失败与具体字段无关时为空
     */
    public List<FieldError> getErrors() {
        return List.of();
    }
}
