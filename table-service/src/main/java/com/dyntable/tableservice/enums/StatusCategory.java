package com.dyntable.tableservice.enums;

/**
 * 引擎公开操作的结果类别；调用方自行映射到传输层
 */
public enum StatusCategory {
    OK(200),
    CREATED(201),
    VALIDATION_FAILED(400),
    ACCESS_DENIED(403),
    NOT_FOUND(404),
    CONFLICT(409),
    INTERNAL(500);

    private final int httpStatus;

    StatusCategory(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
