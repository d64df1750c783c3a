package com.dyntable.tableservice.exception;

import com.dyntable.tableservice.enums.StatusCategory;

public class InternalEngineException extends TableEngineException {

    public InternalEngineException(String message) {
        super(StatusCategory.INTERNAL, message);
    }

    public InternalEngineException(String message, Throwable cause) {
        super(StatusCategory.INTERNAL, message, cause);
    }
}
