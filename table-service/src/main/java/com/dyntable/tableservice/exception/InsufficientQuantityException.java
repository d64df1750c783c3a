package com.dyntable.tableservice.exception;

import com.dyntable.tableservice.dto.FieldError;

import java.math.BigDecimal;
import java.util.List;

/**
 * 商品当前数量不足以满足请求数量时抛出
 */
public class InsufficientQuantityException extends ValidationException {

    private final BigDecimal available;
    private final long requested;

    public InsufficientQuantityException(BigDecimal available, long requested) {
        super(message(available, requested),
                List.of(new FieldError("quantity", requested, message(available, requested))));
        this.available = available;
        this.requested = requested;
    }

    private static String message(BigDecimal available, long requested) {
        return String.format("Insufficient quantity: available %s, requested %d",
                available.stripTrailingZeros().toPlainString(), requested);
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public long getRequested() {
        return requested;
    }
}
