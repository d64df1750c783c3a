package com.dyntable.tableservice.service.coercion;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 转换后的值，或无法转换的原因
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CoercionResult {

    boolean success;
    Object value;
    String error;
    String suggestion;

    public static CoercionResult of(Object value) {
        return new CoercionResult(true, value, null, null);
    }

    public static CoercionResult failure(String error, String suggestion) {
        return new CoercionResult(false, null, error, suggestion);
    }

    /**
     * 附带修改建议的错误文本，可直接显示在字段旁
     */
    public String describeError() {
        if (success) {
            return null;
        }
        return suggestion == null ? error : error + ". " + suggestion;
    }
}
