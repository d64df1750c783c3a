package com.dyntable.tableservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个被拒绝的字段：字段名、出错的输入和可读的原因
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldError {

    private String field;

    private Object value;

    private String reason;
}
