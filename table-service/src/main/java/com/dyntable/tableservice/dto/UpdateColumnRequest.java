package com.dyntable.tableservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 列的部分更新；为 null 的字段保持不变
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateColumnRequest {

    private String name;

    private String type;

    private Boolean required;

    private Boolean allowDuplicates;

    private String defaultValue;

    private Boolean clearDefaultValue;
}
