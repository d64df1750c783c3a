package com.dyntable.tableservice.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddColumnRequest {

    /**
     * 显示名称，如 "Unit Price"；存储为驼峰形式
     */
    @NotBlank(message = "Column name is required")
    private String name;

    @NotBlank(message = "Column type is required")
    private String type;

    private boolean required;

    @Builder.Default
    private boolean allowDuplicates = true;

    private String defaultValue;

    private Integer position;
}
