package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.FilterOperator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RowFilter {

    @NotBlank
    private String column;

    @NotNull
    private FilterOperator operator;

    private Object value;
}
