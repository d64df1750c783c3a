package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.MassActionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MassActionRequest {

    @NotNull
    private MassActionType action;

    private List<String> rowIds;

    /**
     * 设置后目标为匹配 {@code filters} 的全部行，忽略 {@code rowIds}
     */
    private boolean selectAll;

    @Valid
    private List<RowFilter> filters;

    private String fieldName;

    private Object value;
}
