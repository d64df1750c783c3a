package com.dyntable.tableservice.dto;

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
public class ImportRequest {

    private List<String> headers;

    @NotNull
    private List<List<Object>> rows;

    /**
     * false 时按位置映射列，忽略 {@code headers}
     */
    private boolean hasHeaders;
}
