package com.dyntable.tableservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnNameFixResult {

    /**
     * 每个被重命名列的旧名到新名
     */
    private Map<String, String> renamed;

    private int rowsUpdated;

    private List<String> errors;
}
