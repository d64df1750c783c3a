package com.dyntable.tableservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableDeletionResult {

    private String tableId;

    private long deletedRows;

    /**
     * 后续清理步骤的失败信息；无论如何表本身已删除
     */
    private List<String> warnings;
}
