package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.entity.UserTable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedTableResult {

    private UserTable table;

    private List<TableColumn> columns;

    private int rowsCreated;

    private int rowsFailed;

    private List<String> errors;
}
