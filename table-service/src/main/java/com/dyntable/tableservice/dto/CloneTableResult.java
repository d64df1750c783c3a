package com.dyntable.tableservice.dto;

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
public class CloneTableResult {

    private UserTable table;

    private int copiedColumns;

    private int copiedRows;

    private List<String> warnings;
}
