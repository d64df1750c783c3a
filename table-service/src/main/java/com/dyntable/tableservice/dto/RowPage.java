package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.entity.DataRow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RowPage {

    private List<DataRow> rows;

    private int page;

    private int size;

    private long totalRows;

    private int totalPages;
}
