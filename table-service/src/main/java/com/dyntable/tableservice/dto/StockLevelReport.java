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
public class StockLevelReport {

    private int threshold;

    private int tablesScanned;

    private int itemsScanned;

    private List<InventoryAlert> alerts;
}
