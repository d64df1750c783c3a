package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.TransactionType;
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
public class InventoryAnalytics {

    private String tableId;

    private long totalTransactions;

    private Map<TransactionType, Long> countsByType;

    private Map<TransactionType, Long> quantityChangeByType;

    private List<ItemActivity> mostActiveItems;
}
