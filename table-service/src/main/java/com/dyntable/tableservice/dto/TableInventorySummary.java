package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableInventorySummary {

    private String tableId;

    private String tableName;

    private int itemCount;

    private int transactionCount;

    private Map<TransactionType, Long> countsByType;

    private long netQuantityChange;

    private LocalDateTime lastActivity;

    private List<ItemInventorySummary> items;
}
