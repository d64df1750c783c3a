package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.enums.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 单个商品流水历史的汇总视图。不是库存量：当前库存以行数据为准
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemInventorySummary {

    private String tableId;

    private String tableName;

    private String itemId;

    private int transactionCount;

    private Map<TransactionType, Long> countsByType;

    private long netQuantityChange;

    private long totalAdded;

    private long totalRemoved;

    private LocalDateTime firstActivity;

    private LocalDateTime lastActivity;
}
