package com.dyntable.tableservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemActivity {

    private String tableId;

    private String tableName;

    private String itemId;

    private long transactionCount;

    private long netQuantityChange;
}
