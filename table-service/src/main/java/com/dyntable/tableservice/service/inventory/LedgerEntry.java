package com.dyntable.tableservice.service.inventory;

import com.dyntable.tableservice.enums.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 要追加到流水的内容。{@code quantityChange} 和快照都是可选的
 */
@Value
@Builder
public class LedgerEntry {

    String tableId;
    String tableName;
    String itemId;
    TransactionType type;
    Long quantityChange;
    Map<String, Object> previousData;
    Map<String, Object> newData;
    String actorId;
    String referenceId;
    String note;
}
