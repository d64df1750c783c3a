package com.dyntable.tableservice.repository;

import com.dyntable.tableservice.entity.InventoryTransaction;

import java.util.List;

/**
 * 库存流水的只追加存储，不提供更新和删除
 */
public interface InventoryTransactionStore {

    InventoryTransaction append(InventoryTransaction transaction);

    List<InventoryTransaction> findByTable(String tableId);

    List<InventoryTransaction> findByItem(String tableId, String itemId);

    List<InventoryTransaction> findByReference(String referenceId);

    List<InventoryTransaction> findAll();
}
