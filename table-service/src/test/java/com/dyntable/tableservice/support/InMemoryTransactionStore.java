package com.dyntable.tableservice.support;

import com.dyntable.tableservice.entity.InventoryTransaction;
import com.dyntable.tableservice.repository.InventoryTransactionStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class InMemoryTransactionStore implements InventoryTransactionStore {

    private final List<InventoryTransaction> transactions = new ArrayList<>();
    private boolean failing;

    /**
     * While set, every append throws as if the ledger database were unreachable.
     */
    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public InventoryTransaction append(InventoryTransaction transaction) {
        if (failing) {
            throw new IllegalStateException("Ledger storage unavailable");
        }
        if (transactions.stream().anyMatch(tx -> tx.getId().equals(transaction.getId()))) {
            throw new IllegalArgumentException("Transaction already recorded: " + transaction.getId());
        }
        transactions.add(transaction);
        return transaction;
    }

    @Override
    public List<InventoryTransaction> findByTable(String tableId) {
        return transactions.stream().filter(tx -> tx.getTableId().equals(tableId)).collect(Collectors.toList());
    }

    @Override
    public List<InventoryTransaction> findByItem(String tableId, String itemId) {
        return transactions.stream()
                .filter(tx -> tx.getTableId().equals(tableId) && tx.getItemId().equals(itemId))
                .collect(Collectors.toList());
    }

    @Override
    public List<InventoryTransaction> findByReference(String referenceId) {
        return transactions.stream()
                .filter(tx -> Objects.equals(tx.getReferenceId(), referenceId))
                .collect(Collectors.toList());
    }

    @Override
    public List<InventoryTransaction> findAll() {
        return List.copyOf(transactions);
    }
}
