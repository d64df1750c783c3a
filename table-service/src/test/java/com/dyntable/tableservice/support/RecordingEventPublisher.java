package com.dyntable.tableservice.support;

import com.dyntable.tableservice.entity.InventoryTransaction;
import com.dyntable.tableservice.exception.InternalEngineException;
import com.dyntable.tableservice.service.message.EngineEventPublisher;

import java.util.ArrayList;
import java.util.List;

public class RecordingEventPublisher implements EngineEventPublisher {

    private final List<InventoryTransaction> transactions = new ArrayList<>();
    private final List<String> deletedTables = new ArrayList<>();
    private boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public List<InventoryTransaction> getTransactions() {
        return transactions;
    }

    public List<String> getDeletedTables() {
        return deletedTables;
    }

    @Override
    public void publishTransactionRecorded(InventoryTransaction transaction) {
        if (failing) {
            throw new InternalEngineException("Broker unavailable");
        }
        transactions.add(transaction);
    }

    @Override
    public void publishTableDeleted(String tableId, String tableName) {
        if (failing) {
            throw new InternalEngineException("Broker unavailable");
        }
        deletedTables.add(tableId);
    }
}
