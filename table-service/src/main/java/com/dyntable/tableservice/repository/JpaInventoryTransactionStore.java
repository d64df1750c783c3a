package com.dyntable.tableservice.repository;

import com.dyntable.tableservice.entity.InventoryTransaction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaInventoryTransactionStore implements InventoryTransactionStore {

    private final InventoryTransactionRepository repository;

    @Override
    public InventoryTransaction append(InventoryTransaction transaction) {
        if (repository.existsById(transaction.getId())) {
            throw new IllegalStateException("Ledger entry already exists: " + transaction.getId());
        }
        return repository.save(transaction);
    }

    @Override
    public List<InventoryTransaction> findByTable(String tableId) {
        return repository.findByTableIdOrderByCreatedAtAscIdAsc(tableId);
    }

    @Override
    public List<InventoryTransaction> findByItem(String tableId, String itemId) {
        return repository.findByTableIdAndItemIdOrderByCreatedAtAscIdAsc(tableId, itemId);
    }

    @Override
    public List<InventoryTransaction> findByReference(String referenceId) {
        return repository.findByReferenceIdOrderByCreatedAtAscIdAsc(referenceId);
    }

    @Override
    public List<InventoryTransaction> findAll() {
        return repository.findAllByOrderByCreatedAtAscIdAsc();
    }
}
