package com.dyntable.tableservice.repository;

import com.dyntable.tableservice.entity.InventoryTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InventoryTransactionRepository extends JpaRepository<InventoryTransaction, String> {

    List<InventoryTransaction> findByTableIdOrderByCreatedAtAscIdAsc(String tableId);

    List<InventoryTransaction> findByTableIdAndItemIdOrderByCreatedAtAscIdAsc(String tableId, String itemId);

    List<InventoryTransaction> findByReferenceIdOrderByCreatedAtAscIdAsc(String referenceId);

    List<InventoryTransaction> findAllByOrderByCreatedAtAscIdAsc();
}
