package com.dyntable.tableservice.dto;

import com.dyntable.tableservice.entity.InventoryTransaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionPage {

    private List<InventoryTransaction> transactions;

    private int page;

    private int size;

    private long total;

    private int totalPages;
}
