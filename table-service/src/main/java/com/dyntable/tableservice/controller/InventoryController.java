package com.dyntable.tableservice.controller;

import com.dyntable.tableservice.dto.InventoryAnalytics;
import com.dyntable.tableservice.dto.ItemInventorySummary;
import com.dyntable.tableservice.dto.StockAdjustmentRequest;
import com.dyntable.tableservice.dto.StockLevelReport;
import com.dyntable.tableservice.dto.TableInventorySummary;
import com.dyntable.tableservice.dto.TransactionPage;
import com.dyntable.tableservice.dto.TransactionQuery;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.InventoryTransaction;
import com.dyntable.tableservice.enums.TransactionType;
import com.dyntable.tableservice.exception.TableAccessDeniedException;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.security.TableAccessGuard;
import com.dyntable.tableservice.service.inventory.InventoryLedgerService;
import com.dyntable.tableservice.service.purchase.PurchaseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 库存流水查询、库存告警和手工库存调整
 * 指定表的查询需要该表的读权限；不指定表的查询仅限管理员
 */
@Slf4j
@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryLedgerService ledgerService;
    private final PurchaseService purchaseService;
    private final TableAccessGuard accessGuard;

    @GetMapping("/tables/{tableId}/summary")
    public ResponseEntity<TableInventorySummary> tableSummary(@PathVariable String tableId, Actor actor) {
        accessGuard.requireReadable(tableId, actor);
        return ResponseEntity.ok(ledgerService.summaryForTable(tableId));
    }

    @GetMapping("/tables/{tableId}/items/{itemId}/summary")
    public ResponseEntity<ItemInventorySummary> itemSummary(@PathVariable String tableId,
                                                            @PathVariable String itemId, Actor actor) {
        accessGuard.requireReadable(tableId, actor);
        return ResponseEntity.ok(ledgerService.summaryForItem(tableId, itemId));
    }

    @GetMapping("/stock-levels")
    public ResponseEntity<StockLevelReport> stockLevels(@RequestParam(required = false) Integer threshold,
                                                        @RequestParam(required = false) String tableId,
                                                        Actor actor) {
        return ResponseEntity.ok(ledgerService.checkStockLevels(threshold, tableId, actor));
    }

    @GetMapping("/transactions")
    public ResponseEntity<TransactionPage> listTransactions(
            @RequestParam(required = false) String tableId,
            @RequestParam(required = false) String itemId,
            @RequestParam(required = false) TransactionType type,
            @RequestParam(required = false) String createdBy,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size,
            Actor actor) {
        requireScope(tableId, actor);
        TransactionQuery query = TransactionQuery.builder()
                .tableId(tableId)
                .itemId(itemId)
                .type(type)
                .createdBy(createdBy)
                .from(from)
                .to(to)
                .page(page)
                .size(size)
                .build();
        return ResponseEntity.ok(ledgerService.listTransactions(query));
    }

    @GetMapping("/transactions/by-reference/{referenceId}")
    public ResponseEntity<List<InventoryTransaction>> transactionsForReference(@PathVariable String referenceId,
                                                                               Actor actor) {
        requireScope(null, actor);
        return ResponseEntity.ok(ledgerService.transactionsForReference(referenceId));
    }

    @GetMapping("/analytics")
    public ResponseEntity<InventoryAnalytics> analytics(@RequestParam(required = false) String tableId,
                                                        Actor actor) {
        requireScope(tableId, actor);
        return ResponseEntity.ok(ledgerService.analytics(tableId));
    }

    @PostMapping("/adjustments")
    public ResponseEntity<DataRow> adjustStock(@Valid @RequestBody StockAdjustmentRequest request, Actor actor) {
        return ResponseEntity.ok(purchaseService.adjustStock(request, actor));
    }

    private void requireScope(String tableId, Actor actor) {
        if (tableId != null) {
            accessGuard.requireReadable(tableId, actor);
        } else if (!actor.isAdmin()) {
            log.warn("Non-admin {} requested the global ledger", actor.getId());
            throw new TableAccessDeniedException("Global ledger queries require an administrator");
        }
    }
}
