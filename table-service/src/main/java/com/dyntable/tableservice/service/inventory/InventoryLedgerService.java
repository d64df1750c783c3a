package com.dyntable.tableservice.service.inventory;

import com.dyntable.tableservice.config.EngineProperties;
import com.dyntable.tableservice.dto.InventoryAlert;
import com.dyntable.tableservice.dto.InventoryAnalytics;
import com.dyntable.tableservice.dto.ItemActivity;
import com.dyntable.tableservice.dto.ItemInventorySummary;
import com.dyntable.tableservice.dto.StockLevelReport;
import com.dyntable.tableservice.dto.TableInventorySummary;
import com.dyntable.tableservice.dto.TransactionPage;
import com.dyntable.tableservice.dto.TransactionQuery;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.InventoryTransaction;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.AlertType;
import com.dyntable.tableservice.enums.ColumnRole;
import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.enums.TransactionType;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.repository.InventoryTransactionStore;
import com.dyntable.tableservice.repository.TableDataStore;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.security.TableAccessGuard;
import com.dyntable.tableservice.service.message.EngineEventPublisher;
import com.dyntable.tableservice.util.RowValues;
import com.dyntable.tableservice.util.SnowflakeIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 只追加的库存流水及其派生视图
 *
 * 当前库存从不从这里读取：{@link #checkStockLevels} 扫描行上的实时数量，
 * 汇总和分析则按需对历史流水做聚合
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryLedgerService {

    private static final int MOST_ACTIVE_LIMIT = 10;

    private final InventoryTransactionStore transactionStore;
    private final TableDataStore tableStore;
    private final TableAccessGuard accessGuard;
    private final EngineEventPublisher eventPublisher;
    private final SnowflakeIdGenerator idGenerator;
    private final EngineProperties properties;

    public InventoryTransaction record(LedgerEntry entry) {
        InventoryTransaction transaction = InventoryTransaction.builder()
                .id(idGenerator.nextId("tx"))
                .tableId(entry.getTableId())
                .tableName(entry.getTableName())
                .itemId(entry.getItemId())
                .transactionType(entry.getType())
                .quantityChange(entry.getQuantityChange())
                .previousData(copy(entry.getPreviousData()))
                .newData(copy(entry.getNewData()))
                .referenceId(entry.getReferenceId())
                .note(entry.getNote())
                .createdBy(entry.getActorId())
                .createdAt(LocalDateTime.now())
                .build();

        InventoryTransaction saved = transactionStore.append(transaction);
        log.info("Recorded inventory transaction {}: table={}, item={}, type={}, change={}",
                saved.getId(), saved.getTableId(), saved.getItemId(), saved.getTransactionType(),
                saved.getQuantityChange());

        try {
            eventPublisher.publishTransactionRecorded(saved);
        } catch (RuntimeException e) {
            log.warn("Transaction {} recorded but its event was not published: {}", saved.getId(), e.getMessage());
        }
        return saved;
    }

    public ItemInventorySummary summaryForItem(String tableId, String itemId) {
        List<InventoryTransaction> transactions = transactionStore.findByItem(tableId, itemId);
        return summarize(tableId, itemId, transactions);
    }

    public TableInventorySummary summaryForTable(String tableId) {
        List<InventoryTransaction> transactions = transactionStore.findByTable(tableId);

        Map<String, List<InventoryTransaction>> byItem = transactions.stream()
                .collect(Collectors.groupingBy(InventoryTransaction::getItemId, LinkedHashMap::new, Collectors.toList()));
        List<ItemInventorySummary> items = byItem.entrySet().stream()
                .map(e -> summarize(tableId, e.getKey(), e.getValue()))
                .collect(Collectors.toList());

        return TableInventorySummary.builder()
                .tableId(tableId)
                .tableName(latestTableName(tableId, transactions))
                .itemCount(items.size())
                .transactionCount(transactions.size())
                .countsByType(countByType(transactions))
                .netQuantityChange(sumChanges(transactions))
                .lastActivity(transactions.stream().map(InventoryTransaction::getCreatedAt)
                        .filter(Objects::nonNull).max(Comparator.naturalOrder()).orElse(null))
                .items(items)
                .build();
    }

    /**
     * 扫描操作者可读的销售表中各行的当前数量
     *
     * @param threshold 小于等于该值的数量会被报告；null 时使用配置的默认值
     * @param tableId   只扫描操作者可读的这一张销售表；null 时扫描所有可读的销售表
     */
    public StockLevelReport checkStockLevels(Integer threshold, String tableId, Actor actor) {
        int limit = threshold != null ? threshold : properties.getInventory().getLowStockThreshold();
        if (limit < 0) {
            throw new ValidationException("Threshold must not be negative");
        }

        List<UserTable> tables;
        if (tableId != null) {
            UserTable table = accessGuard.requireReadable(tableId, actor);
            if (table.getPurpose() != TablePurpose.SALE) {
                throw new ValidationException("Stock levels are only tracked for sale tables");
            }
            tables = List.of(table);
        } else {
            tables = tableStore.findTables(TablePurpose.SALE).stream()
                    .filter(table -> accessGuard.canRead(table, actor))
                    .collect(Collectors.toList());
        }

        List<InventoryAlert> alerts = new ArrayList<>();
        int itemsScanned = 0;
        BigDecimal limitValue = BigDecimal.valueOf(limit);
        for (UserTable table : tables) {
            for (DataRow row : tableStore.findRows(table.getId())) {
                Optional<BigDecimal> quantity = ColumnRole.QUANTITY.findKey(row.getData())
                        .flatMap(key -> RowValues.toDecimal(row.getData().get(key)));
                if (quantity.isEmpty()) {
                    continue;
                }
                itemsScanned++;
                BigDecimal qty = quantity.get();
                AlertType alertType = qty.signum() < 0 ? AlertType.NEGATIVE_STOCK
                        : qty.signum() == 0 ? AlertType.OUT_OF_STOCK
                        : qty.compareTo(limitValue) <= 0 ? AlertType.LOW_STOCK
                        : null;
                if (alertType != null) {
                    alerts.add(InventoryAlert.builder()
                            .tableId(table.getId())
                            .tableName(table.getName())
                            .itemId(row.getId())
                            .itemName(itemName(row))
                            .currentQuantity(qty)
                            .threshold(limit)
                            .alertType(alertType)
                            .build());
                }
            }
        }
        log.debug("Stock check over {} tables, {} items: {} alerts", tables.size(), itemsScanned, alerts.size());
        return StockLevelReport.builder()
                .threshold(limit)
                .tablesScanned(tables.size())
                .itemsScanned(itemsScanned)
                .alerts(alerts)
                .build();
    }

    public TransactionPage listTransactions(TransactionQuery query) {
        if (query.getPage() < 0 || query.getSize() < 1) {
            throw new ValidationException("Page must be >= 0 and size >= 1");
        }
        List<InventoryTransaction> source;
        if (query.getTableId() != null && query.getItemId() != null) {
            source = transactionStore.findByItem(query.getTableId(), query.getItemId());
        } else if (query.getTableId() != null) {
            source = transactionStore.findByTable(query.getTableId());
        } else {
            source = transactionStore.findAll();
        }

        List<InventoryTransaction> matching = source.stream()
                .filter(tx -> query.getItemId() == null || query.getItemId().equals(tx.getItemId()))
                .filter(tx -> query.getType() == null || query.getType() == tx.getTransactionType())
                .filter(tx -> query.getCreatedBy() == null || query.getCreatedBy().equals(tx.getCreatedBy()))
                .filter(tx -> query.getFrom() == null || !tx.getCreatedAt().isBefore(query.getFrom()))
                .filter(tx -> query.getTo() == null || !tx.getCreatedAt().isAfter(query.getTo()))
                .sorted(Comparator.comparing(InventoryTransaction::getCreatedAt).reversed())
                .collect(Collectors.toList());

        int from = Math.min(query.getPage() * query.getSize(), matching.size());
        int to = Math.min(from + query.getSize(), matching.size());
        return TransactionPage.builder()
                .transactions(matching.subList(from, to))
                .page(query.getPage())
                .size(query.getSize())
                .total(matching.size())
                .totalPages((matching.size() + query.getSize() - 1) / query.getSize())
                .build();
    }

    public List<InventoryTransaction> transactionsForReference(String referenceId) {
        return transactionStore.findByReference(referenceId);
    }

    public InventoryAnalytics analytics(String tableId) {
        List<InventoryTransaction> transactions = tableId != null
                ? transactionStore.findByTable(tableId)
                : transactionStore.findAll();

        Map<TransactionType, Long> changeByType = new EnumMap<>(TransactionType.class);
        for (TransactionType type : TransactionType.values()) {
            changeByType.put(type, 0L);
        }
        Map<String, ItemActivity> activity = new LinkedHashMap<>();
        for (InventoryTransaction tx : transactions) {
            long change = tx.getQuantityChange() != null ? tx.getQuantityChange() : 0L;
            changeByType.merge(tx.getTransactionType(), change, Long::sum);

            ItemActivity item = activity.computeIfAbsent(tx.getTableId() + "/" + tx.getItemId(),
                    key -> ItemActivity.builder()
                            .tableId(tx.getTableId())
                            .itemId(tx.getItemId())
                            .build());
            item.setTableName(tx.getTableName());
            item.setTransactionCount(item.getTransactionCount() + 1);
            item.setNetQuantityChange(item.getNetQuantityChange() + change);
        }

        List<ItemActivity> mostActive = activity.values().stream()
                .sorted(Comparator.comparingLong(ItemActivity::getTransactionCount).reversed())
                .limit(MOST_ACTIVE_LIMIT)
                .collect(Collectors.toList());

        return InventoryAnalytics.builder()
                .tableId(tableId)
                .totalTransactions(transactions.size())
                .countsByType(countByType(transactions))
                .quantityChangeByType(changeByType)
                .mostActiveItems(mostActive)
                .build();
    }

    private ItemInventorySummary summarize(String tableId, String itemId, List<InventoryTransaction> transactions) {
        long added = 0;
        long removed = 0;
        LocalDateTime first = null;
        LocalDateTime last = null;
        for (InventoryTransaction tx : transactions) {
            Long change = tx.getQuantityChange();
            if (change != null && change > 0) {
                added += change;
            } else if (change != null && change < 0) {
                removed -= change;
            }
            LocalDateTime at = tx.getCreatedAt();
            if (at != null && (first == null || at.isBefore(first))) {
                first = at;
            }
            if (at != null && (last == null || at.isAfter(last))) {
                last = at;
            }
        }
        return ItemInventorySummary.builder()
                .tableId(tableId)
                .tableName(latestTableName(tableId, transactions))
                .itemId(itemId)
                .transactionCount(transactions.size())
                .countsByType(countByType(transactions))
                .netQuantityChange(added - removed)
                .totalAdded(added)
                .totalRemoved(removed)
                .firstActivity(first)
                .lastActivity(last)
                .build();
    }

    private String latestTableName(String tableId, List<InventoryTransaction> transactions) {
        if (!transactions.isEmpty()) {
            return transactions.get(transactions.size() - 1).getTableName();
        }
        return tableStore.findTable(tableId).map(UserTable::getName).orElse(null);
    }

    private static Map<TransactionType, Long> countByType(List<InventoryTransaction> transactions) {
        Map<TransactionType, Long> counts = new EnumMap<>(TransactionType.class);
        for (TransactionType type : TransactionType.values()) {
            counts.put(type, 0L);
        }
        transactions.forEach(tx -> counts.merge(tx.getTransactionType(), 1L, Long::sum));
        return counts;
    }

    private static long sumChanges(List<InventoryTransaction> transactions) {
        return transactions.stream()
                .map(InventoryTransaction::getQuantityChange)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .sum();
    }

    private static String itemName(DataRow row) {
        Object name = row.getData().get("name");
        return name != null ? String.valueOf(name) : null;
    }

    private static Map<String, Object> copy(Map<String, Object> data) {
        return data == null ? null : new LinkedHashMap<>(data);
    }
}
