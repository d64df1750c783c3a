package com.dyntable.tableservice.service.inventory;

import com.dyntable.tableservice.entity.InventoryTransaction;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.ColumnRole;
import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.enums.TransactionType;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.service.row.MutationOptions;
import com.dyntable.tableservice.util.RowValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

/**
 * 将已接受的销售表行写入转换为库存流水
 *
 * 在行写入存储后执行。追加失败只记录为降级，
 * 不向上抛出：行写入保持有效
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InventoryTracker {

    private final InventoryLedgerService ledgerService;

    public Optional<InventoryTransaction> rowCreated(UserTable table, String rowId, Map<String, Object> data,
                                                     Actor actor, MutationOptions options) {
        // 没有数量的销售行按一件计
        return track(table, rowId, TransactionType.ADD, Optional.of(quantityOf(data).orElse(1L)), null, data,
                actor, options);
    }

    public Optional<InventoryTransaction> rowUpdated(UserTable table, String rowId, Map<String, Object> previous,
                                                     Map<String, Object> current, Actor actor, MutationOptions options) {
        Long delta = null;
        Optional<Long> before = quantityOf(previous);
        Optional<Long> after = quantityOf(current);
        if (before.isPresent() && after.isPresent()) {
            delta = after.get() - before.get();
        } else if (after.isPresent()) {
            delta = after.get();
        } else if (before.isPresent()) {
            delta = -before.get();
        }
        return track(table, rowId, TransactionType.UPDATE, Optional.ofNullable(delta), previous, current, actor, options);
    }

    public Optional<InventoryTransaction> rowDeleted(UserTable table, String rowId, Map<String, Object> previous,
                                                     Actor actor, MutationOptions options) {
        return track(table, rowId, TransactionType.REMOVE, quantityOf(previous).map(q -> -q), previous, null,
                actor, options);
    }

    private Optional<InventoryTransaction> track(UserTable table, String rowId, TransactionType defaultType,
                                                 Optional<Long> delta, Map<String, Object> previous,
                                                 Map<String, Object> current, Actor actor, MutationOptions options) {
        if (table.getPurpose() != TablePurpose.SALE) {
            return Optional.empty();
        }
        MutationOptions effective = options != null ? options : MutationOptions.none();
        TransactionType type = effective.getLedgerType() != null ? effective.getLedgerType() : defaultType;
        try {
            return Optional.of(ledgerService.record(LedgerEntry.builder()
                    .tableId(table.getId())
                    .tableName(table.getName())
                    .itemId(rowId)
                    .type(type)
                    .quantityChange(delta.orElse(null))
                    .previousData(previous)
                    .newData(current)
                    .actorId(actor.getId())
                    .referenceId(effective.getReferenceId())
                    .note(effective.getNote())
                    .build()));
        } catch (RuntimeException e) {
            log.warn("DEGRADED: row {} in table {} was written but its {} ledger entry failed: {}",
                    rowId, table.getId(), type, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private static Optional<Long> quantityOf(Map<String, Object> data) {
        return ColumnRole.QUANTITY.findKey(data)
                .flatMap(key -> RowValues.toDecimal(data.get(key)))
                .map(InventoryTracker::toLong);
    }

    private static long toLong(BigDecimal value) {
        return value.setScale(0, RoundingMode.HALF_UP).longValue();
    }
}
