package com.dyntable.tableservice.service.row;

import com.dyntable.tableservice.config.EngineProperties;
import com.dyntable.tableservice.dto.FieldError;
import com.dyntable.tableservice.dto.MassActionItemResult;
import com.dyntable.tableservice.dto.MassActionRequest;
import com.dyntable.tableservice.dto.MassActionResult;
import com.dyntable.tableservice.dto.RowFilter;
import com.dyntable.tableservice.dto.RowPage;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.MassActionType;
import com.dyntable.tableservice.enums.StatusCategory;
import com.dyntable.tableservice.exception.ResourceNotFoundException;
import com.dyntable.tableservice.exception.TableEngineException;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.repository.TableDataStore;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.security.TableAccessGuard;
import com.dyntable.tableservice.service.inventory.InventoryTracker;
import com.dyntable.tableservice.service.registry.CapabilityRegistry;
import com.dyntable.tableservice.service.registry.CapabilityRegistryFactory;
import com.dyntable.tableservice.util.SnowflakeIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 行的创建、更新、删除和批量操作的唯一入口
 *
 * 每次写入依次执行：权限校验、类型解析与转换、必填校验、
 * 重复值检查、写入存储，最后（仅销售表）追加流水。
 * 外层没有事务：流水只在行写入存储后追加，
 * 追加失败不会撤销行写入
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RowMutationService {

    private final TableDataStore store;
    private final TableAccessGuard accessGuard;
    private final CapabilityRegistryFactory registryFactory;
    private final RowValidator rowValidator;
    private final InventoryTracker inventoryTracker;
    private final SnowflakeIdGenerator idGenerator;
    private final EngineProperties properties;

    public DataRow createRow(String tableId, Map<String, Object> input, Actor actor) {
        return createRow(tableId, input, actor, MutationOptions.none());
    }

    public DataRow createRow(String tableId, Map<String, Object> input, Actor actor, MutationOptions options) {
        UserTable table = accessGuard.requireWritable(tableId, actor);
        List<TableColumn> columns = store.findColumns(tableId);
        return create(table, columns, input, actor, options, registryFactory.snapshot());
    }

    /**
     * 替换行数据。{@code input} 中缺少的列会被清空
     */
    public DataRow updateRow(String tableId, String rowId, Map<String, Object> input, Actor actor) {
        return updateRow(tableId, rowId, input, actor, MutationOptions.none());
    }

    public DataRow updateRow(String tableId, String rowId, Map<String, Object> input, Actor actor,
                             MutationOptions options) {
        UserTable table = accessGuard.requireWritable(tableId, actor);
        DataRow existing = findRow(tableId, rowId);
        List<TableColumn> columns = store.findColumns(tableId);
        return update(table, columns, existing, input, actor, options, registryFactory.snapshot());
    }

    public void deleteRow(String tableId, String rowId, Actor actor) {
        deleteRow(tableId, rowId, actor, MutationOptions.none());
    }

    public void deleteRow(String tableId, String rowId, Actor actor, MutationOptions options) {
        UserTable table = accessGuard.requireWritable(tableId, actor);
        delete(table, findRow(tableId, rowId), actor, options);
    }

    public DataRow getRow(String tableId, String rowId, Actor actor) {
        accessGuard.requireReadable(tableId, actor);
        return findRow(tableId, rowId);
    }

    /**
     * @param page 从 0 开始的页码
     */
    public RowPage listRows(String tableId, List<RowFilter> filters, int page, int size, Actor actor) {
        accessGuard.requireReadable(tableId, actor);
        if (page < 0 || size < 1) {
            throw new ValidationException("Page must be >= 0 and size >= 1");
        }
        List<DataRow> matching = matchingRows(tableId, filters);
        int from = Math.min(page * size, matching.size());
        int to = Math.min(from + size, matching.size());
        log.debug("Listed rows of table {}: {} matching, page {} size {}", tableId, matching.size(), page, size);
        return RowPage.builder()
                .rows(matching.subList(from, to))
                .page(page)
                .size(size)
                .totalRows(matching.size())
                .totalPages((matching.size() + size - 1) / size)
                .build();
    }

    /**
     * 对多行逐条执行同一操作。后面的条目失败时，
     * 已成功的条目保持提交；结果中列出每条的结果
     */
    public MassActionResult executeMassAction(String tableId, MassActionRequest request, Actor actor) {
        UserTable table = accessGuard.requireWritable(tableId, actor);
        List<TableColumn> columns = store.findColumns(tableId);

        if (request.getAction() == MassActionType.SET_FIELD_VALUE) {
            boolean known = columns.stream().anyMatch(c -> c.getName().equals(request.getFieldName()));
            if (!known) {
                throw new ValidationException("Unknown field for mass update",
                        List.of(new FieldError("fieldName", request.getFieldName(), "No such column")));
            }
        }

        List<String> targetIds = resolveTargets(tableId, request, columns);
        int limit = properties.getMassAction().getMaxRows();
        if (targetIds.size() > limit) {
            throw new ValidationException(String.format(
                    "Mass action targets %d rows, the limit is %d", targetIds.size(), limit));
        }

        CapabilityRegistry registry = registryFactory.snapshot();
        List<MassActionItemResult> results = new ArrayList<>();
        for (String rowId : targetIds) {
            results.add(applyToRow(table, columns, rowId, request, actor, registry));
        }

        int succeeded = (int) results.stream().filter(MassActionItemResult::isSuccess).count();
        log.info("Mass action {} on table {} by {}: {} succeeded, {} failed",
                request.getAction(), tableId, actor.getId(), succeeded, results.size() - succeeded);
        return MassActionResult.builder()
                .action(request.getAction())
                .requested(targetIds.size())
                .succeeded(succeeded)
                .failed(results.size() - succeeded)
                .results(results)
                .build();
    }

    DataRow create(UserTable table, List<TableColumn> columns, Map<String, Object> input, Actor actor,
                   MutationOptions options, CapabilityRegistry registry) {
        Map<String, Object> data = rowValidator.validate(table.getId(), columns, input, null, registry);

        LocalDateTime now = LocalDateTime.now();
        DataRow row = store.saveRow(DataRow.builder()
                .id(idGenerator.nextId("row"))
                .tableId(table.getId())
                .data(data)
                .createdBy(actor.getId())
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Created row {} in table {} by {}", row.getId(), table.getId(), actor.getId());

        inventoryTracker.rowCreated(table, row.getId(), row.getData(), actor, options);
        return row;
    }

    DataRow update(UserTable table, List<TableColumn> columns, DataRow existing, Map<String, Object> input,
                   Actor actor, MutationOptions options, CapabilityRegistry registry) {
        Map<String, Object> previous = new LinkedHashMap<>(existing.getData());
        Map<String, Object> data = rowValidator.validate(table.getId(), columns, input, existing, registry);

        DataRow row = store.saveRow(existing.toBuilder()
                .data(data)
                .updatedAt(LocalDateTime.now())
                .build());
        log.info("Updated row {} in table {} by {}", row.getId(), table.getId(), actor.getId());

        inventoryTracker.rowUpdated(table, row.getId(), previous, row.getData(), actor, options);
        return row;
    }

    void delete(UserTable table, DataRow existing, Actor actor, MutationOptions options) {
        store.deleteRow(existing.getId());
        log.info("Deleted row {} from table {} by {}", existing.getId(), table.getId(), actor.getId());

        inventoryTracker.rowDeleted(table, existing.getId(), existing.getData(), actor, options);
    }

    private MassActionItemResult applyToRow(UserTable table, List<TableColumn> columns, String rowId,
                                            MassActionRequest request, Actor actor, CapabilityRegistry registry) {
        try {
            Optional<DataRow> existing = store.findRow(table.getId(), rowId);
            if (existing.isEmpty()) {
                throw new ResourceNotFoundException("Row", rowId);
            }
            if (request.getAction() == MassActionType.DELETE) {
                delete(table, existing.get(), actor, MutationOptions.none());
            } else {
                Map<String, Object> input = new LinkedHashMap<>(existing.get().getData());
                input.put(request.getFieldName(), request.getValue());
                update(table, columns, existing.get(), input, actor, MutationOptions.none(), registry);
            }
            return MassActionItemResult.builder()
                    .rowId(rowId)
                    .success(true)
                    .status(StatusCategory.OK)
                    .build();
        } catch (TableEngineException e) {
            log.debug("Mass action item {} failed: {}", rowId, e.getMessage());
            return MassActionItemResult.builder()
                    .rowId(rowId)
                    .success(false)
                    .status(e.getStatus())
                    .message(e.getMessage())
                    .errors(e.getErrors())
                    .build();
        }
    }

    private List<String> resolveTargets(String tableId, MassActionRequest request, List<TableColumn> columns) {
        if (request.isSelectAll()) {
            // 目标行来自当前过滤条件，而不是客户端提交的 id
            return store.findRows(tableId).stream()
                    .filter(RowFilters.compile(request.getFilters(), columns))
                    .map(DataRow::getId)
                    .collect(Collectors.toList());
        }
        if (request.getRowIds() == null || request.getRowIds().isEmpty()) {
            throw new ValidationException("No rows selected");
        }
        return request.getRowIds().stream().distinct().collect(Collectors.toList());
    }

    private List<DataRow> matchingRows(String tableId, List<RowFilter> filters) {
        List<TableColumn> columns = store.findColumns(tableId);
        return store.findRows(tableId).stream()
                .filter(RowFilters.compile(filters, columns))
                .collect(Collectors.toList());
    }

    private DataRow findRow(String tableId, String rowId) {
        return store.findRow(tableId, rowId).orElseThrow(() -> new ResourceNotFoundException("Row", rowId));
    }
}
