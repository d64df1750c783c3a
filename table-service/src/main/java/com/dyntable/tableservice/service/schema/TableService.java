package com.dyntable.tableservice.service.schema;

import com.dyntable.tableservice.dto.CloneTableRequest;
import com.dyntable.tableservice.dto.CloneTableResult;
import com.dyntable.tableservice.dto.CreateTableRequest;
import com.dyntable.tableservice.dto.TableDeletionResult;
import com.dyntable.tableservice.dto.UpdateTableRequest;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.enums.TableVisibility;
import com.dyntable.tableservice.exception.TableEngineException;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.repository.TableDataStore;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.security.TableAccessGuard;
import com.dyntable.tableservice.service.message.EngineEventPublisher;
import com.dyntable.tableservice.service.row.RowMutationService;
import com.dyntable.tableservice.util.SnowflakeIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 表的生命周期：创建、更新、删除和克隆
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableService {

    private final TableDataStore store;
    private final TableAccessGuard accessGuard;
    private final TableSchemaService schemaService;
    private final RowMutationService rowMutationService;
    private final EngineEventPublisher eventPublisher;
    private final SnowflakeIdGenerator idGenerator;

    /**
     * 创建表并初始化其用途对应的默认列
     */
    public UserTable createTable(CreateTableRequest request, Actor actor) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Table name is required");
        }
        LocalDateTime now = LocalDateTime.now();
        UserTable table = store.saveTable(UserTable.builder()
                .id(idGenerator.nextId("tbl"))
                .name(request.getName().trim())
                .description(request.getDescription())
                .visibility(request.getVisibility() != null ? request.getVisibility() : TableVisibility.PRIVATE)
                .purpose(request.getPurpose() != null ? request.getPurpose() : TablePurpose.DEFAULT)
                .ownerId(actor.getId())
                .createdAt(now)
                .updatedAt(now)
                .build());
        schemaService.ensureColumns(table, PurposeDefaults.columnsFor(table.getPurpose()));
        log.info("Created table {} ({}, {}) for {}", table.getId(), table.getPurpose(), table.getVisibility(),
                actor.getId());
        return table;
    }

    public UserTable getTable(String tableId, Actor actor) {
        return accessGuard.requireReadable(tableId, actor);
    }

    public List<UserTable> listTables(Actor actor) {
        return store.findTables().stream()
                .filter(table -> accessGuard.canRead(table, actor))
                .collect(Collectors.toList());
    }

    /**
     * 切换用途时补充新用途缺少的默认列；
     * 已有的列不会被删除
     */
    public UserTable updateTable(String tableId, UpdateTableRequest request, Actor actor) {
        UserTable table = accessGuard.requireWritable(tableId, actor);
        TablePurpose previousPurpose = table.getPurpose();

        if (request.getName() != null) {
            if (request.getName().isBlank()) {
                throw new ValidationException("Table name is required");
            }
            table.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            table.setDescription(request.getDescription());
        }
        if (request.getVisibility() != null) {
            table.setVisibility(request.getVisibility());
        }
        if (request.getPurpose() != null) {
            table.setPurpose(request.getPurpose());
        }
        table.setUpdatedAt(LocalDateTime.now());
        UserTable saved = store.saveTable(table);

        if (saved.getPurpose() != previousPurpose) {
            schemaService.ensureColumns(saved, PurposeDefaults.columnsFor(saved.getPurpose()));
            log.info("Table {} purpose changed from {} to {}", tableId, previousPurpose, saved.getPurpose());
        }
        return saved;
    }

    /**
     * 删除表及其列和行。库存流水保留：流水自带表名。
     * 之后通知其他子系统；通知失败时
     * 删除仍然有效，结果中带有警告
     */
    public TableDeletionResult deleteTable(String tableId, Actor actor) {
        UserTable table = accessGuard.requireWritable(tableId, actor);
        long deletedRows = store.deleteTable(tableId);
        log.info("Deleted table {} ({} rows) by {}", tableId, deletedRows, actor.getId());

        List<String> warnings = new ArrayList<>();
        try {
            eventPublisher.publishTableDeleted(tableId, table.getName());
        } catch (RuntimeException e) {
            log.warn("Table {} deleted but dependent cleanup was not triggered: {}", tableId, e.getMessage());
            warnings.add("Cleanup of references to this table could not be triggered: " + e.getMessage());
        }
        return TableDeletionResult.builder()
                .tableId(tableId)
                .deletedRows(deletedRows)
                .warnings(warnings)
                .build();
    }

    /**
     * 将表结构（可选连同数据行）复制为操作者拥有的新表。
     * 复制的行经过行处理流程，因此克隆销售表会记录 ADD 流水
     */
    public CloneTableResult cloneTable(String tableId, CloneTableRequest request, Actor actor) {
        UserTable source = accessGuard.requireReadable(tableId, actor);
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Table name is required");
        }
        LocalDateTime now = LocalDateTime.now();
        UserTable copy = store.saveTable(UserTable.builder()
                .id(idGenerator.nextId("tbl"))
                .name(request.getName().trim())
                .description(source.getDescription())
                .visibility(request.getVisibility() != null ? request.getVisibility() : TableVisibility.PRIVATE)
                .purpose(source.getPurpose())
                .ownerId(actor.getId())
                .createdAt(now)
                .updatedAt(now)
                .build());

        List<TableColumn> columns = store.findColumns(tableId);
        List<TableColumn> copiedColumns = new ArrayList<>();
        for (TableColumn column : columns) {
            copiedColumns.add(column.toBuilder()
                    .id(idGenerator.nextId("col"))
                    .tableId(copy.getId())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        }
        store.saveColumns(copiedColumns);

        int copiedRows = 0;
        List<String> warnings = new ArrayList<>();
        if (request.isIncludeRows()) {
            for (DataRow row : store.findRows(tableId)) {
                try {
                    rowMutationService.createRow(copy.getId(), new LinkedHashMap<>(row.getData()), actor);
                    copiedRows++;
                } catch (TableEngineException e) {
                    warnings.add(String.format("Row %s not copied: %s", row.getId(), e.getMessage()));
                }
            }
        }
        log.info("Cloned table {} into {} ({} columns, {} rows)", tableId, copy.getId(), copiedColumns.size(),
                copiedRows);
        return CloneTableResult.builder()
                .table(copy)
                .copiedColumns(copiedColumns.size())
                .copiedRows(copiedRows)
                .warnings(warnings)
                .build();
    }
}
