package com.dyntable.tableservice.service.schema;

import com.dyntable.module.spi.ColumnTemplate;
import com.dyntable.tableservice.config.EngineProperties;
import com.dyntable.tableservice.dto.AddColumnRequest;
import com.dyntable.tableservice.dto.ColumnNameFixResult;
import com.dyntable.tableservice.dto.FieldError;
import com.dyntable.tableservice.dto.TypeChangeIssue;
import com.dyntable.tableservice.dto.TypeChangePreview;
import com.dyntable.tableservice.dto.UpdateColumnRequest;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.exception.ConflictException;
import com.dyntable.tableservice.exception.ResourceNotFoundException;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.repository.TableDataStore;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.security.TableAccessGuard;
import com.dyntable.tableservice.service.coercion.CoercionResult;
import com.dyntable.tableservice.service.coercion.ValueCoercer;
import com.dyntable.tableservice.service.registry.CapabilityRegistry;
import com.dyntable.tableservice.service.registry.CapabilityRegistryFactory;
import com.dyntable.tableservice.util.RowValues;
import com.dyntable.tableservice.util.SnowflakeIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 列的生命周期：添加、重命名、修改类型、调整位置和删除，
 * 并执行销售表和租赁表的受保护列规则
 *
 * 删除后位置会留下空缺；由 {@link #recountPositions} 补齐
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableSchemaService {

    private final TableDataStore store;
    private final TableAccessGuard accessGuard;
    private final CapabilityRegistryFactory registryFactory;
    private final ValueCoercer coercer;
    private final SnowflakeIdGenerator idGenerator;
    private final EngineProperties properties;

    public List<TableColumn> listColumns(String tableId, Actor actor) {
        accessGuard.requireReadable(tableId, actor);
        return store.findColumns(tableId);
    }

    public TableColumn addColumn(String tableId, AddColumnRequest request, Actor actor) {
        UserTable table = accessGuard.requireWritable(tableId, actor);
        String name = ColumnNames.toInternalName(request.getName());
        List<TableColumn> columns = store.findColumns(tableId);
        ensureNameFree(columns, name, null);

        CapabilityRegistry registry = registryFactory.snapshot();
        registry.resolve(request.getType());
        checkDefaultValue(name, request.getType(), request.getDefaultValue(), registry);

        int end = columns.stream().mapToInt(TableColumn::getPosition).max().orElse(-1) + 1;
        int position = request.getPosition() == null ? end : request.getPosition();
        if (position < 0 || position > end) {
            throw new ValidationException(String.format("Position must be between 0 and %d", end));
        }
        if (position < end) {
            // 腾出位置：插入点及之后的列依次后移一位
            List<TableColumn> shifted = columns.stream()
                    .filter(c -> c.getPosition() >= position)
                    .map(c -> c.toBuilder().position(c.getPosition() + 1).build())
                    .collect(Collectors.toList());
            store.saveColumns(shifted);
        }

        TableColumn column = store.saveColumn(newColumn(table.getId(), name, request.getType(), request.isRequired(),
                request.isAllowDuplicates(), request.getDefaultValue(), position));
        log.info("Added column {} ({}) to table {} at position {}", name, request.getType(), tableId, position);
        return column;
    }

    /**
     * 添加表中尚未存在的模板列，追加在末尾
     */
    public List<TableColumn> ensureColumns(UserTable table, List<ColumnTemplate> templates) {
        List<TableColumn> columns = store.findColumns(table.getId());
        Set<String> existing = columns.stream()
                .map(c -> c.getName().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(HashSet::new));
        int position = columns.stream().mapToInt(TableColumn::getPosition).max().orElse(-1) + 1;

        List<TableColumn> added = new ArrayList<>();
        for (ColumnTemplate template : templates) {
            if (!existing.add(template.getName().toLowerCase(Locale.ROOT))) {
                continue;
            }
            added.add(store.saveColumn(newColumn(table.getId(), template.getName(), template.getType(),
                    template.isRequired(), template.isAllowDuplicates(), template.getDefaultValue(), position++)));
        }
        if (!added.isEmpty()) {
            log.info("Added {} default column(s) to table {}", added.size(), table.getId());
        }
        return added;
    }

    public TableColumn updateColumn(String tableId, String columnId, UpdateColumnRequest request, Actor actor) {
        accessGuard.requireWritable(tableId, actor);
        TableColumn column = requireColumn(tableId, columnId);
        if (request.getName() != null && !ColumnNames.toInternalName(request.getName()).equals(column.getName())) {
            column = renameColumn(tableId, columnId, request.getName(), actor);
        }
        if (request.getType() != null && !request.getType().equals(column.getType())) {
            column = changeColumnType(tableId, columnId, request.getType(), actor);
        }
        if (request.getRequired() == null && request.getAllowDuplicates() == null
                && request.getDefaultValue() == null && !Boolean.TRUE.equals(request.getClearDefaultValue())) {
            return column;
        }
        return updateSettings(tableId, column, request, actor);
    }

    public TableColumn renameColumn(String tableId, String columnId, String displayName, Actor actor) {
        UserTable table = accessGuard.requireWritable(tableId, actor);
        TableColumn column = requireColumn(tableId, columnId);
        String newName = ColumnNames.toInternalName(displayName);
        if (newName.equals(column.getName())) {
            return column;
        }
        if (table.getPurpose().isProtected(column.getName())) {
            throw protectedColumns(table, List.of(column.getName()), "renamed");
        }
        ensureNameFree(store.findColumns(tableId), newName, columnId);

        String oldName = column.getName();
        TableColumn renamed = store.saveColumn(column.toBuilder().name(newName).updatedAt(LocalDateTime.now()).build());
        int rows = store.renameColumnInRows(tableId, oldName, newName);
        log.info("Renamed column {} to {} in table {} ({} rows migrated)", oldName, newName, tableId, rows);
        return renamed;
    }

    /**
     * 修改类型 id。已存储的值保持不变；
     * 可先调用 {@link #previewTypeChange} 查看新类型会拒绝哪些值
     */
    public TableColumn changeColumnType(String tableId, String columnId, String newType, Actor actor) {
        accessGuard.requireWritable(tableId, actor);
        TableColumn column = requireColumn(tableId, columnId);
        CapabilityRegistry registry = registryFactory.snapshot();
        registry.resolve(newType);
        checkDefaultValue(column.getName(), newType, column.getDefaultValue(), registry);

        TableColumn changed = store.saveColumn(column.toBuilder().type(newType).updatedAt(LocalDateTime.now()).build());
        log.info("Changed type of column {} in table {} from {} to {}", column.getName(), tableId,
                column.getType(), newType);
        return changed;
    }

    public TypeChangePreview previewTypeChange(String tableId, String columnId, String newType, Actor actor) {
        accessGuard.requireReadable(tableId, actor);
        TableColumn column = requireColumn(tableId, columnId);
        CapabilityRegistry registry = registryFactory.snapshot();
        registry.resolve(newType);

        int maxSamples = properties.getTypePreview().getMaxSamples();
        List<TypeChangeIssue> samples = new ArrayList<>();
        List<DataRow> rows = store.findRows(tableId);
        int incompatible = 0;
        for (DataRow row : rows) {
            Object value = row.getData().get(column.getName());
            if (RowValues.isBlank(value)) {
                continue;
            }
            CoercionResult result = coercer.coerce(value, newType, registry);
            if (!result.isSuccess()) {
                incompatible++;
                if (samples.size() < maxSamples) {
                    samples.add(TypeChangeIssue.builder()
                            .rowId(row.getId())
                            .currentValue(value)
                            .issue(result.describeError())
                            .build());
                }
            }
        }
        return TypeChangePreview.builder()
                .columnName(column.getName())
                .currentType(column.getType())
                .newType(newType)
                .totalRows(rows.size())
                .compatibleRows(rows.size() - incompatible)
                .incompatibleRows(incompatible)
                .sampleIssues(samples)
                .build();
    }

    public void deleteColumn(String tableId, String columnId, Actor actor) {
        deleteColumns(tableId, List.of(columnId), actor);
    }

    /**
     * 一次删除多列。只要其中有受保护列就不删除任何列，
     * 错误信息列出所有受保护的列
     */
    public void deleteColumns(String tableId, List<String> columnIds, Actor actor) {
        UserTable table = accessGuard.requireWritable(tableId, actor);
        List<TableColumn> targets = new ArrayList<>();
        for (String columnId : columnIds) {
            targets.add(requireColumn(tableId, columnId));
        }
        List<String> blocked = targets.stream()
                .map(TableColumn::getName)
                .filter(name -> table.getPurpose().isProtected(name))
                .collect(Collectors.toList());
        if (!blocked.isEmpty()) {
            throw protectedColumns(table, blocked, "deleted");
        }

        for (TableColumn column : targets) {
            store.deleteColumn(column.getId());
            int rows = store.removeColumnFromRows(tableId, column.getName());
            log.info("Deleted column {} from table {} ({} rows cleaned)", column.getName(), tableId, rows);
        }
    }

    /**
     * 将列重新编号为 0..n-1，保持相对顺序。幂等
     */
    public List<TableColumn> recountPositions(String tableId, Actor actor) {
        accessGuard.requireWritable(tableId, actor);
        List<TableColumn> columns = new ArrayList<>(store.findColumns(tableId));
        columns.sort(Comparator.comparingInt(TableColumn::getPosition).thenComparing(TableColumn::getId));

        List<TableColumn> changed = new ArrayList<>();
        List<TableColumn> result = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            TableColumn column = columns.get(i);
            if (column.getPosition() != i) {
                column = column.toBuilder().position(i).build();
                changed.add(column);
            }
            result.add(column);
        }
        if (!changed.isEmpty()) {
            store.saveColumns(changed);
            log.info("Recounted positions of table {}: {} column(s) moved", tableId, changed.size());
        }
        return result;
    }

    public List<TableColumn> swapPositions(String tableId, String columnIdA, String columnIdB, Actor actor) {
        accessGuard.requireWritable(tableId, actor);
        if (columnIdA.equals(columnIdB)) {
            throw new ValidationException("Cannot swap a column with itself");
        }
        TableColumn a = requireColumn(tableId, columnIdA);
        TableColumn b = requireColumn(tableId, columnIdB);

        List<TableColumn> swapped = store.saveColumns(List.of(
                a.toBuilder().position(b.getPosition()).build(),
                b.toBuilder().position(a.getPosition()).build()));
        log.info("Swapped columns {} and {} in table {}", a.getName(), b.getName(), tableId);
        return swapped;
    }

    /**
     * 将旧列名改写为驼峰形式，并同步迁移行中的键。
     * 受保护的名称和已经合法的名称保持不变
     */
    public ColumnNameFixResult fixColumnNames(String tableId, Actor actor) {
        UserTable table = accessGuard.requireWritable(tableId, actor);
        List<TableColumn> columns = store.findColumns(tableId);
        Set<String> taken = columns.stream().map(TableColumn::getName).collect(Collectors.toCollection(HashSet::new));

        Map<String, String> renamed = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        int rowsUpdated = 0;
        for (TableColumn column : columns) {
            String oldName = column.getName();
            if (ColumnNames.isValidInternalName(oldName)) {
                continue;
            }
            if (table.getPurpose().isProtected(oldName)) {
                errors.add(String.format("Column '%s' is protected and was not renamed", oldName));
                continue;
            }
            String base = ColumnNames.repair(oldName);
            String candidate = base;
            // 后缀保持名称只含字母：price, priceB, priceC...
            char suffix = 'B';
            while (taken.contains(candidate) && suffix <= 'Z') {
                candidate = base + suffix++;
            }
            if (taken.contains(candidate)) {
                errors.add(String.format("No free name for column '%s'", oldName));
                continue;
            }
            taken.remove(oldName);
            taken.add(candidate);
            store.saveColumn(column.toBuilder().name(candidate).updatedAt(LocalDateTime.now()).build());
            rowsUpdated += store.renameColumnInRows(tableId, oldName, candidate);
            renamed.put(oldName, candidate);
        }
        log.info("Fixed {} column name(s) in table {}, {} row update(s)", renamed.size(), tableId, rowsUpdated);
        return ColumnNameFixResult.builder()
                .renamed(renamed)
                .rowsUpdated(rowsUpdated)
                .errors(errors)
                .build();
    }

    private TableColumn updateSettings(String tableId, TableColumn column, UpdateColumnRequest request, Actor actor) {
        accessGuard.requireWritable(tableId, actor);
        TableColumn.TableColumnBuilder builder = column.toBuilder().updatedAt(LocalDateTime.now());
        if (request.getRequired() != null) {
            builder.required(request.getRequired());
        }
        if (request.getAllowDuplicates() != null) {
            if (!request.getAllowDuplicates() && column.isAllowDuplicates()) {
                ensureNoDuplicates(tableId, column.getName());
            }
            builder.allowDuplicates(request.getAllowDuplicates());
        }
        if (Boolean.TRUE.equals(request.getClearDefaultValue())) {
            builder.defaultValue(null);
        } else if (request.getDefaultValue() != null) {
            checkDefaultValue(column.getName(), column.getType(), request.getDefaultValue(), registryFactory.snapshot());
            builder.defaultValue(request.getDefaultValue());
        }
        TableColumn updated = store.saveColumn(builder.build());
        log.info("Updated settings of column {} in table {}", column.getName(), tableId);
        return updated;
    }

    private void ensureNoDuplicates(String tableId, String columnName) {
        Set<String> seen = new HashSet<>();
        for (DataRow row : store.findRows(tableId)) {
            Object value = row.getData().get(columnName);
            if (value == null) {
                continue;
            }
            String key = RowValues.toDecimal(value)
                    .filter(d -> value instanceof Number)
                    .map(d -> d.stripTrailingZeros().toPlainString())
                    .orElse(String.valueOf(value));
            if (!seen.add(key)) {
                throw new ConflictException(String.format(
                        "Column '%s' already holds duplicate value '%s'", columnName, value),
                        List.of(new FieldError(columnName, value, "Duplicate value")));
            }
        }
    }

    private void checkDefaultValue(String columnName, String type, String defaultValue, CapabilityRegistry registry) {
        if (RowValues.isBlank(defaultValue)) {
            return;
        }
        CoercionResult result = coercer.coerce(defaultValue, type, registry);
        if (!result.isSuccess()) {
            throw new ValidationException("Invalid default value",
                    List.of(new FieldError(columnName, defaultValue, result.describeError())));
        }
    }

    private void ensureNameFree(List<TableColumn> columns, String name, String ignoreColumnId) {
        boolean taken = columns.stream()
                .filter(c -> !c.getId().equals(ignoreColumnId))
                .anyMatch(c -> c.getName().equalsIgnoreCase(name));
        if (taken) {
            throw new ConflictException(String.format("Column '%s' already exists", name),
                    List.of(new FieldError("name", name, "Column name already in use")));
        }
    }

    private TableColumn requireColumn(String tableId, String columnId) {
        return store.findColumn(tableId, columnId).orElseThrow(() -> new ResourceNotFoundException("Column", columnId));
    }

    private TableColumn newColumn(String tableId, String name, String type, boolean required, boolean allowDuplicates,
                                  String defaultValue, int position) {
        LocalDateTime now = LocalDateTime.now();
        return TableColumn.builder()
                .id(idGenerator.nextId("col"))
                .tableId(tableId)
                .name(name)
                .type(type)
                .required(required)
                .allowDuplicates(allowDuplicates)
                .defaultValue(defaultValue)
                .position(position)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static ValidationException protectedColumns(UserTable table, List<String> names, String action) {
        String message = String.format("Protected column(s) of a %s table cannot be %s: %s",
                table.getPurpose().name().toLowerCase(Locale.ROOT), action, String.join(", ", names));
        List<FieldError> errors = names.stream()
                .map(name -> new FieldError(name, null, "Protected column"))
                .collect(Collectors.toList());
        return new ValidationException(message, errors);
    }
}
