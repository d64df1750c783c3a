package com.dyntable.tableservice.service.row;

import com.dyntable.tableservice.dto.FieldError;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.exception.ColumnTypeNotFoundException;
import com.dyntable.tableservice.exception.ConflictException;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.repository.TableDataStore;
import com.dyntable.tableservice.service.coercion.CoercionResult;
import com.dyntable.tableservice.service.coercion.ValueCoercer;
import com.dyntable.tableservice.service.registry.CapabilityRegistry;
import com.dyntable.tableservice.util.RowValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 将原始输入转为带类型的行数据：依次进行类型解析、
 * 转换、必填校验和重复值检查
 *
 * 同一步骤内的错误会汇总。任一步骤失败，
 * 写入在存储任何内容之前终止
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RowValidator {

    private final TableDataStore store;
    private final ValueCoercer coercer;

    /**
     * @param existing 更新时为已存储的行，创建时为 {@code null}
     * @return 以列名为键的带类型数据，每列一项
     */
    public Map<String, Object> validate(String tableId, List<TableColumn> columns, Map<String, Object> input,
                                        DataRow existing, CapabilityRegistry registry) {
        Map<String, Object> source = input != null ? input : Map.of();
        Map<String, Object> stored = existing != null ? existing.getData() : Map.of();

        Map<String, Object> rawValues = new LinkedHashMap<>();
        Map<String, Object> unchanged = new LinkedHashMap<>();
        for (TableColumn column : columns) {
            Object raw = rawValueFor(column, source, existing == null);
            if (existing != null && !RowValues.isBlank(raw) && stored.containsKey(column.getName())
                    && RowValues.sameValue(raw, stored.get(column.getName()))) {
                // 未改动的值保留存储形式，跳过类型校验
                unchanged.put(column.getName(), stored.get(column.getName()));
            } else {
                rawValues.put(column.getName(), raw);
            }
        }
        ignoredKeys(columns, source);

        // 针对无法解析类型的写入在读取任何值之前就失败
        List<String> unresolved = new ArrayList<>();
        for (TableColumn column : columns) {
            if (rawValues.containsKey(column.getName()) && !RowValues.isBlank(rawValues.get(column.getName()))
                    && !registry.isResolvable(column.getType())) {
                unresolved.add(column.getType());
            }
        }
        if (!unresolved.isEmpty()) {
            throw new ColumnTypeNotFoundException(String.join(", ", unresolved));
        }

        Map<String, Object> typed = new LinkedHashMap<>();
        List<FieldError> errors = new ArrayList<>();
        for (TableColumn column : columns) {
            String name = column.getName();
            if (unchanged.containsKey(name)) {
                typed.put(name, unchanged.get(name));
                continue;
            }
            Object raw = rawValues.get(name);
            CoercionResult result = coercer.coerce(raw, column.getType(), registry);
            if (!result.isSuccess()) {
                errors.add(new FieldError(name, raw, result.describeError()));
                continue;
            }
            typed.put(name, result.getValue());
        }

        for (TableColumn column : columns) {
            if (column.isRequired() && typed.containsKey(column.getName()) && typed.get(column.getName()) == null) {
                errors.add(new FieldError(column.getName(), null, "Required field is empty"));
            }
        }
        if (!errors.isEmpty()) {
            log.warn("Row rejected for table {}: {} field error(s)", tableId, errors.size());
            throw ValidationException.forFields(errors);
        }

        checkDuplicates(tableId, columns, typed, existing);
        return typed;
    }

    private void checkDuplicates(String tableId, List<TableColumn> columns, Map<String, Object> typed, DataRow existing) {
        String excludeRowId = existing != null ? existing.getId() : null;
        List<FieldError> conflicts = new ArrayList<>();
        for (TableColumn column : columns) {
            Object value = typed.get(column.getName());
            if (column.isAllowDuplicates() || value == null) {
                continue;
            }
            if (!store.findRowsWithValue(tableId, column.getName(), value, excludeRowId).isEmpty()) {
                conflicts.add(new FieldError(column.getName(), value,
                        String.format("Value '%s' already exists in column '%s'", value, column.getDisplayName())));
            }
        }
        if (!conflicts.isEmpty()) {
            log.warn("Row rejected for table {}: duplicate values in {} column(s)", tableId, conflicts.size());
            throw new ConflictException(conflicts.size() == 1
                    ? conflicts.get(0).getReason()
                    : String.format("Duplicate values in %d columns", conflicts.size()), conflicts);
        }
    }

    private static Object rawValueFor(TableColumn column, Map<String, Object> input, boolean creating) {
        if (input.containsKey(column.getName())) {
            return input.get(column.getName());
        }
        // 默认值不能满足必填列
        if (creating && !column.isRequired() && column.getDefaultValue() != null) {
            return column.getDefaultValue();
        }
        return null;
    }

    private static void ignoredKeys(List<TableColumn> columns, Map<String, Object> input) {
        if (log.isDebugEnabled()) {
            input.keySet().stream()
                    .filter(key -> columns.stream().noneMatch(c -> c.getName().equals(key)))
                    .forEach(key -> log.debug("Ignoring input field without a column: {}", key));
        }
    }
}
