package com.dyntable.tableservice.support;

import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.repository.TableDataStore;
import com.dyntable.tableservice.util.RowValues;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Map-backed store that hands out copies, so services cannot mutate stored state by accident.
 */
public class InMemoryTableDataStore implements TableDataStore {

    private final Map<String, UserTable> tables = new LinkedHashMap<>();
    private final Map<String, TableColumn> columns = new LinkedHashMap<>();
    private final Map<String, DataRow> rows = new LinkedHashMap<>();

    @Override
    public Optional<UserTable> findTable(String tableId) {
        return Optional.ofNullable(tables.get(tableId)).map(InMemoryTableDataStore::copy);
    }

    @Override
    public List<UserTable> findTables() {
        return tables.values().stream().map(InMemoryTableDataStore::copy).collect(Collectors.toList());
    }

    @Override
    public List<UserTable> findTables(TablePurpose purpose) {
        return tables.values().stream()
                .filter(table -> table.getPurpose() == purpose)
                .map(InMemoryTableDataStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public UserTable saveTable(UserTable table) {
        tables.put(table.getId(), copy(table));
        return copy(table);
    }

    @Override
    public long deleteTable(String tableId) {
        columns.values().removeIf(column -> column.getTableId().equals(tableId));
        long removed = rows.values().stream().filter(row -> row.getTableId().equals(tableId)).count();
        rows.values().removeIf(row -> row.getTableId().equals(tableId));
        tables.remove(tableId);
        return removed;
    }

    @Override
    public List<TableColumn> findColumns(String tableId) {
        return columns.values().stream()
                .filter(column -> column.getTableId().equals(tableId))
                .sorted(Comparator.comparing(TableColumn::getPosition).thenComparing(TableColumn::getId))
                .map(InMemoryTableDataStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<TableColumn> findColumn(String tableId, String columnId) {
        return Optional.ofNullable(columns.get(columnId))
                .filter(column -> column.getTableId().equals(tableId))
                .map(InMemoryTableDataStore::copy);
    }

    @Override
    public TableColumn saveColumn(TableColumn column) {
        columns.put(column.getId(), copy(column));
        return copy(column);
    }

    @Override
    public List<TableColumn> saveColumns(Collection<TableColumn> toSave) {
        return toSave.stream().map(this::saveColumn).collect(Collectors.toList());
    }

    @Override
    public void deleteColumn(String columnId) {
        columns.remove(columnId);
    }

    @Override
    public int renameColumnInRows(String tableId, String oldName, String newName) {
        int changed = 0;
        for (DataRow row : rows.values()) {
            if (row.getTableId().equals(tableId) && row.getData().containsKey(oldName)) {
                Map<String, Object> data = new LinkedHashMap<>(row.getData());
                data.put(newName, data.remove(oldName));
                row.setData(data);
                changed++;
            }
        }
        return changed;
    }

    @Override
    public int removeColumnFromRows(String tableId, String columnName) {
        int changed = 0;
        for (DataRow row : rows.values()) {
            if (row.getTableId().equals(tableId) && row.getData().containsKey(columnName)) {
                Map<String, Object> data = new LinkedHashMap<>(row.getData());
                data.remove(columnName);
                row.setData(data);
                changed++;
            }
        }
        return changed;
    }

    @Override
    public Optional<DataRow> findRow(String tableId, String rowId) {
        return Optional.ofNullable(rows.get(rowId))
                .filter(row -> row.getTableId().equals(tableId))
                .map(InMemoryTableDataStore::copy);
    }

    @Override
    public List<DataRow> findRows(String tableId) {
        return rows.values().stream()
                .filter(row -> row.getTableId().equals(tableId))
                .map(InMemoryTableDataStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public long countRows(String tableId) {
        return rows.values().stream().filter(row -> row.getTableId().equals(tableId)).count();
    }

    @Override
    public DataRow saveRow(DataRow row) {
        rows.put(row.getId(), copy(row));
        return copy(row);
    }

    @Override
    public void deleteRow(String rowId) {
        rows.remove(rowId);
    }

    @Override
    public List<DataRow> findRowsWithValue(String tableId, String columnName, Object value, String excludeRowId) {
        List<DataRow> matches = new ArrayList<>();
        for (DataRow row : findRows(tableId)) {
            if (!row.getId().equals(excludeRowId) && RowValues.sameValue(row.getData().get(columnName), value)) {
                matches.add(row);
            }
        }
        return matches;
    }

    private static UserTable copy(UserTable table) {
        return table.toBuilder().build();
    }

    private static TableColumn copy(TableColumn column) {
        return column.toBuilder().build();
    }

    private static DataRow copy(DataRow row) {
        return row.toBuilder().data(new LinkedHashMap<>(row.getData())).build();
    }
}
