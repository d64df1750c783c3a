package com.dyntable.tableservice.repository;

import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.util.RowValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaTableDataStore implements TableDataStore {

    private final UserTableRepository tableRepository;
    private final TableColumnRepository columnRepository;
    private final DataRowRepository rowRepository;

    @Override
    public Optional<UserTable> findTable(String tableId) {
        return tableRepository.findById(tableId);
    }

    @Override
    public List<UserTable> findTables() {
        return tableRepository.findAllByOrderByCreatedAtAsc();
    }

    @Override
    public List<UserTable> findTables(TablePurpose purpose) {
        return tableRepository.findByPurposeOrderByCreatedAtAsc(purpose);
    }

    @Override
    public UserTable saveTable(UserTable table) {
        return tableRepository.save(table);
    }

    @Override
    @Transactional
    public long deleteTable(String tableId) {
        int rows = rowRepository.deleteByTableId(tableId);
        int columns = columnRepository.deleteByTableId(tableId);
        tableRepository.deleteById(tableId);
        log.info("Deleted table {} with {} columns and {} rows", tableId, columns, rows);
        return rows;
    }

    @Override
    public List<TableColumn> findColumns(String tableId) {
        return columnRepository.findByTableIdOrderByPositionAscIdAsc(tableId);
    }

    @Override
    public Optional<TableColumn> findColumn(String tableId, String columnId) {
        return columnRepository.findByIdAndTableId(columnId, tableId);
    }

    @Override
    public TableColumn saveColumn(TableColumn column) {
        return columnRepository.save(column);
    }

    @Override
    @Transactional
    public List<TableColumn> saveColumns(Collection<TableColumn> columns) {
        return columnRepository.saveAll(columns);
    }

    @Override
    public void deleteColumn(String columnId) {
        columnRepository.deleteById(columnId);
    }

    @Override
    @Transactional
    public int renameColumnInRows(String tableId, String oldName, String newName) {
        int changed = 0;
        for (DataRow row : rowRepository.findByTableIdOrderByCreatedAtAscIdAsc(tableId)) {
            if (row.getData().containsKey(oldName)) {
                Map<String, Object> data = new LinkedHashMap<>(row.getData());
                data.put(newName, data.remove(oldName));
                row.setData(data);
                rowRepository.save(row);
                changed++;
            }
        }
        return changed;
    }

    @Override
    @Transactional
    public int removeColumnFromRows(String tableId, String columnName) {
        int changed = 0;
        for (DataRow row : rowRepository.findByTableIdOrderByCreatedAtAscIdAsc(tableId)) {
            if (row.getData().containsKey(columnName)) {
                Map<String, Object> data = new LinkedHashMap<>(row.getData());
                data.remove(columnName);
                row.setData(data);
                rowRepository.save(row);
                changed++;
            }
        }
        return changed;
    }

    @Override
    public Optional<DataRow> findRow(String tableId, String rowId) {
        return rowRepository.findByIdAndTableId(rowId, tableId);
    }

    @Override
    public List<DataRow> findRows(String tableId) {
        return rowRepository.findByTableIdOrderByCreatedAtAscIdAsc(tableId);
    }

    @Override
    public long countRows(String tableId) {
        return rowRepository.countByTableId(tableId);
    }

    @Override
    public DataRow saveRow(DataRow row) {
        return rowRepository.save(row);
    }

    @Override
    public void deleteRow(String rowId) {
        rowRepository.deleteById(rowId);
    }

    @Override
    public List<DataRow> findRowsWithValue(String tableId, String columnName, Object value, String excludeRowId) {
        // 行数据是 JSON 文档，因此在这里而不是在 SQL 中匹配
        List<DataRow> matches = new ArrayList<>();
        for (DataRow row : rowRepository.findByTableIdOrderByCreatedAtAscIdAsc(tableId)) {
            if (row.getId().equals(excludeRowId)) {
                continue;
            }
            if (RowValues.sameValue(row.getData().get(columnName), value)) {
                matches.add(row);
            }
        }
        return matches;
    }
}
