package com.dyntable.tableservice.repository;

import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.TablePurpose;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 表、列定义和数据行的存储
 *
 * 每个方法各自原子，不跨调用；服务层自行安排写入顺序，
 * 保证中途失败不会留下损坏的状态
 */
public interface TableDataStore {

    Optional<UserTable> findTable(String tableId);

    List<UserTable> findTables();

    List<UserTable> findTables(TablePurpose purpose);

    UserTable saveTable(UserTable table);

    /**
     * 删除表及其所有列和行
     *
     * @return 删除的行数
     */
    long deleteTable(String tableId);

    List<TableColumn> findColumns(String tableId);

    Optional<TableColumn> findColumn(String tableId, String columnId);

    TableColumn saveColumn(TableColumn column);

    /**
     * 一次保存多列（用于交换位置和重新编号）
     */
    List<TableColumn> saveColumns(Collection<TableColumn> columns);

    void deleteColumn(String columnId);

    /**
     * 在表的每一行中把 {@code oldName} 下的值移到 {@code newName}
     *
     * @return 修改的行数
     */
    int renameColumnInRows(String tableId, String oldName, String newName);

    int removeColumnFromRows(String tableId, String columnName);

    Optional<DataRow> findRow(String tableId, String rowId);

    List<DataRow> findRows(String tableId);

    long countRows(String tableId);

    DataRow saveRow(DataRow row);

    void deleteRow(String rowId);

    /**
     * 表中 {@code columnName} 值等于 {@code value} 的行，排除 {@code excludeRowId}
     */
    List<DataRow> findRowsWithValue(String tableId, String columnName, Object value, String excludeRowId);
}
