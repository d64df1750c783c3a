package com.dyntable.tableservice.repository;

import com.dyntable.tableservice.entity.TableColumn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TableColumnRepository extends JpaRepository<TableColumn, String> {

    /**
     * 按显示顺序返回表的列；位置相同时按 id 排序，
     * 位置存在空缺或重复时读取结果也保持稳定
     */
    List<TableColumn> findByTableIdOrderByPositionAscIdAsc(String tableId);

    Optional<TableColumn> findByIdAndTableId(String id, String tableId);

    @Modifying
    @Query("DELETE FROM TableColumn c WHERE c.tableId = :tableId")
    int deleteByTableId(String tableId);
}
