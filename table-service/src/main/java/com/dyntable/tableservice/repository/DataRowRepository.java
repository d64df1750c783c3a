package com.dyntable.tableservice.repository;

import com.dyntable.tableservice.entity.DataRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DataRowRepository extends JpaRepository<DataRow, String> {

    List<DataRow> findByTableIdOrderByCreatedAtAscIdAsc(String tableId);

    Optional<DataRow> findByIdAndTableId(String id, String tableId);

    long countByTableId(String tableId);

    @Modifying
    @Query("DELETE FROM DataRow r WHERE r.tableId = :tableId")
    int deleteByTableId(String tableId);
}
