package com.dyntable.tableservice.repository;

import com.dyntable.tableservice.entity.Sale;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SaleRepository extends JpaRepository<Sale, String> {

    List<Sale> findByTableIdOrderByCreatedAtDesc(String tableId);
}
