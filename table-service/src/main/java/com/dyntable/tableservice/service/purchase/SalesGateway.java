package com.dyntable.tableservice.service.purchase;

import com.dyntable.tableservice.entity.Sale;

import java.util.List;
import java.util.Optional;

/**
 * 已完成销售的记录位置
 */
public interface SalesGateway {

    Sale recordSale(Sale sale);

    Optional<Sale> findSale(String saleId);

    List<Sale> findSalesForTable(String tableId);
}
