package com.dyntable.tableservice.service.purchase;

import com.dyntable.tableservice.entity.Sale;
import com.dyntable.tableservice.repository.SaleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaSalesGateway implements SalesGateway {

    private final SaleRepository saleRepository;

    @Override
    @Transactional
    public Sale recordSale(Sale sale) {
        Sale saved = saleRepository.save(sale);
        log.debug("Stored sale {}", saved.getId());
        return saved;
    }

    @Override
    public Optional<Sale> findSale(String saleId) {
        return saleRepository.findById(saleId);
    }

    @Override
    public List<Sale> findSalesForTable(String tableId) {
        return saleRepository.findByTableIdOrderByCreatedAtDesc(tableId);
    }
}
