package com.dyntable.tableservice.controller;

import com.dyntable.tableservice.dto.AvailabilityResponse;
import com.dyntable.tableservice.dto.PurchaseRequest;
import com.dyntable.tableservice.entity.Sale;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.service.purchase.PurchaseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 销售表的公开购买接口
 */
@RestController
@RequestMapping("/api/sales")
@RequiredArgsConstructor
public class SalesController {

    private final PurchaseService purchaseService;

    @PostMapping("/purchase")
    public ResponseEntity<Sale> purchase(@Valid @RequestBody PurchaseRequest request, Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(purchaseService.purchase(request, actor));
    }

    @GetMapping("/availability")
    public ResponseEntity<AvailabilityResponse> checkAvailability(@RequestParam String tableId,
                                                                  @RequestParam String itemId,
                                                                  @RequestParam(defaultValue = "1") long quantity) {
        return ResponseEntity.ok(purchaseService.checkAvailability(tableId, itemId, quantity));
    }

    @GetMapping("/{saleId}")
    public ResponseEntity<Sale> getSale(@PathVariable String saleId, Actor actor) {
        return ResponseEntity.ok(purchaseService.getSale(saleId, actor));
    }

    @GetMapping("/tables/{tableId}")
    public ResponseEntity<List<Sale>> listSales(@PathVariable String tableId, Actor actor) {
        return ResponseEntity.ok(purchaseService.listSales(tableId, actor));
    }
}
