package com.dyntable.tableservice.service.purchase;

import com.dyntable.tableservice.dto.AvailabilityResponse;
import com.dyntable.tableservice.dto.FieldError;
import com.dyntable.tableservice.dto.PurchaseRequest;
import com.dyntable.tableservice.dto.StockAdjustmentRequest;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.Sale;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.ColumnRole;
import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.exception.InsufficientQuantityException;
import com.dyntable.tableservice.exception.ResourceNotFoundException;
import com.dyntable.tableservice.exception.TableAccessDeniedException;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.repository.TableDataStore;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.security.TableAccessGuard;
import com.dyntable.tableservice.service.row.MutationOptions;
import com.dyntable.tableservice.service.row.RowMutationService;
import com.dyntable.tableservice.util.RowValues;
import com.dyntable.tableservice.util.SnowflakeIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 公开销售表的购买和手工库存调整
 *
 * 购买先记录销售，再通过行处理流程扣减数量，
 * 由该流程追加库存流水。两步不是原子的：
 * 扣减失败时销售仍然有效，不一致只记录日志。
 * 库存检查是先查后改，并发购买可能超卖
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PurchaseService {

    private final TableDataStore store;
    private final RowMutationService rowMutationService;
    private final SalesGateway salesGateway;
    private final TableAccessGuard accessGuard;
    private final SnowflakeIdGenerator idGenerator;

    public Sale purchase(PurchaseRequest request, Actor actor) {
        if (request.getQuantitySold() < 1) {
            throw new ValidationException("Quantity must be at least 1",
                    List.of(new FieldError("quantitySold", request.getQuantitySold(), "Must be at least 1")));
        }
        UserTable table = requirePurchasableTable(request.getTableId());
        DataRow item = store.findRow(table.getId(), request.getItemId())
                .orElseThrow(() -> new ResourceNotFoundException("Item", request.getItemId()));

        BigDecimal price = requirePrice(item);
        String quantityKey = quantityKey(item);
        BigDecimal currentQty = RowValues.toDecimal(item.getData().get(quantityKey)).orElse(BigDecimal.ZERO);
        if (currentQty.compareTo(BigDecimal.valueOf(request.getQuantitySold())) < 0) {
            log.warn("Purchase rejected for item {} in table {}: available {}, requested {}",
                    item.getId(), table.getId(), currentQty, request.getQuantitySold());
            throw new InsufficientQuantityException(currentQty, request.getQuantitySold());
        }

        BigDecimal unitPrice = price.setScale(2, RoundingMode.HALF_UP);
        Sale sale = salesGateway.recordSale(Sale.builder()
                .id(idGenerator.nextId("sale"))
                .tableId(table.getId())
                .tableName(table.getName())
                .itemId(item.getId())
                .itemSnapshot(new LinkedHashMap<>(item.getData()))
                .quantitySold(request.getQuantitySold())
                .unitPrice(unitPrice)
                .totalAmount(unitPrice.multiply(BigDecimal.valueOf(request.getQuantitySold())))
                .customerId(request.getCustomerId())
                .customerEmail(request.getCustomerEmail())
                .notes(request.getNotes())
                .createdBy(actor != null ? actor.getId() : null)
                .createdAt(LocalDateTime.now())
                .build());
        log.info("Recorded sale {}: item={}, table={}, quantity={}, total={}", sale.getId(), item.getId(),
                table.getId(), sale.getQuantitySold(), sale.getTotalAmount());

        Map<String, Object> updated = new LinkedHashMap<>(item.getData());
        updated.put(quantityKey, RowValues.normalize(currentQty.subtract(BigDecimal.valueOf(request.getQuantitySold()))));
        try {
            rowMutationService.updateRow(table.getId(), item.getId(), updated, Actor.system(),
                    MutationOptions.referencing(sale.getId()));
        } catch (RuntimeException e) {
            log.error("INCONSISTENCY: sale {} recorded but quantity of item {} in table {} was not decremented",
                    sale.getId(), item.getId(), table.getId(), e);
        }
        return sale;
    }

    /**
     * 与 {@link #purchase} 相同的校验，但没有副作用
     */
    public AvailabilityResponse checkAvailability(String tableId, String itemId, long quantity) {
        AvailabilityResponse.AvailabilityResponseBuilder response = AvailabilityResponse.builder()
                .tableId(tableId)
                .itemId(itemId)
                .requested(quantity);
        UserTable table = requirePurchasableTable(tableId);
        DataRow item = store.findRow(table.getId(), itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Item", itemId));

        BigDecimal price = RowValues.toDecimal(item.getData().get(priceKey(item))).orElse(null);
        BigDecimal currentQty = ColumnRole.QUANTITY.findKey(item.getData())
                .flatMap(key -> RowValues.toDecimal(item.getData().get(key)))
                .orElse(BigDecimal.ZERO);
        response.unitPrice(price).currentQuantity(currentQty);

        if (price == null || price.signum() <= 0) {
            return response.available(false).reason("Item is not available for sale").build();
        }
        if (quantity < 1) {
            return response.available(false).reason("Quantity must be at least 1").build();
        }
        if (currentQty.compareTo(BigDecimal.valueOf(quantity)) < 0) {
            return response.available(false)
                    .reason(new InsufficientQuantityException(currentQty, quantity).getMessage())
                    .build();
        }
        return response.available(true).build();
    }

    /**
     * 表的销售记录，最新的在前。仅对可编辑该表的用户可见
     */
    public List<Sale> listSales(String tableId, Actor actor) {
        accessGuard.requireWritable(tableId, actor);
        return salesGateway.findSalesForTable(tableId);
    }

    public Sale getSale(String saleId, Actor actor) {
        Sale sale = salesGateway.findSale(saleId).orElseThrow(() -> new ResourceNotFoundException("Sale", saleId));
        accessGuard.requireWritable(sale.getTableId(), actor);
        return sale;
    }

    /**
     * 按 {@code delta} 修正商品数量，流水类型记为 ADJUST
     */
    public DataRow adjustStock(StockAdjustmentRequest request, Actor actor) {
        if (request.getDelta() == null || request.getDelta() == 0) {
            throw new ValidationException("Delta must be a non-zero number");
        }
        UserTable table = store.findTable(request.getTableId())
                .orElseThrow(() -> new ResourceNotFoundException("Table", request.getTableId()));
        if (table.getPurpose() != TablePurpose.SALE) {
            throw new ValidationException("Stock can only be adjusted in sale tables");
        }
        DataRow item = rowMutationService.getRow(table.getId(), request.getItemId(), actor);
        String quantityKey = quantityKey(item);
        BigDecimal currentQty = RowValues.toDecimal(item.getData().get(quantityKey)).orElse(BigDecimal.ZERO);

        Map<String, Object> updated = new LinkedHashMap<>(item.getData());
        updated.put(quantityKey, RowValues.normalize(currentQty.add(BigDecimal.valueOf(request.getDelta()))));
        DataRow saved = rowMutationService.updateRow(table.getId(), item.getId(), updated, actor,
                MutationOptions.adjustment(request.getReason()));
        log.info("Adjusted stock of item {} in table {} by {} ({})", item.getId(), table.getId(),
                request.getDelta(), request.getReason());
        return saved;
    }

    private UserTable requirePurchasableTable(String tableId) {
        UserTable table = store.findTable(tableId).orElseThrow(() -> new ResourceNotFoundException("Table", tableId));
        if (!table.getVisibility().isPubliclyReadable() || table.getPurpose() != TablePurpose.SALE) {
            log.warn("Purchase attempt on table {} which is not a public sale table", tableId);
            throw new TableAccessDeniedException("Table is not available for public sales");
        }
        return table;
    }

    private static BigDecimal requirePrice(DataRow item) {
        BigDecimal price = RowValues.toDecimal(item.getData().get(priceKey(item))).orElse(null);
        if (price == null || price.signum() <= 0) {
            throw new ValidationException("Item is not available for sale",
                    List.of(new FieldError(ColumnRole.PRICE.canonicalName(), price, "Price must be greater than 0")));
        }
        return price;
    }

    private static String priceKey(DataRow item) {
        return ColumnRole.PRICE.findKey(item.getData()).orElse(ColumnRole.PRICE.canonicalName());
    }

    private static String quantityKey(DataRow item) {
        return ColumnRole.QUANTITY.findKey(item.getData()).orElse(ColumnRole.QUANTITY.canonicalName());
    }
}
