package com.dyntable.tableservice.service.purchase;

import com.dyntable.tableservice.dto.AvailabilityResponse;
import com.dyntable.tableservice.dto.PurchaseRequest;
import com.dyntable.tableservice.dto.StockAdjustmentRequest;
import com.dyntable.tableservice.dto.UpdateTableRequest;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.InventoryTransaction;
import com.dyntable.tableservice.entity.Sale;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.enums.TableVisibility;
import com.dyntable.tableservice.enums.TransactionType;
import com.dyntable.tableservice.exception.InsufficientQuantityException;
import com.dyntable.tableservice.exception.ResourceNotFoundException;
import com.dyntable.tableservice.exception.TableAccessDeniedException;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.dyntable.tableservice.support.EngineFixture.OWNER;
import static com.dyntable.tableservice.support.EngineFixture.STRANGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PurchaseServiceTest {

    private static final Actor CUSTOMER = Actor.user("customer-1");

    private EngineFixture engine;
    private PurchaseService purchases;
    private UserTable shop;
    private DataRow pen;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        purchases = engine.purchaseService;
        shop = engine.table("Shop", TablePurpose.SALE, TableVisibility.PUBLIC);
        engine.column(shop, "Name", "text");
        pen = engine.rowService.createRow(shop.getId(), Map.of("name", "Pen", "price", 5, "qty", 10), OWNER);
    }

    @Test
    void purchaseDecrementsStockAndRecordsTheSale() {
        Sale sale = purchases.purchase(request(3), CUSTOMER);

        assertThat(sale.getQuantitySold()).isEqualTo(3);
        assertThat(sale.getUnitPrice()).isEqualByComparingTo("5.00");
        assertThat(sale.getTotalAmount()).isEqualByComparingTo("15.00");
        assertThat(sale.getItemSnapshot()).containsEntry("qty", 10L);
        assertThat(engine.store.findRow(shop.getId(), pen.getId()).orElseThrow().getData()).containsEntry("qty", 7L);

        List<InventoryTransaction> entries = engine.ledgerService.transactionsForReference(sale.getId());
        assertThat(entries).singleElement().satisfies(tx -> {
            assertThat(tx.getQuantityChange()).isEqualTo(-3L);
            assertThat(tx.getTransactionType()).isEqualTo(TransactionType.UPDATE);
            assertThat(tx.getCreatedBy()).isEqualTo(Actor.SYSTEM_ID);
        });
    }

    @Test
    void insufficientStockLeavesEverythingUntouched() {
        purchases.purchase(request(3), CUSTOMER);
        int ledgerSize = engine.transactions.findAll().size();

        assertThatThrownBy(() -> purchases.purchase(request(8), CUSTOMER))
                .isInstanceOf(InsufficientQuantityException.class)
                .isInstanceOf(ValidationException.class)
                .hasMessage("Insufficient quantity: available 7, requested 8");
        assertThat(engine.transactions.findAll()).hasSize(ledgerSize);
        assertThat(engine.sales.count()).isEqualTo(1);
        assertThat(engine.store.findRow(shop.getId(), pen.getId()).orElseThrow().getData()).containsEntry("qty", 7L);
    }

    @Test
    void privateTablesDoNotSell() {
        engine.tableService.updateTable(shop.getId(),
                UpdateTableRequest.builder().visibility(TableVisibility.PRIVATE).build(), OWNER);

        assertThatThrownBy(() -> purchases.purchase(request(1), CUSTOMER))
                .isInstanceOf(TableAccessDeniedException.class)
                .hasMessage("Table is not available for public sales");
    }

    @Test
    void nonSaleTablesDoNotSell() {
        UserTable board = engine.table("Board", TablePurpose.DEFAULT, TableVisibility.PUBLIC);

        assertThatThrownBy(() -> purchases.purchase(PurchaseRequest.builder()
                .tableId(board.getId()).itemId("row-x").quantitySold(1).build(), CUSTOMER))
                .isInstanceOf(TableAccessDeniedException.class);
    }

    @Test
    void freeItemsAreNotForSale() {
        DataRow gift = engine.rowService.createRow(shop.getId(), Map.of("name", "Gift", "price", 0, "qty", 5), OWNER);

        assertThatThrownBy(() -> purchases.purchase(PurchaseRequest.builder()
                .tableId(shop.getId()).itemId(gift.getId()).quantitySold(1).build(), CUSTOMER))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Item is not available for sale");
    }

    @Test
    void unknownItemIsNotFound() {
        assertThatThrownBy(() -> purchases.purchase(PurchaseRequest.builder()
                .tableId(shop.getId()).itemId("row-missing").quantitySold(1).build(), CUSTOMER))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Item not found: row-missing");
    }

    @Test
    void zeroQuantityIsRejected() {
        assertThatThrownBy(() -> purchases.purchase(request(0), CUSTOMER))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Quantity must be at least 1");
    }

    @Test
    void availabilityHasNoSideEffects() {
        AvailabilityResponse enough = purchases.checkAvailability(shop.getId(), pen.getId(), 10);
        AvailabilityResponse tooMany = purchases.checkAvailability(shop.getId(), pen.getId(), 11);

        assertThat(enough.isAvailable()).isTrue();
        assertThat(tooMany.isAvailable()).isFalse();
        assertThat(tooMany.getReason()).isEqualTo("Insufficient quantity: available 10, requested 11");
        assertThat(engine.sales.count()).isZero();
    }

    @Test
    void adjustmentIsRecordedAsAdjust() {
        DataRow adjusted = purchases.adjustStock(StockAdjustmentRequest.builder()
                .tableId(shop.getId()).itemId(pen.getId()).delta(-4L).reason("Damaged").build(), OWNER);

        assertThat(adjusted.getData()).containsEntry("qty", 6L);
        assertThat(engine.transactions.findByItem(shop.getId(), pen.getId()))
                .filteredOn(tx -> tx.getTransactionType() == TransactionType.ADJUST)
                .singleElement()
                .satisfies(tx -> {
                    assertThat(tx.getQuantityChange()).isEqualTo(-4L);
                    assertThat(tx.getNote()).isEqualTo("Damaged");
                });
    }

    @Test
    void adjustmentNeedsWriteAccess() {
        assertThatThrownBy(() -> purchases.adjustStock(StockAdjustmentRequest.builder()
                .tableId(shop.getId()).itemId(pen.getId()).delta(5L).build(), STRANGER))
                .isInstanceOf(TableAccessDeniedException.class);
    }

    @Test
    void salesAreListedForTheOwner() {
        Sale sale = purchases.purchase(request(2), CUSTOMER);

        assertThat(purchases.listSales(shop.getId(), OWNER)).extracting(Sale::getId).containsExactly(sale.getId());
        assertThat(purchases.getSale(sale.getId(), OWNER).getTotalAmount()).isEqualByComparingTo(new BigDecimal("10"));
        assertThatThrownBy(() -> purchases.listSales(shop.getId(), CUSTOMER))
                .isInstanceOf(TableAccessDeniedException.class);
    }

    private PurchaseRequest request(int quantity) {
        return PurchaseRequest.builder()
                .tableId(shop.getId())
                .itemId(pen.getId())
                .quantitySold(quantity)
                .customerEmail("buyer@example.com")
                .build();
    }
}
