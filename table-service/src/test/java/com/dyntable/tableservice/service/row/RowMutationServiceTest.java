package com.dyntable.tableservice.service.row;

import com.dyntable.tableservice.dto.AddColumnRequest;
import com.dyntable.tableservice.dto.FieldError;
import com.dyntable.tableservice.dto.MassActionItemResult;
import com.dyntable.tableservice.dto.MassActionRequest;
import com.dyntable.tableservice.dto.MassActionResult;
import com.dyntable.tableservice.dto.RowFilter;
import com.dyntable.tableservice.dto.RowPage;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.InventoryTransaction;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.FilterOperator;
import com.dyntable.tableservice.enums.MassActionType;
import com.dyntable.tableservice.enums.StatusCategory;
import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.enums.TableVisibility;
import com.dyntable.tableservice.enums.TransactionType;
import com.dyntable.tableservice.exception.ColumnTypeNotFoundException;
import com.dyntable.tableservice.exception.ConflictException;
import com.dyntable.tableservice.exception.ResourceNotFoundException;
import com.dyntable.tableservice.exception.TableAccessDeniedException;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.support.EngineFixture;
import com.dyntable.tableservice.support.SkuTestModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.dyntable.tableservice.support.EngineFixture.OWNER;
import static com.dyntable.tableservice.support.EngineFixture.STRANGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

class RowMutationServiceTest {

    private EngineFixture engine;
    private RowMutationService rows;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        rows = engine.rowService;
    }

    @Test
    void storesTypedValuesForEveryColumn() {
        UserTable table = engine.table("Contacts");
        engine.column(table, "Name", "text");
        engine.column(table, "Age", "integer");
        engine.column(table, "Active", "boolean");

        DataRow row = rows.createRow(table.getId(), Map.of("name", " Ada ", "age", "36", "active", "yes"), OWNER);

        assertThat(row.getData()).containsEntry("name", "Ada")
                .containsEntry("age", 36L)
                .containsEntry("active", true);
        assertThat(row.getCreatedBy()).isEqualTo(OWNER.getId());
    }

    @Test
    void requiredColumnMustHaveAValue() {
        UserTable table = engine.table("Contacts");
        engine.column(table, AddColumnRequest.builder().name("Name").type("text").required(true).build());

        ValidationException e = catchThrowableOfType(
                () -> rows.createRow(table.getId(), Map.of("name", "  "), OWNER), ValidationException.class);

        assertThat(e.getStatus()).isEqualTo(StatusCategory.VALIDATION_FAILED);
        assertThat(e.getErrors()).extracting(FieldError::getField, FieldError::getReason)
                .containsExactly(tuple("name", "Required field is empty"));
    }

    @Test
    void defaultsFillOptionalColumnsOnCreateOnly() {
        UserTable table = engine.table("Tasks");
        engine.column(table, "Title", "text");
        engine.column(table, AddColumnRequest.builder().name("Priority").type("integer").defaultValue("3").build());

        DataRow created = rows.createRow(table.getId(), Map.of("title", "Ship"), OWNER);
        DataRow updated = rows.updateRow(table.getId(), created.getId(), Map.of("title", "Ship it"), OWNER);

        assertThat(created.getData()).containsEntry("priority", 3L);
        assertThat(updated.getData()).containsEntry("priority", null);
    }

    @Test
    void collectsEveryFieldErrorAtOnce() {
        UserTable table = engine.table("Contacts");
        engine.column(table, "Age", "integer");
        engine.column(table, "Email", "email");
        engine.column(table, "Born", "date");

        ValidationException e = catchThrowableOfType(() -> rows.createRow(table.getId(),
                Map.of("age", "old", "email", "nope", "born", "yesterday"), OWNER), ValidationException.class);

        assertThat(e).hasMessage("Validation failed for 3 field(s)");
        assertThat(e.getErrors()).extracting(FieldError::getField).containsExactly("age", "email", "born");
        assertThat(engine.store.countRows(table.getId())).isZero();
    }

    @Test
    void duplicateValueIsAConflict() {
        UserTable table = engine.table("Contacts");
        engine.column(table, AddColumnRequest.builder().name("Email").type("email").allowDuplicates(false).build());
        rows.createRow(table.getId(), Map.of("email", "a@b.co"), OWNER);

        assertThatThrownBy(() -> rows.createRow(table.getId(), Map.of("email", "a@b.co"), OWNER))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Value 'a@b.co' already exists in column 'Email'");
    }

    @Test
    void rowDoesNotConflictWithItself() {
        UserTable table = engine.table("Contacts");
        engine.column(table, AddColumnRequest.builder().name("Code").type("integer").allowDuplicates(false).build());
        engine.column(table, "Note", "text");
        DataRow row = rows.createRow(table.getId(), Map.of("code", 7), OWNER);

        DataRow updated = rows.updateRow(table.getId(), row.getId(), Map.of("code", "7", "note", "same"), OWNER);

        assertThat(updated.getData()).containsEntry("code", 7L).containsEntry("note", "same");
    }

    @Test
    void numericDuplicatesCompareByValue() {
        UserTable table = engine.table("Contacts");
        engine.column(table, AddColumnRequest.builder().name("Code").type("number").allowDuplicates(false).build());
        rows.createRow(table.getId(), Map.of("code", "5"), OWNER);

        assertThatThrownBy(() -> rows.createRow(table.getId(), Map.of("code", "5.0"), OWNER))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void saleTableWritesAreMirroredInTheLedger() {
        UserTable table = engine.table("Shop", TablePurpose.SALE, TableVisibility.PRIVATE);

        DataRow row = rows.createRow(table.getId(), Map.of("price", 5, "qty", 10), OWNER);
        rows.updateRow(table.getId(), row.getId(), Map.of("price", 5, "qty", 7), OWNER);
        rows.deleteRow(table.getId(), row.getId(), OWNER);

        List<InventoryTransaction> ledger = engine.transactions.findByItem(table.getId(), row.getId());
        assertThat(ledger).extracting(InventoryTransaction::getTransactionType)
                .containsExactly(TransactionType.ADD, TransactionType.UPDATE, TransactionType.REMOVE);
        assertThat(ledger).extracting(InventoryTransaction::getQuantityChange).containsExactly(10L, -3L, -7L);
        assertThat(ledger.get(1).getPreviousData()).containsEntry("qty", 10L);
        assertThat(ledger.get(1).getNewData()).containsEntry("qty", 7L);
        assertThat(engine.events.getTransactions()).hasSize(3);
    }

    @Test
    void ordinaryTablesHaveNoLedger() {
        UserTable table = engine.table("Contacts");
        engine.column(table, "Qty", "integer");

        rows.createRow(table.getId(), Map.of("qty", 4), OWNER);

        assertThat(engine.transactions.findAll()).isEmpty();
    }

    @Test
    void ledgerFailureDoesNotUndoTheRowWrite() {
        UserTable table = engine.table("Shop", TablePurpose.SALE, TableVisibility.PRIVATE);
        engine.transactions.setFailing(true);

        DataRow row = rows.createRow(table.getId(), Map.of("price", 5, "qty", 10), OWNER);

        assertThat(engine.store.findRow(table.getId(), row.getId())).isPresent();
        assertThat(engine.transactions.findAll()).isEmpty();
    }

    @Test
    void strangerCannotWritePublicTable() {
        UserTable table = engine.table("Board", TablePurpose.DEFAULT, TableVisibility.PUBLIC);
        engine.column(table, "Text", "text");
        DataRow row = rows.createRow(table.getId(), Map.of("text", "hello"), OWNER);

        assertThat(rows.getRow(table.getId(), row.getId(), STRANGER).getData()).containsEntry("text", "hello");
        assertThatThrownBy(() -> rows.updateRow(table.getId(), row.getId(), Map.of("text", "hacked"), STRANGER))
                .isInstanceOf(TableAccessDeniedException.class);
    }

    @Test
    void missingRowIsNotFound() {
        UserTable table = engine.table("Contacts");

        assertThatThrownBy(() -> rows.deleteRow(table.getId(), "row-missing", OWNER))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Row not found: row-missing");
    }

    @Test
    void deactivatedModuleTypeBlocksNewValuesButKeepsOldOnes() {
        engine.modules.install(SkuTestModule.MODULE_ID, SkuTestModule.capabilities());
        UserTable table = engine.table("Catalog");
        engine.column(table, "Code", SkuTestModule.SKU_TYPE);
        engine.column(table, "Note", "text");
        DataRow row = rows.createRow(table.getId(), Map.of("code", "abc-123"), OWNER);

        engine.modules.deactivate(SkuTestModule.MODULE_ID);

        DataRow untouched = rows.updateRow(table.getId(), row.getId(),
                Map.of("code", "ABC-123", "note", "kept"), OWNER);
        assertThat(untouched.getData()).containsEntry("code", "ABC-123");
        ColumnTypeNotFoundException e = catchThrowableOfType(() -> rows.updateRow(table.getId(), row.getId(),
                Map.of("code", "XYZ-999"), OWNER), ColumnTypeNotFoundException.class);
        assertThat(e.getStatus()).isEqualTo(StatusCategory.NOT_FOUND);
    }

    @Test
    void filtersAndPagesRows() {
        UserTable table = engine.table("Contacts");
        engine.column(table, "Name", "text");
        engine.column(table, "Age", "integer");
        rows.createRow(table.getId(), Map.of("name", "Ada", "age", 36), OWNER);
        rows.createRow(table.getId(), Map.of("name", "Alan", "age", 41), OWNER);
        rows.createRow(table.getId(), Map.of("name", "Grace"), OWNER);

        RowPage older = rows.listRows(table.getId(),
                List.of(new RowFilter("age", FilterOperator.GT, "40")), 0, 10, OWNER);
        RowPage named = rows.listRows(table.getId(),
                List.of(new RowFilter("name", FilterOperator.CONTAINS, "a")), 1, 2, OWNER);
        RowPage noAge = rows.listRows(table.getId(),
                List.of(new RowFilter("age", FilterOperator.EMPTY, null)), 0, 10, OWNER);

        assertThat(older.getRows()).extracting(r -> r.getData().get("name")).containsExactly("Alan");
        assertThat(named.getTotalRows()).isEqualTo(3);
        assertThat(named.getTotalPages()).isEqualTo(2);
        assertThat(named.getRows()).hasSize(1);
        assertThat(noAge.getRows()).extracting(r -> r.getData().get("name")).containsExactly("Grace");
    }

    @Test
    void unknownFilterColumnIsRejected() {
        UserTable table = engine.table("Contacts");

        assertThatThrownBy(() -> rows.listRows(table.getId(),
                List.of(new RowFilter("ghost", FilterOperator.EQ, "x")), 0, 10, OWNER))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid filters");
    }

    @Test
    void selectAllTargetsOnlyFilteredRows() {
        UserTable table = engine.table("Inbox");
        engine.column(table, "Status", "text");
        List<String> archivedIds = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            String status = i < 10 ? "archived" : "open";
            DataRow row = rows.createRow(table.getId(), Map.of("status", status), OWNER);
            if (i < 10) {
                archivedIds.add(row.getId());
            }
        }

        MassActionResult result = rows.executeMassAction(table.getId(), MassActionRequest.builder()
                .action(MassActionType.DELETE)
                .selectAll(true)
                .rowIds(List.of("ignored-1", "ignored-2"))
                .filters(List.of(new RowFilter("status", FilterOperator.EQ, "archived")))
                .build(), OWNER);

        assertThat(result.getRequested()).isEqualTo(10);
        assertThat(result.getSucceeded()).isEqualTo(10);
        assertThat(engine.store.countRows(table.getId())).isEqualTo(40);
        assertThat(engine.store.findRows(table.getId())).extracting(DataRow::getId)
                .doesNotContainAnyElementsOf(archivedIds);
    }

    @Test
    void massUpdateReportsEachItem() {
        UserTable table = engine.table("Contacts");
        engine.column(table, AddColumnRequest.builder().name("Code").type("integer").allowDuplicates(false).build());
        DataRow first = rows.createRow(table.getId(), Map.of("code", 1), OWNER);
        DataRow second = rows.createRow(table.getId(), Map.of("code", 2), OWNER);

        MassActionResult result = rows.executeMassAction(table.getId(), MassActionRequest.builder()
                .action(MassActionType.SET_FIELD_VALUE)
                .rowIds(List.of(first.getId(), second.getId(), "row-missing"))
                .fieldName("code")
                .value(9)
                .build(), OWNER);

        assertThat(result.getSucceeded()).isEqualTo(1);
        assertThat(result.getFailed()).isEqualTo(2);
        assertThat(result.getResults()).extracting(MassActionItemResult::getStatus)
                .containsExactly(StatusCategory.OK, StatusCategory.CONFLICT, StatusCategory.NOT_FOUND);
        assertThat(engine.store.findRow(table.getId(), first.getId()).orElseThrow().getData())
                .containsEntry("code", 9L);
    }

    @Test
    void massActionNeedsTargets() {
        UserTable table = engine.table("Contacts");

        assertThatThrownBy(() -> rows.executeMassAction(table.getId(), MassActionRequest.builder()
                .action(MassActionType.DELETE)
                .rowIds(List.of())
                .build(), OWNER))
                .isInstanceOf(ValidationException.class)
                .hasMessage("No rows selected");
    }
}
