package com.dyntable.tableservice.service.schema;

import com.dyntable.tableservice.dto.AddColumnRequest;
import com.dyntable.tableservice.dto.ColumnNameFixResult;
import com.dyntable.tableservice.dto.TypeChangePreview;
import com.dyntable.tableservice.dto.UpdateColumnRequest;
import com.dyntable.tableservice.dto.UpdateTableRequest;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.enums.TableVisibility;
import com.dyntable.tableservice.exception.ColumnTypeNotFoundException;
import com.dyntable.tableservice.exception.ConflictException;
import com.dyntable.tableservice.exception.TableAccessDeniedException;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.dyntable.tableservice.support.EngineFixture.OWNER;
import static com.dyntable.tableservice.support.EngineFixture.STRANGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableSchemaServiceTest {

    private EngineFixture engine;
    private TableSchemaService schemaService;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        schemaService = engine.schemaService;
    }

    @Test
    void saleTableStartsWithProtectedColumns() {
        UserTable table = engine.table("Shop", TablePurpose.SALE, TableVisibility.PUBLIC);

        List<TableColumn> columns = schemaService.listColumns(table.getId(), OWNER);

        assertThat(columns).extracting(TableColumn::getName).containsExactly("price", "qty");
        assertThat(columns).extracting(TableColumn::getPosition).containsExactly(0, 1);
        assertThat(columns).allMatch(TableColumn::isRequired);
    }

    @Test
    void addColumnNormalizesNameAndAppends() {
        UserTable table = engine.table("Contacts");
        engine.column(table, "Full Name", "text");

        TableColumn email = engine.column(table, "Email Address", "email");

        assertThat(email.getName()).isEqualTo("emailAddress");
        assertThat(email.getDisplayName()).isEqualTo("Email Address");
        assertThat(email.getPosition()).isEqualTo(1);
    }

    @Test
    void insertingShiftsLaterColumns() {
        UserTable table = engine.table("Contacts");
        engine.column(table, "First", "text");
        engine.column(table, "Second", "text");

        engine.column(table, AddColumnRequest.builder().name("Inserted").type("text").position(1).build());

        assertThat(schemaService.listColumns(table.getId(), OWNER)).extracting(TableColumn::getName)
                .containsExactly("first", "inserted", "second");
    }

    @Test
    void rejectsDuplicateNameIgnoringCase() {
        UserTable table = engine.table("Contacts");
        engine.column(table, "Email", "email");

        assertThatThrownBy(() -> engine.column(table, "EMAIL", "text"))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Column 'email' already exists");
    }

    @Test
    void rejectsUnknownTypeAndBadDefault() {
        UserTable table = engine.table("Contacts");

        assertThatThrownBy(() -> engine.column(table, "Code", "acme:sku"))
                .isInstanceOf(ColumnTypeNotFoundException.class);
        assertThatThrownBy(() -> engine.column(table, AddColumnRequest.builder()
                .name("Count").type("integer").defaultValue("many").build()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid default value");
    }

    @Test
    void protectedColumnsCannotBeDeleted() {
        UserTable table = engine.table("Shop", TablePurpose.SALE, TableVisibility.PUBLIC);
        TableColumn notes = engine.column(table, "Notes", "text");
        List<String> ids = schemaService.listColumns(table.getId(), OWNER).stream()
                .map(TableColumn::getId).toList();

        assertThatThrownBy(() -> schemaService.deleteColumns(table.getId(), ids, OWNER))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Protected column(s) of a sale table cannot be deleted: price, qty");
        assertThat(schemaService.listColumns(table.getId(), OWNER)).extracting(TableColumn::getId)
                .contains(notes.getId());
    }

    @Test
    void leavingSalePurposeReleasesProtectedColumns() {
        UserTable table = engine.table("Shop", TablePurpose.SALE, TableVisibility.PUBLIC);
        List<String> ids = schemaService.listColumns(table.getId(), OWNER).stream()
                .map(TableColumn::getId).toList();
        assertThatThrownBy(() -> schemaService.deleteColumns(table.getId(), ids, OWNER))
                .isInstanceOf(ValidationException.class);

        engine.tableService.updateTable(table.getId(),
                UpdateTableRequest.builder().purpose(TablePurpose.DEFAULT).build(), OWNER);
        schemaService.deleteColumns(table.getId(), ids, OWNER);

        assertThat(schemaService.listColumns(table.getId(), OWNER)).isEmpty();
    }

    @Test
    void deletingAColumnRemovesItsRowValues() {
        UserTable table = engine.table("Contacts");
        engine.column(table, "Name", "text");
        TableColumn city = engine.column(table, "City", "text");
        DataRow row = engine.rowService.createRow(table.getId(), Map.of("name", "Ada", "city", "London"), OWNER);

        schemaService.deleteColumn(table.getId(), city.getId(), OWNER);

        assertThat(engine.store.findRow(table.getId(), row.getId()).orElseThrow().getData())
                .containsOnlyKeys("name");
    }

    @Test
    void renameMigratesRowKeys() {
        UserTable table = engine.table("Contacts");
        TableColumn name = engine.column(table, "Name", "text");
        DataRow row = engine.rowService.createRow(table.getId(), Map.of("name", "Ada"), OWNER);

        TableColumn renamed = schemaService.renameColumn(table.getId(), name.getId(), "Full Name", OWNER);

        assertThat(renamed.getName()).isEqualTo("fullName");
        assertThat(engine.store.findRow(table.getId(), row.getId()).orElseThrow().getData())
                .containsEntry("fullName", "Ada")
                .doesNotContainKey("name");
    }

    @Test
    void protectedColumnsCannotBeRenamed() {
        UserTable table = engine.table("Shop", TablePurpose.SALE, TableVisibility.PRIVATE);
        TableColumn price = schemaService.listColumns(table.getId(), OWNER).get(0);

        assertThatThrownBy(() -> schemaService.renameColumn(table.getId(), price.getId(), "Cost", OWNER))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("cannot be renamed");
    }

    @Test
    void previewCountsIncompatibleValues() {
        UserTable table = engine.table("Contacts");
        TableColumn code = engine.column(table, "Code", "text");
        engine.rowService.createRow(table.getId(), Map.of("code", "12"), OWNER);
        engine.rowService.createRow(table.getId(), Map.of("code", "twelve"), OWNER);
        engine.rowService.createRow(table.getId(), Map.of(), OWNER);

        TypeChangePreview preview = schemaService.previewTypeChange(table.getId(), code.getId(), "integer", OWNER);

        assertThat(preview.getTotalRows()).isEqualTo(3);
        assertThat(preview.getIncompatibleRows()).isEqualTo(1);
        assertThat(preview.getCompatibleRows()).isEqualTo(2);
        assertThat(preview.getSampleIssues()).singleElement()
                .satisfies(issue -> assertThat(issue.getCurrentValue()).isEqualTo("twelve"));
    }

    @Test
    void disallowingDuplicatesFailsWhenRowsAlreadyRepeat() {
        UserTable table = engine.table("Contacts");
        TableColumn city = engine.column(table, "City", "text");
        engine.rowService.createRow(table.getId(), Map.of("city", "Paris"), OWNER);
        engine.rowService.createRow(table.getId(), Map.of("city", "Paris"), OWNER);

        UpdateColumnRequest request = UpdateColumnRequest.builder().allowDuplicates(false).build();

        assertThatThrownBy(() -> schemaService.updateColumn(table.getId(), city.getId(), request, OWNER))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void recountIsIdempotent() {
        UserTable table = engine.table("Contacts");
        TableColumn a = engine.column(table, "Alpha", "text");
        TableColumn b = engine.column(table, "Beta", "text");
        TableColumn c = engine.column(table, "Gamma", "text");
        schemaService.deleteColumn(table.getId(), b.getId(), OWNER);

        List<TableColumn> first = schemaService.recountPositions(table.getId(), OWNER);
        List<TableColumn> second = schemaService.recountPositions(table.getId(), OWNER);

        assertThat(first).extracting(TableColumn::getId).containsExactly(a.getId(), c.getId());
        assertThat(first).extracting(TableColumn::getPosition).containsExactly(0, 1);
        assertThat(second).extracting(TableColumn::getPosition).containsExactly(0, 1);
    }

    @Test
    void swapExchangesPositions() {
        UserTable table = engine.table("Contacts");
        TableColumn a = engine.column(table, "Alpha", "text");
        TableColumn b = engine.column(table, "Beta", "text");

        schemaService.swapPositions(table.getId(), a.getId(), b.getId(), OWNER);

        assertThat(schemaService.listColumns(table.getId(), OWNER)).extracting(TableColumn::getName)
                .containsExactly("beta", "alpha");
        assertThatThrownBy(() -> schemaService.swapPositions(table.getId(), a.getId(), a.getId(), OWNER))
                .hasMessage("Cannot swap a column with itself");
    }

    @Test
    void fixColumnNamesRepairsLegacyNamesWithoutCollisions() {
        UserTable table = engine.table("Legacy");
        engine.column(table, "Unit Price", "number");
        LocalDateTime now = LocalDateTime.now();
        engine.store.saveColumn(TableColumn.builder().id("col-legacy").tableId(table.getId()).name("unit_price")
                .type("number").position(1).createdAt(now).updatedAt(now).build());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("unit_price", 4L);
        engine.store.saveRow(DataRow.builder().id("row-legacy").tableId(table.getId()).data(data)
                .createdBy(OWNER.getId()).createdAt(now).updatedAt(now).build());

        ColumnNameFixResult result = schemaService.fixColumnNames(table.getId(), OWNER);

        assertThat(result.getRenamed()).containsEntry("unit_price", "unitPriceB");
        assertThat(result.getRowsUpdated()).isEqualTo(1);
        assertThat(engine.store.findRow(table.getId(), "row-legacy").orElseThrow().getData())
                .containsEntry("unitPriceB", 4L);
    }

    @Test
    void strangersCannotChangeSchema() {
        UserTable table = engine.table("Contacts", TablePurpose.DEFAULT, TableVisibility.PUBLIC);

        assertThat(schemaService.listColumns(table.getId(), STRANGER)).isEmpty();
        assertThatThrownBy(() -> schemaService.addColumn(table.getId(),
                AddColumnRequest.builder().name("Name").type("text").build(), STRANGER))
                .isInstanceOf(TableAccessDeniedException.class);
    }
}
