package com.dyntable.tableservice.service.generator;

import com.dyntable.tableservice.dto.ColumnTypeInfo;
import com.dyntable.tableservice.dto.GenerateTableRequest;
import com.dyntable.tableservice.dto.GeneratedTableResult;
import com.dyntable.tableservice.dto.TableGeneratorInfo;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.enums.TablePurpose;
import com.dyntable.tableservice.exception.ResourceNotFoundException;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.support.EngineFixture;
import com.dyntable.tableservice.support.SkuTestModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.dyntable.tableservice.support.EngineFixture.OWNER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableGeneratorServiceTest {

    private EngineFixture engine;
    private TableGeneratorService generator;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        engine.modules.install(SkuTestModule.MODULE_ID, SkuTestModule.capabilities());
        generator = engine.generatorService;
    }

    @Test
    void generatesSaleTableWithLedgeredRows() {
        GeneratedTableResult result = generator.generateTable(request("products", "Demo Shop", 10, 42L), OWNER);

        assertThat(result.getTable().getPurpose()).isEqualTo(TablePurpose.SALE);
        assertThat(result.getColumns()).extracting(TableColumn::getName)
                .containsExactly("price", "qty", "name", "description", "category");
        assertThat(result.getRowsCreated() + result.getRowsFailed()).isEqualTo(10);
        assertThat(result.getRowsCreated()).isPositive();
        assertThat(engine.transactions.findByTable(result.getTable().getId())).hasSize(result.getRowsCreated());
        assertThat(engine.store.findRows(result.getTable().getId())).allSatisfy(row -> {
            assertThat(((Number) row.getData().get("price")).doubleValue()).isPositive();
            assertThat(((Number) row.getData().get("qty")).longValue()).isBetween(1L, 50L);
        });
    }

    @Test
    void sameSeedGivesSameData() {
        GeneratedTableResult first = generator.generateTable(request("contacts", "A", 5, 7L), OWNER);
        GeneratedTableResult second = generator.generateTable(request("contacts", "B", 5, 7L), OWNER);

        assertThat(dataOf(first)).isEqualTo(dataOf(second));
    }

    @Test
    void rentalTemplateUsesRoleDefaults() {
        GeneratedTableResult result = generator.generateTable(request("rentals", "Tools", 3, 1L), OWNER);

        assertThat(result.getTable().getPurpose()).isEqualTo(TablePurpose.RENT);
        assertThat(engine.store.findRows(result.getTable().getId())).hasSize(3).allSatisfy(row -> {
            assertThat(row.getData()).containsEntry("used", false).containsEntry("available", true);
        });
    }

    @Test
    void moduleTemplatesAreAvailable() {
        GeneratedTableResult result = generator.generateTable(
                GenerateTableRequest.builder().generatorId("acme:catalog").tableName("Catalog").seed(3L).build(),
                OWNER);

        assertThat(result.getRowsCreated()).isEqualTo(5);
        assertThat(engine.store.findRows(result.getTable().getId())).extracting(row -> row.getData().get("sku"))
                .containsExactly("SKU-001", "SKU-002", "SKU-003", "SKU-004", "SKU-005");
    }

    @Test
    void rejectsUnknownTemplate() {
        assertThatThrownBy(() -> generator.generateTable(request("nope", "X", 1, null), OWNER))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void rejectsRowCountOverLimit() {
        engine.properties.getGenerator().setMaxRows(20);

        assertThatThrownBy(() -> generator.generateTable(request("contacts", "X", 21, null), OWNER))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Row count must be between 0 and 20");
    }

    @Test
    void catalogListsBuiltInAndModuleCapabilities() {
        List<ColumnTypeInfo> types = engine.catalogService.listColumnTypes();
        List<TableGeneratorInfo> templates = engine.catalogService.listTableGenerators();

        assertThat(types).filteredOn(ColumnTypeInfo::isBuiltIn).hasSize(18);
        assertThat(types).filteredOn(type -> !type.isBuiltIn()).singleElement()
                .satisfies(type -> {
                    assertThat(type.getTypeId()).isEqualTo("acme:sku");
                    assertThat(type.getModuleId()).isEqualTo("acme");
                });
        assertThat(templates).extracting(TableGeneratorInfo::getId)
                .containsExactly("products", "rentals", "contacts", "acme:catalog");
    }

    private static GenerateTableRequest request(String generatorId, String name, int rows, Long seed) {
        return GenerateTableRequest.builder()
                .generatorId(generatorId)
                .tableName(name)
                .rowCount(rows)
                .seed(seed)
                .build();
    }

    private List<Map<String, Object>> dataOf(GeneratedTableResult result) {
        return engine.store.findRows(result.getTable().getId()).stream()
                .map(DataRow::getData)
                .collect(Collectors.toList());
    }
}
