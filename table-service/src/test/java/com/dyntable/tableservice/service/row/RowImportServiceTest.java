package com.dyntable.tableservice.service.row;

import com.dyntable.tableservice.dto.AddColumnRequest;
import com.dyntable.tableservice.dto.ImportRequest;
import com.dyntable.tableservice.dto.ImportResult;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.exception.ValidationException;
import com.dyntable.tableservice.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dyntable.tableservice.support.EngineFixture.OWNER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowImportServiceTest {

    private EngineFixture engine;
    private UserTable table;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        table = engine.table("Contacts");
        engine.column(table, AddColumnRequest.builder().name("Full Name").type("text").required(true).build());
        engine.column(table, "Email", "email");
        engine.column(table, "Age", "integer");
    }

    @Test
    void mapsHeadersByNameDisplayNameOrRepairedForm() {
        ImportResult result = engine.importService.importRows(table.getId(), ImportRequest.builder()
                .hasHeaders(true)
                .headers(List.of("full_name", "EMAIL", "age", "Shoe Size"))
                .rows(List.of(
                        List.of("Ada Lovelace", "ada@example.com", "36", "38"),
                        List.of("Alan Turing", "alan@example.com", "41", "44")))
                .build(), OWNER);

        assertThat(result.getImported()).isEqualTo(2);
        assertThat(result.getUnmappedHeaders()).containsExactly("Shoe Size");
        assertThat(engine.store.findRows(table.getId())).extracting(DataRow::getData)
                .allSatisfy(data -> assertThat(data).containsOnlyKeys("fullName", "email", "age"));
    }

    @Test
    void badRowsAreReportedAndTheRestImported() {
        ImportResult result = engine.importService.importRows(table.getId(), ImportRequest.builder()
                .rows(List.of(
                        List.of("Ada", "ada@example.com", "36"),
                        List.of("", "not-an-email", "x"),
                        List.of("Grace", "grace@example.com")))
                .build(), OWNER);

        assertThat(result.getTotalRows()).isEqualTo(3);
        assertThat(result.getImported()).isEqualTo(2);
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getRowErrors()).singleElement().satisfies(error -> {
            assertThat(error.getRowNumber()).isEqualTo(2);
            assertThat(error.getErrors()).hasSize(3);
        });
    }

    @Test
    void failsWhenNoHeaderMatches() {
        assertThatThrownBy(() -> engine.importService.importRows(table.getId(), ImportRequest.builder()
                .hasHeaders(true)
                .headers(List.of("foo", "bar"))
                .rows(List.of(List.of("1", "2")))
                .build(), OWNER))
                .isInstanceOf(ValidationException.class)
                .hasMessage("No import column matches a table column");
    }

    @Test
    void enforcesRowLimit() {
        engine.properties.getImport().setMaxRows(1);

        assertThatThrownBy(() -> engine.importService.importRows(table.getId(), ImportRequest.builder()
                .rows(List.of(List.of("a"), List.of("b")))
                .build(), OWNER))
                .hasMessage("Import has 2 rows, the limit is 1");
    }
}
