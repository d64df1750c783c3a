package com.dyntable.tableservice.controller;

import com.dyntable.tableservice.dto.AddColumnRequest;
import com.dyntable.tableservice.dto.ColumnNameFixResult;
import com.dyntable.tableservice.dto.SwapColumnsRequest;
import com.dyntable.tableservice.dto.TypeChangePreview;
import com.dyntable.tableservice.dto.UpdateColumnRequest;
import com.dyntable.tableservice.entity.TableColumn;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.service.schema.TableSchemaService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tables/{tableId}/columns")
@RequiredArgsConstructor
public class ColumnController {

    private final TableSchemaService schemaService;

    @GetMapping
    public ResponseEntity<List<TableColumn>> listColumns(@PathVariable String tableId, Actor actor) {
        return ResponseEntity.ok(schemaService.listColumns(tableId, actor));
    }

    @PostMapping
    public ResponseEntity<TableColumn> addColumn(@PathVariable String tableId,
                                                 @Valid @RequestBody AddColumnRequest request, Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(schemaService.addColumn(tableId, request, actor));
    }

    @PatchMapping("/{columnId}")
    public ResponseEntity<TableColumn> updateColumn(@PathVariable String tableId, @PathVariable String columnId,
                                                    @RequestBody UpdateColumnRequest request, Actor actor) {
        return ResponseEntity.ok(schemaService.updateColumn(tableId, columnId, request, actor));
    }

    @GetMapping("/{columnId}/type-preview")
    public ResponseEntity<TypeChangePreview> previewTypeChange(@PathVariable String tableId,
                                                               @PathVariable String columnId,
                                                               @RequestParam String type, Actor actor) {
        return ResponseEntity.ok(schemaService.previewTypeChange(tableId, columnId, type, actor));
    }

    @DeleteMapping("/{columnId}")
    public ResponseEntity<Void> deleteColumn(@PathVariable String tableId, @PathVariable String columnId,
                                             Actor actor) {
        schemaService.deleteColumn(tableId, columnId, actor);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/bulk-delete")
    public ResponseEntity<Void> deleteColumns(@PathVariable String tableId, @RequestBody List<String> columnIds,
                                              Actor actor) {
        schemaService.deleteColumns(tableId, columnIds, actor);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/recount")
    public ResponseEntity<List<TableColumn>> recountPositions(@PathVariable String tableId, Actor actor) {
        return ResponseEntity.ok(schemaService.recountPositions(tableId, actor));
    }

    @PostMapping("/swap")
    public ResponseEntity<List<TableColumn>> swapPositions(@PathVariable String tableId,
                                                           @Valid @RequestBody SwapColumnsRequest request,
                                                           Actor actor) {
        return ResponseEntity.ok(schemaService.swapPositions(tableId, request.getColumnA(), request.getColumnB(),
                actor));
    }

    @PostMapping("/fix-names")
    public ResponseEntity<ColumnNameFixResult> fixColumnNames(@PathVariable String tableId, Actor actor) {
        return ResponseEntity.ok(schemaService.fixColumnNames(tableId, actor));
    }
}
