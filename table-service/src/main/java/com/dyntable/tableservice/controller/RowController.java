package com.dyntable.tableservice.controller;

import com.dyntable.tableservice.dto.ImportRequest;
import com.dyntable.tableservice.dto.ImportResult;
import com.dyntable.tableservice.dto.MassActionRequest;
import com.dyntable.tableservice.dto.MassActionResult;
import com.dyntable.tableservice.dto.RowFilter;
import com.dyntable.tableservice.dto.RowPage;
import com.dyntable.tableservice.entity.DataRow;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.service.row.RowImportService;
import com.dyntable.tableservice.service.row.RowMutationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 单张表的行写入、过滤列表、批量操作和批量导入
 */
@RestController
@RequestMapping("/api/tables/{tableId}/rows")
@RequiredArgsConstructor
public class RowController {

    private final RowMutationService rowMutationService;
    private final RowImportService rowImportService;

    @GetMapping
    public ResponseEntity<RowPage> listRows(@PathVariable String tableId,
                                            @RequestParam(defaultValue = "0") int page,
                                            @RequestParam(defaultValue = "50") int size,
                                            Actor actor) {
        return ResponseEntity.ok(rowMutationService.listRows(tableId, List.of(), page, size, actor));
    }

    /**
     * 带过滤条件的列表查询，所有条件须同时满足
     */
    @PostMapping("/search")
    public ResponseEntity<RowPage> searchRows(@PathVariable String tableId,
                                              @RequestBody List<RowFilter> filters,
                                              @RequestParam(defaultValue = "0") int page,
                                              @RequestParam(defaultValue = "50") int size,
                                              Actor actor) {
        return ResponseEntity.ok(rowMutationService.listRows(tableId, filters, page, size, actor));
    }

    @GetMapping("/{rowId}")
    public ResponseEntity<DataRow> getRow(@PathVariable String tableId, @PathVariable String rowId, Actor actor) {
        return ResponseEntity.ok(rowMutationService.getRow(tableId, rowId, actor));
    }

    @PostMapping
    public ResponseEntity<DataRow> createRow(@PathVariable String tableId, @RequestBody Map<String, Object> data,
                                             Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(rowMutationService.createRow(tableId, data, actor));
    }

    @PutMapping("/{rowId}")
    public ResponseEntity<DataRow> updateRow(@PathVariable String tableId, @PathVariable String rowId,
                                             @RequestBody Map<String, Object> data, Actor actor) {
        return ResponseEntity.ok(rowMutationService.updateRow(tableId, rowId, data, actor));
    }

    @DeleteMapping("/{rowId}")
    public ResponseEntity<Void> deleteRow(@PathVariable String tableId, @PathVariable String rowId, Actor actor) {
        rowMutationService.deleteRow(tableId, rowId, actor);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/mass-action")
    public ResponseEntity<MassActionResult> executeMassAction(@PathVariable String tableId,
                                                              @Valid @RequestBody MassActionRequest request,
                                                              Actor actor) {
        return ResponseEntity.ok(rowMutationService.executeMassAction(tableId, request, actor));
    }

    @PostMapping("/import")
    public ResponseEntity<ImportResult> importRows(@PathVariable String tableId,
                                                   @Valid @RequestBody ImportRequest request, Actor actor) {
        return ResponseEntity.ok(rowImportService.importRows(tableId, request, actor));
    }
}
