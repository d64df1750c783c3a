package com.dyntable.tableservice.controller;

import com.dyntable.tableservice.dto.CloneTableRequest;
import com.dyntable.tableservice.dto.CloneTableResult;
import com.dyntable.tableservice.dto.CreateTableRequest;
import com.dyntable.tableservice.dto.TableDeletionResult;
import com.dyntable.tableservice.dto.UpdateTableRequest;
import com.dyntable.tableservice.entity.UserTable;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.service.schema.TableService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 表的生命周期：创建、查询、更新、删除和克隆
 */
@Slf4j
@RestController
@RequestMapping("/api/tables")
@RequiredArgsConstructor
public class TableController {

    private final TableService tableService;

    @PostMapping
    public ResponseEntity<UserTable> createTable(@Valid @RequestBody CreateTableRequest request, Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tableService.createTable(request, actor));
    }

    @GetMapping
    public ResponseEntity<List<UserTable>> listTables(Actor actor) {
        return ResponseEntity.ok(tableService.listTables(actor));
    }

    @GetMapping("/{tableId}")
    public ResponseEntity<UserTable> getTable(@PathVariable String tableId, Actor actor) {
        return ResponseEntity.ok(tableService.getTable(tableId, actor));
    }

    @PatchMapping("/{tableId}")
    public ResponseEntity<UserTable> updateTable(@PathVariable String tableId,
                                                 @Valid @RequestBody UpdateTableRequest request, Actor actor) {
        return ResponseEntity.ok(tableService.updateTable(tableId, request, actor));
    }

    @DeleteMapping("/{tableId}")
    public ResponseEntity<TableDeletionResult> deleteTable(@PathVariable String tableId, Actor actor) {
        return ResponseEntity.ok(tableService.deleteTable(tableId, actor));
    }

    /**
     * 将表结构（按需连同数据行）复制为调用者拥有的新表
     */
    @PostMapping("/{tableId}/clone")
    public ResponseEntity<CloneTableResult> cloneTable(@PathVariable String tableId,
                                                       @Valid @RequestBody CloneTableRequest request, Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tableService.cloneTable(tableId, request, actor));
    }
}
