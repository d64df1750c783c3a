package com.dyntable.tableservice.controller;

import com.dyntable.tableservice.dto.ColumnTypeInfo;
import com.dyntable.tableservice.dto.GenerateTableRequest;
import com.dyntable.tableservice.dto.GeneratedTableResult;
import com.dyntable.tableservice.dto.TableGeneratorInfo;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.service.generator.TableGeneratorService;
import com.dyntable.tableservice.service.registry.CapabilityCatalogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 注册表当前提供的列类型和表模板
 */
@RestController
@RequestMapping("/api/schema")
@RequiredArgsConstructor
public class SchemaController {

    private final CapabilityCatalogService catalogService;
    private final TableGeneratorService generatorService;

    @GetMapping("/column-types")
    public ResponseEntity<List<ColumnTypeInfo>> listColumnTypes() {
        return ResponseEntity.ok(catalogService.listColumnTypes());
    }

    @GetMapping("/table-generators")
    public ResponseEntity<List<TableGeneratorInfo>> listTableGenerators() {
        return ResponseEntity.ok(catalogService.listTableGenerators());
    }

    @PostMapping("/table-generators/generate")
    public ResponseEntity<GeneratedTableResult> generateTable(@Valid @RequestBody GenerateTableRequest request,
                                                              Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(generatorService.generateTable(request, actor));
    }
}
