package com.dyntable.tableservice.controller;

import com.dyntable.tableservice.dto.ModuleInfo;
import com.dyntable.tableservice.security.Actor;
import com.dyntable.tableservice.service.module.ModuleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/modules")
@RequiredArgsConstructor
public class ModuleController {

    private final ModuleService moduleService;

    @GetMapping
    public ResponseEntity<List<ModuleInfo>> listModules() {
        return ResponseEntity.ok(moduleService.listModules());
    }

    @PostMapping("/{moduleId}/activate")
    public ResponseEntity<ModuleInfo> activate(@PathVariable String moduleId, Actor actor) {
        return ResponseEntity.ok(moduleService.activate(moduleId, actor));
    }

    @PostMapping("/{moduleId}/deactivate")
    public ResponseEntity<ModuleInfo> deactivate(@PathVariable String moduleId, Actor actor) {
        return ResponseEntity.ok(moduleService.deactivate(moduleId, actor));
    }
}
