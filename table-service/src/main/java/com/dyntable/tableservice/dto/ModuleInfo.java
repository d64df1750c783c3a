package com.dyntable.tableservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModuleInfo {

    private String id;

    private String displayName;

    private String version;

    private String description;

    private boolean active;

    private List<String> columnTypes;

    private List<String> generators;

    private List<String> tableGenerators;
}
