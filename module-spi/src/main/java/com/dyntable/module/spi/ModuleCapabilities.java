package com.dyntable.module.spi;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything a module contributes to the capability registry.
 * Keys and tags are local; the registry prefixes them with the module id.
 */
@Value
@Builder
public class ModuleCapabilities {

    @Singular
    List<ColumnTypeHandler> columnTypes;
    @Singular
    Map<String, ValueGenerator> generators;
    @Singular
    List<TableGeneratorDefinition> tableGenerators;

    public static ModuleCapabilities empty() {
        return ModuleCapabilities.builder().build();
    }
}
