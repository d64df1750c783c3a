package com.dyntable.module.spi;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Schema template from which a complete table, including sample rows, can be generated.
 */
@Value
@Builder
public class TableGeneratorDefinition {

    String id;
    String displayName;
    String description;
    @Singular
    List<ColumnTemplate> columns;
    @Builder.Default
    int defaultRowCount = 25;
    /**
     * {@code default}, {@code sale} or {@code rent}.
     */
    @Builder.Default
    String targetPurpose = "default";
}
