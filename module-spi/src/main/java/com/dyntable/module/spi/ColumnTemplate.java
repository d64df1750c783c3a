package com.dyntable.module.spi;

import lombok.Builder;
import lombok.Value;

/**
 * Column definition used by a table generator.
 */
@Value
@Builder
public class ColumnTemplate {

    String name;
    String type;
    boolean required;
    @Builder.Default
    boolean allowDuplicates = true;
    String defaultValue;
    /**
     * Value generator id used to fill the column; {@code null} falls back to the type's own generator.
     */
    String generatorId;
}
