package com.dyntable.module.spi;

/**
 * Produces a sample value for one cell of a generated row.
 */
@FunctionalInterface
public interface ValueGenerator {

    Object generate(GenerationContext context);
}
