package com.dyntable.module.spi;

/**
 * Entry point of an installable module, discovered through {@link java.util.ServiceLoader}.
 */
public interface StoreModule {

    /**
     * Namespace of every type and generator the module registers. Must not contain {@code ':'}.
     */
    String id();

    String version();

    String displayName();

    default String description() {
        return "";
    }

    ModuleCapabilities capabilities();

    default void onActivate() {
    }

    default void onDeactivate() {
    }
}
