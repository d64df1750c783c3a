package com.dyntable.module.spi;

/**
 * Helpers for namespaced type identifiers of the form {@code moduleId:tag}.
 */
public final class TypeIds {

    public static final char SEPARATOR = ':';

    private TypeIds() {
    }

    public static String qualify(String moduleId, String tag) {
        return moduleId + SEPARATOR + tag;
    }

    public static boolean isNamespaced(String typeId) {
        return typeId != null && typeId.indexOf(SEPARATOR) > 0;
    }

    /**
     * @return the module id, or {@code null} for a built-in identifier
     */
    public static String moduleIdOf(String typeId) {
        if (!isNamespaced(typeId)) {
            return null;
        }
        return typeId.substring(0, typeId.lastIndexOf(SEPARATOR));
    }

    public static String tagOf(String typeId) {
        if (!isNamespaced(typeId)) {
            return typeId;
        }
        return typeId.substring(typeId.lastIndexOf(SEPARATOR) + 1);
    }
}
