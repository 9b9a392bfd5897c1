package com.pkgmeta.core.model;

import java.util.List;

/**
 * License information as declared by a descriptor, without interpretation.
 *
 * @param license free-text license field, null when absent or a placeholder
 * @param classifiers trove classifiers in the license category
 */
public record DeclaredLicense(
    String license,
    List<String> classifiers
) {
    private static final DeclaredLicense NONE = new DeclaredLicense(null, List.of());

    /**
     * Compact constructor with validation.
     */
    public DeclaredLicense {
        classifiers = classifiers != null ? List.copyOf(classifiers) : List.of();
    }

    public static DeclaredLicense none() {
        return NONE;
    }

    public boolean isEmpty() {
        return license == null && classifiers.isEmpty();
    }
}
