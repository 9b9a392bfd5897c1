package com.pkgmeta.core.util;

/**
 * Constants for package ecosystem identifiers.
 */
public final class PackageTypes {
    /** Package type of the Python Package Index. */
    public static final String PYPI = "pypi";

    /** Primary language of PyPI packages. */
    public static final String PYTHON = "Python";

    private PackageTypes() {
        // Prevent instantiation
    }
}
