package com.pkgmeta.core.model;

/**
 * A dependency declared by a package.
 *
 * <p>A resolved dependency is pinned to exactly one version and its {@code purl}
 * carries that version; an unresolved one carries no version. The {@code purl}
 * is null for requirements that name no package (a bare path or URL).
 *
 * @param purl canonical package reference, may be null
 * @param scope dependency scope (install, development, tests, or an extras name)
 * @param runtime true if needed at runtime
 * @param optional true if optional
 * @param resolved true if pinned to a single version
 * @param extractedRequirement normalized version constraint or raw requirement text
 */
public record DependentPackage(
    PackageUrl purl,
    String scope,
    boolean runtime,
    boolean optional,
    boolean resolved,
    String extractedRequirement
) {
    /**
     * Compact constructor with validation.
     */
    public DependentPackage {
        if (scope == null || scope.isBlank()) {
            scope = "install";
        }
        if (resolved && (purl == null || !purl.hasVersion())) {
            throw new IllegalArgumentException("a resolved dependency needs a versioned purl");
        }
        if (!resolved && purl != null && purl.hasVersion()) {
            throw new IllegalArgumentException("an unresolved dependency must not carry a version: " + purl);
        }
    }
}
