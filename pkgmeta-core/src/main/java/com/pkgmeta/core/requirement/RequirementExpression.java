package com.pkgmeta.core.requirement;

import java.util.List;
import java.util.Objects;

/**
 * Parsed dependency requirement: name, extras, version constraints, optional
 * direct URL and optional environment marker.
 *
 * @param name project name as written
 * @param extras requested extras, possibly empty
 * @param specifiers version constraints, possibly empty
 * @param url direct reference after {@code @}, or null
 * @param marker environment marker, or null
 * @param text original requirement text, trimmed
 */
public record RequirementExpression(
    String name,
    List<String> extras,
    SpecifierSet specifiers,
    String url,
    MarkerExpression marker,
    String text
) {

    public RequirementExpression {
        Objects.requireNonNull(name, "name must not be null");
        extras = extras != null ? List.copyOf(extras) : List.of();
        specifiers = specifiers != null ? specifiers : SpecifierSet.empty();
    }

    public boolean hasMarker() {
        return marker != null;
    }
}
