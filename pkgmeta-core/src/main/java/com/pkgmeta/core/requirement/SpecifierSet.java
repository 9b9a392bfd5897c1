package com.pkgmeta.core.requirement;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Conjunction of version constraints attached to a requirement.
 *
 * <p>Keeps declaration order and drops duplicates. The canonical string form
 * joins the specifiers sorted by their text with commas, so {@code >=1.0, <2}
 * renders as {@code <2,>=1.0}.
 */
public final class SpecifierSet {

    private static final SpecifierSet EMPTY = new SpecifierSet(List.of());

    private final List<Specifier> specifiers;

    private SpecifierSet(List<Specifier> specifiers) {
        this.specifiers = specifiers;
    }

    public static SpecifierSet empty() {
        return EMPTY;
    }

    public static SpecifierSet of(List<Specifier> specifiers) {
        if (specifiers == null || specifiers.isEmpty()) {
            return EMPTY;
        }
        return new SpecifierSet(List.copyOf(new LinkedHashSet<>(specifiers)));
    }

    public List<Specifier> specifiers() {
        return specifiers;
    }

    public boolean isEmpty() {
        return specifiers.isEmpty();
    }

    public int size() {
        return specifiers.size();
    }

    /**
     * Returns the pinned version when the set holds exactly one equality specifier.
     *
     * @return pinned version, or empty for zero, several or non-equality specifiers
     */
    public Optional<String> pinnedVersion() {
        if (specifiers.size() != 1) {
            return Optional.empty();
        }
        Specifier only = specifiers.get(0);
        return only.isEquality() ? Optional.of(only.version()) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SpecifierSet other && specifiers.equals(other.specifiers);
    }

    @Override
    public int hashCode() {
        return specifiers.hashCode();
    }

    @Override
    public String toString() {
        List<Specifier> sorted = new ArrayList<>(specifiers);
        sorted.sort(null);
        return sorted.stream().map(Specifier::toString).collect(Collectors.joining(","));
    }
}
