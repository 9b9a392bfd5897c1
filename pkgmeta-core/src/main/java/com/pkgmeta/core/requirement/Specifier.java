package com.pkgmeta.core.requirement;

import java.util.Objects;
import java.util.Set;

/**
 * One version constraint, such as {@code >=1.0} or {@code ==2.3.1}.
 *
 * @param operator comparison operator
 * @param version version text as written
 */
public record Specifier(String operator, String version) implements Comparable<Specifier> {

    static final Set<String> OPERATORS = Set.of("===", "==", "!=", "<=", ">=", "~=", "<", ">");
    private static final String WILDCARD_SUFFIX = ".*";

    public Specifier {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(version, "version must not be null");
        if (!OPERATORS.contains(operator)) {
            throw new IllegalArgumentException("Unknown version operator: " + operator);
        }
        version = version.trim();
    }

    /**
     * Returns true for {@code ==} or {@code ===} against one concrete version;
     * {@code ==1.*} is a prefix match and does not count.
     *
     * @return true if this specifier pins an exact version
     */
    public boolean isEquality() {
        if ("===".equals(operator)) {
            return true;
        }
        return "==".equals(operator) && !version.endsWith(WILDCARD_SUFFIX);
    }

    @Override
    public int compareTo(Specifier other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        return operator + version;
    }
}
