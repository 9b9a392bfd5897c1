package com.pkgmeta.core.normalize;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical purposes a project URL can serve, with the label synonyms that
 * identify each one. Roles are matched in declaration order.
 */
public enum UrlRole {
    BUG_TRACKING(Set.of("tracker", "bug reports", "github: issues", "bug tracker", "issues", "issue tracker")),
    CODE_VIEW(Set.of("source", "source code", "code")),
    VCS(Set.of("github", "gitlab", "github: repo", "repository")),
    HOMEPAGE(Set.of("website", "homepage", "home"));

    private final Set<String> synonyms;

    UrlRole(Set<String> synonyms) {
        this.synonyms = synonyms;
    }

    public Set<String> synonyms() {
        return synonyms;
    }

    /**
     * Finds the role whose synonym list contains a label.
     *
     * @param label URL label, compared trimmed and lower-cased
     * @return matching role, or empty for an unrecognized label
     */
    public static Optional<UrlRole> forLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (UrlRole role : values()) {
            if (role.synonyms.contains(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
