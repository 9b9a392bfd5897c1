package com.pkgmeta.core.model;

import java.util.Objects;

/**
 * A person or organization credited by a package descriptor.
 *
 * @param type party type
 * @param name display name, may be null when only an email is declared
 * @param role author or maintainer
 * @param email contact email, may be null when only a name is declared
 */
public record Party(
    PartyType type,
    String name,
    PartyRole role,
    String email
) {
    /**
     * Compact constructor with validation.
     */
    public Party {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(role, "role must not be null");
        if (name == null && email == null) {
            throw new IllegalArgumentException("party needs a name or an email");
        }
    }
}
