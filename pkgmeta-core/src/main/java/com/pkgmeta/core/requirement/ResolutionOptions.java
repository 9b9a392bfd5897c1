package com.pkgmeta.core.requirement;

import java.util.Objects;

/**
 * Defaults applied when turning requirements into dependency records.
 *
 * @param defaultScope scope used when the marker names no extra
 * @param runtime runtime flag for produced dependencies
 * @param optional optional flag for produced dependencies
 */
public record ResolutionOptions(String defaultScope, boolean runtime, boolean optional) {

    public static final String INSTALL = "install";
    public static final String DEVELOPMENT = "development";

    public ResolutionOptions {
        Objects.requireNonNull(defaultScope, "defaultScope must not be null");
    }

    /** Runtime, non-optional, scope {@value #INSTALL}. */
    public static ResolutionOptions install() {
        return new ResolutionOptions(INSTALL, true, false);
    }

    /** Non-runtime, optional, scope {@value #DEVELOPMENT}. */
    public static ResolutionOptions development() {
        return new ResolutionOptions(DEVELOPMENT, false, true);
    }

    public ResolutionOptions withScope(String scope) {
        return new ResolutionOptions(scope, runtime, optional);
    }
}
