package com.pkgmeta.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pkgmeta.core.version.VersionRecoverer;

import java.util.List;

/**
 * Root configuration for metadata extraction.
 *
 * <p>Loaded from {@code pkgmeta.yaml}. Absent sections fall back to their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * handlers:
 *   enabled:
 *     - pypi_setup_py
 *     - pip_requirements
 *
 * versionRecovery:
 *   enabled: true
 *   maxDepth: 4
 *
 * output:
 *   pretty: true
 * }</pre>
 *
 * @param handlers handler selection
 * @param versionRecovery version recovery settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionConfig(
    @JsonProperty("handlers") HandlerConfig handlers,
    @JsonProperty("versionRecovery") VersionRecoveryConfig versionRecovery,
    @JsonProperty("output") OutputConfig output
) {
    public ExtractionConfig {
        if (handlers == null) {
            handlers = HandlerConfig.all();
        }
        if (versionRecovery == null) {
            versionRecovery = VersionRecoveryConfig.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates a default configuration: every handler enabled, version recovery
     * on with the default depth, pretty output.
     *
     * @return default configuration
     */
    public static ExtractionConfig defaults() {
        return new ExtractionConfig(null, null, null);
    }

    /**
     * Handler selection.
     *
     * @param enabled enabled handler ids; empty means all handlers
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HandlerConfig(
        @JsonProperty("enabled") List<String> enabled
    ) {
        public HandlerConfig {
            enabled = enabled != null ? List.copyOf(enabled) : List.of();
        }

        public static HandlerConfig all() {
            return new HandlerConfig(List.of());
        }

        /**
         * Checks if a handler is enabled.
         *
         * @param handlerId handler id to check
         * @return true if the list is empty or names the handler
         */
        public boolean isEnabled(String handlerId) {
            return enabled.isEmpty() || enabled.contains(handlerId);
        }
    }

    /**
     * Version recovery settings.
     *
     * @param enabled whether to search neighbouring modules for a missing version
     * @param maxDepth number of directory levels visited by the search
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VersionRecoveryConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("maxDepth") Integer maxDepth
    ) {
        public VersionRecoveryConfig {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (maxDepth == null || maxDepth < 0) {
                maxDepth = VersionRecoverer.DEFAULT_MAX_DEPTH;
            }
        }

        public static VersionRecoveryConfig defaults() {
            return new VersionRecoveryConfig(null, null);
        }

        public boolean isEnabled() {
            return enabled;
        }
    }

    /**
     * Output settings.
     *
     * @param pretty whether JSON output is indented
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("pretty") Boolean pretty
    ) {
        public OutputConfig {
            if (pretty == null) {
                pretty = Boolean.TRUE;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null);
        }

        public boolean isPretty() {
            return pretty;
        }
    }
}
