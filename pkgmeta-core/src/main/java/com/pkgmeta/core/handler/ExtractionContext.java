package com.pkgmeta.core.handler;

import com.pkgmeta.core.config.ExtractionConfig;
import com.pkgmeta.core.util.FileUtils;
import com.pkgmeta.core.version.VersionRecoverer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Context provided to handlers during extraction.
 *
 * @param rootPath scanned root directory
 * @param config extraction configuration
 */
public record ExtractionContext(
    Path rootPath,
    ExtractionConfig config
) {
    private static final Logger log = LoggerFactory.getLogger(ExtractionContext.class);

    /**
     * Compact constructor with validation.
     */
    public ExtractionContext {
        Objects.requireNonNull(rootPath, "rootPath must not be null");
        if (config == null) {
            config = ExtractionConfig.defaults();
        }
    }

    /**
     * Creates a context with the default configuration.
     *
     * @param rootPath scanned root directory
     * @return context
     */
    public static ExtractionContext of(Path rootPath) {
        return new ExtractionContext(rootPath, ExtractionConfig.defaults());
    }

    /**
     * Finds files matching the given glob pattern below the root.
     *
     * @param pattern glob pattern relative to the root
     * @return matching file paths, sorted; empty if the walk fails
     */
    public List<Path> findFiles(String pattern) {
        try {
            return FileUtils.findFiles(rootPath, pattern);
        } catch (IOException e) {
            log.warn("Failed to search {} for {}: {}", rootPath, pattern, e.getMessage());
            return List.of();
        }
    }

    /**
     * Returns the version recoverer configured for this run.
     *
     * @return recoverer, or empty when version recovery is disabled
     */
    public Optional<VersionRecoverer> versionRecoverer() {
        ExtractionConfig.VersionRecoveryConfig recovery = config.versionRecovery();
        if (!recovery.isEnabled()) {
            return Optional.empty();
        }
        return Optional.of(new VersionRecoverer(recovery.maxDepth()));
    }
}
