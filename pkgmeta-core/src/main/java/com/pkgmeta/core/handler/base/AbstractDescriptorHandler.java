package com.pkgmeta.core.handler.base;

import com.pkgmeta.core.handler.DescriptorHandler;
import com.pkgmeta.core.handler.ExtractionContext;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import com.pkgmeta.core.requirement.RequirementResolver;
import com.pkgmeta.core.requirement.ResolutionOptions;
import com.pkgmeta.core.version.VersionRecoverer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Abstract base class for descriptor handlers providing common functionality.
 *
 * <p>This class reduces code duplication across handler implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per handler class)</li>
 *   <li>File reading utilities ({@link #readFileContent(Path)}, {@link #readFileLines(Path)})</li>
 *   <li>Requirement list resolution that skips malformed entries with a warning</li>
 *   <li>Version recovery for descriptors that compute their version in code</li>
 * </ul>
 *
 * @see DescriptorHandler
 * @see ExtractionContext
 */
public abstract class AbstractDescriptorHandler implements DescriptorHandler {

    /**
     * Logger instance for this handler.
     * Automatically initialized with the concrete handler class name.
     */
    protected final Logger log;

    /**
     * Constructor that initializes the logger for the concrete handler class.
     */
    protected AbstractDescriptorHandler() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== File Reading Utilities ====================

    /**
     * Reads the entire content of a file as a single UTF-8 string.
     *
     * @param file path to the file to read
     * @return file content as string
     * @throws IOException if file cannot be read
     */
    protected String readFileContent(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /**
     * Reads all lines from a file.
     *
     * @param file path to the file to read
     * @return list of lines
     * @throws IOException if file cannot be read
     */
    protected List<String> readFileLines(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    // ==================== Record Helpers ====================

    /**
     * Resolves requirement strings, skipping and logging malformed ones.
     *
     * @param file descriptor the requirements come from, for logging
     * @param requirements requirement strings
     * @param options scope and flag defaults
     * @return dependencies in input order
     */
    protected List<DependentPackage> resolveRequirements(Path file, List<String> requirements, ResolutionOptions options) {
        List<DependentPackage> dependencies = RequirementResolver.resolveAll(requirements, options);
        log.debug("Resolved {} of {} requirements in {} (scope {})",
            dependencies.size(), requirements.size(), file, options.defaultScope());
        return dependencies;
    }

    /**
     * Fills in a missing version from neighbouring modules of a code-form descriptor.
     *
     * @param builder record builder
     * @param file descriptor file
     * @param context extraction context
     */
    protected void recoverVersion(PackageRecord.Builder builder, Path file, ExtractionContext context) {
        if (builder.version() != null) {
            return;
        }
        Optional<VersionRecoverer> recoverer = context.versionRecoverer();
        if (recoverer.isEmpty()) {
            return;
        }
        try {
            recoverer.get().recover(file).ifPresent(version -> {
                log.debug("Recovered version {} for {}", version, file);
                builder.version(version);
            });
        } catch (IOException e) {
            log.warn("Version recovery failed for {}: {}", file, e.getMessage());
        }
    }

    /**
     * Fills in a missing version from a dotted {@code attr:} reference.
     *
     * @param builder record builder
     * @param file descriptor file; the reference is relative to its directory
     * @param reference dotted reference such as {@code mypkg.__version__}
     * @param context extraction context
     */
    protected void recoverVersion(PackageRecord.Builder builder, Path file, String reference, ExtractionContext context) {
        if (builder.version() != null || reference == null) {
            return;
        }
        Path directory = file.toAbsolutePath().getParent();
        context.versionRecoverer()
            .flatMap(recoverer -> recoverer.recoverFromReference(directory, reference))
            .ifPresent(version -> {
                log.debug("Recovered version {} for {} from {}", version, file, reference);
                builder.version(version);
            });
    }
}
