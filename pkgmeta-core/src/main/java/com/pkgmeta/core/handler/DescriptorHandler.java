package com.pkgmeta.core.handler;

import com.pkgmeta.core.model.PackageRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Interface for handlers that turn one kind of package descriptor into
 * {@link PackageRecord}s.
 *
 * <p>Handlers are discovered via Java Service Provider Interface (SPI). Each
 * handler reads one descriptor format (PKG-INFO, setup.py, a requirements
 * file, ...) and delegates field normalization to the shared engine.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.pkgmeta.core.handler.DescriptorHandler}
 *
 * @see ExtractionContext
 * @see ExtractionResult
 */
public interface DescriptorHandler {

    /**
     * Returns the datasource identifier of this handler.
     *
     * <p>Recorded on every produced record and used in configuration
     * (e.g., "pypi_setup_py", "pip_requirements").
     *
     * @return unique handler identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this handler.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns glob patterns, relative to the scanned root, for the files this handler reads.
     *
     * @return glob patterns
     */
    Set<String> getFilePatterns();

    /**
     * Parses one descriptor file.
     *
     * <p>Missing optional fields are left empty. A descriptor that is
     * structurally unusable is reported by throwing; no partial record is
     * returned in that case.
     *
     * @param file descriptor file
     * @param context extraction context
     * @return records extracted from the file, usually one
     * @throws DescriptorParseException if the descriptor is malformed
     * @throws IOException if the file cannot be read
     */
    List<PackageRecord> parse(Path file, ExtractionContext context) throws IOException;
}
