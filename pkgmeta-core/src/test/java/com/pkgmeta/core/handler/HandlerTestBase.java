package com.pkgmeta.core.handler;

import com.pkgmeta.core.config.ExtractionConfig;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Base class for handler functional tests.
 *
 * <p>Provides a temporary project directory, helpers for writing descriptor
 * fixtures and an {@link ExtractionContext} with the default configuration.
 */
public abstract class HandlerTestBase {

    @TempDir
    protected Path tempDir;

    protected ExtractionContext context;

    @BeforeEach
    void setUpContext() {
        context = ExtractionContext.of(tempDir);
    }

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "setup.py" or "pkg/__init__.py")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    /**
     * Creates a directory in the temp directory.
     *
     * @param relativePath path relative to tempDir
     * @return the created directory path
     * @throws IOException if directory cannot be created
     */
    protected Path createDirectory(String relativePath) throws IOException {
        Path dirPath = tempDir.resolve(relativePath);
        Files.createDirectories(dirPath);
        return dirPath;
    }

    /**
     * Creates multiple files from a map of relative paths to content.
     *
     * @param files map of relative path to content
     * @throws IOException if any file cannot be created
     */
    protected void createFiles(Map<String, String> files) throws IOException {
        for (Map.Entry<String, String> entry : files.entrySet()) {
            createFile(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Creates a context with a custom configuration.
     *
     * @param config extraction configuration
     * @return new context rooted at tempDir
     */
    protected ExtractionContext createContext(ExtractionConfig config) {
        return new ExtractionContext(tempDir, config);
    }

    /**
     * Asserts that a handler produced exactly one record and returns it.
     *
     * @param records handler output
     * @return the single record
     */
    protected static PackageRecord single(List<PackageRecord> records) {
        assertThat(records).hasSize(1);
        return records.get(0);
    }

    /**
     * Finds a dependency by its package URL text.
     *
     * @param record record to search
     * @param purl package URL, e.g. {@code pkg:pypi/requests}
     * @return the dependency
     */
    protected static DependentPackage dependency(PackageRecord record, String purl) {
        return record.dependencies().stream()
            .filter(d -> d.purl() != null && d.purl().toString().equals(purl))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no dependency " + purl + " in " + record.dependencies()));
    }
}
