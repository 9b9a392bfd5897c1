package com.pkgmeta.core.scanner;

import com.pkgmeta.core.config.ExtractionConfig;
import com.pkgmeta.core.handler.DescriptorHandler;
import com.pkgmeta.core.handler.DescriptorParseException;
import com.pkgmeta.core.handler.ExtractionContext;
import com.pkgmeta.core.handler.ExtractionResult;
import com.pkgmeta.core.handler.base.AbstractDescriptorHandler;
import com.pkgmeta.core.model.PackageRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PackageScanner}.
 */
class PackageScannerTest {

    @TempDir
    Path tempDir;

    /**
     * Reads the first line of a file as a package name; a file starting with
     * {@code !} cannot be parsed and one starting with {@code ?} makes the handler fail.
     */
    static class NameFileHandler extends AbstractDescriptorHandler {
        private final String id;
        private final Set<String> patterns;

        NameFileHandler(String id, String... patterns) {
            this.id = id;
            this.patterns = Set.of(patterns);
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getDisplayName() {
            return "Name file " + id;
        }

        @Override
        public Set<String> getFilePatterns() {
            return patterns;
        }

        @Override
        public List<PackageRecord> parse(Path file, ExtractionContext context) throws IOException {
            String name = readFileLines(file).get(0);
            if (name.startsWith("!")) {
                throw new DescriptorParseException(file, "unreadable name");
            }
            if (name.startsWith("?")) {
                throw new IllegalStateException("handler bug");
            }
            return List.of(PackageRecord.builder(id).name(name).build());
        }
    }

    private Path write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    @Test
    void scan_runsHandlersInIdOrderAndFilesInPathOrder() throws IOException {
        Path b = write("b/names.txt", "beta\n");
        Path a = write("a/names.txt", "alpha\n");
        Path other = write("other.name", "other\n");
        PackageScanner scanner = new PackageScanner(List.of(
            new NameFileHandler("zeta", "**/*.txt"),
            new NameFileHandler("alpha", "{**/,}*.name")));

        List<ExtractionResult> results = scanner.scan(ExtractionContext.of(tempDir));

        assertThat(results).extracting(ExtractionResult::handlerId).containsExactly("alpha", "zeta", "zeta");
        assertThat(results).extracting(ExtractionResult::file).containsExactly(other, a, b);
        assertThat(results).allMatch(ExtractionResult::success);
    }

    @Test
    void scan_withOverlappingPatterns_visitsFileOnce() throws IOException {
        write("pkg/names.txt", "once\n");
        PackageScanner scanner = new PackageScanner(List.of(
            new NameFileHandler("dup", "**/*.txt", "**/names.txt")));

        assertThat(scanner.scan(ExtractionContext.of(tempDir))).hasSize(1);
    }

    @Test
    void scan_withUnparseableFile_reportsFailureAndContinues() throws IOException {
        write("a/names.txt", "!broken\n");
        write("b/names.txt", "fine\n");
        PackageScanner scanner = new PackageScanner(List.of(new NameFileHandler("names", "**/*.txt")));

        List<ExtractionResult> results = scanner.scan(ExtractionContext.of(tempDir));

        assertThat(results).hasSize(2);
        assertThat(results.get(0).success()).isFalse();
        assertThat(results.get(0).records()).isEmpty();
        assertThat(results.get(0).errors()).singleElement().asString().endsWith("unreadable name");
        assertThat(results.get(1).records()).extracting(PackageRecord::name).containsExactly("fine");
    }

    @Test
    void scan_withHandlerRuntimeFailure_reportsFailureAndContinues() throws IOException {
        write("a/names.txt", "?crash\n");
        write("b/names.txt", "fine\n");
        PackageScanner scanner = new PackageScanner(List.of(new NameFileHandler("names", "**/*.txt")));

        List<ExtractionResult> results = scanner.scan(ExtractionContext.of(tempDir));

        assertThat(results).hasSize(2);
        assertThat(results.get(0).success()).isFalse();
        assertThat(results.get(0).errors()).containsExactly("IllegalStateException: handler bug");
        assertThat(results.get(1).records()).extracting(PackageRecord::name).containsExactly("fine");
    }

    @Test
    void scan_withBlankPipfileKey_keepsOtherEntriesAndFiles() throws IOException {
        write("app/Pipfile", """
            [packages]
            "" = {git = "https://github.com/acme/unnamed.git"}
            requests = "*"
            """);
        write("app/requirements.txt", "click==8.1.3\n");

        List<ExtractionResult> results = PackageScanner.discover().scan(ExtractionContext.of(tempDir));

        assertThat(results).extracting(ExtractionResult::handlerId).containsExactly("pip_requirements", "pipfile");
        assertThat(results).allMatch(ExtractionResult::success);
        assertThat(results.get(1).records().get(0).dependencies())
            .extracting(d -> d.purl().toString())
            .containsExactly("pkg:pypi/requests");
    }

    @Test
    void scan_skipsHandlersDisabledInConfig() throws IOException {
        write("pkg/names.txt", "x\n");
        PackageScanner scanner = new PackageScanner(List.of(
            new NameFileHandler("on", "**/*.txt"),
            new NameFileHandler("off", "**/*.txt")));
        ExtractionConfig config = new ExtractionConfig(new ExtractionConfig.HandlerConfig(List.of("on")), null, null);

        List<ExtractionResult> results = scanner.scan(new ExtractionContext(tempDir, config));

        assertThat(results).extracting(ExtractionResult::handlerId).containsExactly("on");
    }

    @Test
    void discover_loadsRegisteredHandlersSortedById() {
        PackageScanner scanner = PackageScanner.discover();

        assertThat(scanner.handlers()).isNotEmpty();
        assertThat(scanner.handlers()).extracting(DescriptorHandler::getId).isSorted();
    }
}
