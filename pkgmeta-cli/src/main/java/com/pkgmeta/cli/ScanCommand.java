package com.pkgmeta.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pkgmeta.core.config.ConfigLoader;
import com.pkgmeta.core.config.ExtractionConfig;
import com.pkgmeta.core.handler.ExtractionContext;
import com.pkgmeta.core.handler.ExtractionResult;
import com.pkgmeta.core.model.PackageRecord;
import com.pkgmeta.core.scanner.PackageScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to extract package records from a directory tree.
 *
 * <p>Loads the configuration, runs every enabled handler through
 * {@link PackageScanner} and writes the results as JSON, either to standard
 * output or to a file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Scan current directory
 * pkgmeta scan
 *
 * # Scan a directory and write compact JSON to a file
 * pkgmeta scan /path/to/project -o records.json --compact
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Extract normalized package records from Python descriptors",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: pkgmeta.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Write JSON to this file instead of standard output"
    )
    private Path outputFile;

    @Option(
        names = {"--compact"},
        description = "Write JSON without indentation (overrides config)"
    )
    private boolean compact;

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            if (!Files.isDirectory(root)) {
                log.error("Not a directory: {}", root);
                System.err.println("✗ Not a directory: " + root);
                return 1;
            }

            ExtractionConfig config = loadConfiguration(root);
            List<ExtractionResult> results = PackageScanner.discover().scan(new ExtractionContext(root, config));
            write(toOutput(root, results), config.output().isPretty() && !compact);

            long failed = results.stream().filter(r -> !r.success()).count();
            log.info("Extracted {} records from {} descriptors ({} failed)",
                results.stream().mapToInt(r -> r.records().size()).sum(), results.size(), failed);
            return 0;

        } catch (Exception e) {
            log.error("Scan failed", e);
            System.err.println("✗ Scan failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads configuration; relative paths resolve against the project directory.
     */
    private ExtractionConfig loadConfiguration(Path root) {
        return ConfigLoader.forProject(root, configPath);
    }

    static List<ScanEntry> toOutput(Path root, List<ExtractionResult> results) {
        List<ScanEntry> entries = new ArrayList<>();
        for (ExtractionResult result : results) {
            entries.add(new ScanEntry(
                result.handlerId(),
                root.relativize(result.file().toAbsolutePath().normalize()).toString().replace('\\', '/'),
                result.success(),
                result.errors(),
                result.records()
            ));
        }
        return entries;
    }

    private void write(List<ScanEntry> entries, boolean pretty) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        if (pretty) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        if (outputFile != null) {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(outputFile.toFile(), entries);
            log.info("Wrote {} results to {}", entries.size(), outputFile);
        } else {
            System.out.println(mapper.writeValueAsString(entries));
        }
    }

    /**
     * JSON view of one extraction result, with the file relative to the scanned root.
     *
     * @param handler handler id
     * @param file descriptor path relative to the root
     * @param success whether the descriptor could be read
     * @param errors failure reasons
     * @param records extracted records
     */
    record ScanEntry(
        String handler,
        String file,
        boolean success,
        List<String> errors,
        List<PackageRecord> records
    ) {
    }
}
