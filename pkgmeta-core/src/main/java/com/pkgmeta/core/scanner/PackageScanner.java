package com.pkgmeta.core.scanner;

import com.pkgmeta.core.handler.DescriptorHandler;
import com.pkgmeta.core.handler.ExtractionContext;
import com.pkgmeta.core.handler.ExtractionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs descriptor handlers over a directory tree.
 *
 * <p>Handlers are discovered through {@link ServiceLoader}, filtered by the
 * configuration and run in id order. Each handler sees every file matching
 * any of its patterns once, in path order. A descriptor that cannot be read
 * yields a failed {@link ExtractionResult} and the scan continues.
 *
 * <pre>{@code
 * PackageScanner scanner = PackageScanner.discover();
 * List<ExtractionResult> results = scanner.scan(ExtractionContext.of(root));
 * }</pre>
 */
public class PackageScanner {

    private static final Logger log = LoggerFactory.getLogger(PackageScanner.class);

    private final List<DescriptorHandler> handlers;

    /**
     * Creates a scanner over an explicit handler list.
     *
     * @param handlers handlers to run
     */
    public PackageScanner(List<DescriptorHandler> handlers) {
        List<DescriptorHandler> sorted = new ArrayList<>(handlers);
        sorted.sort(Comparator.comparing(DescriptorHandler::getId));
        this.handlers = List.copyOf(sorted);
    }

    /**
     * Creates a scanner over all handlers registered on the class path.
     *
     * @return scanner
     */
    public static PackageScanner discover() {
        return new PackageScanner(discoverHandlers());
    }

    /**
     * Loads all registered handlers, sorted by id.
     *
     * @return handlers
     */
    public static List<DescriptorHandler> discoverHandlers() {
        log.debug("Discovering descriptor handlers via ServiceLoader");
        List<DescriptorHandler> discovered = new ArrayList<>();
        ServiceLoader.load(DescriptorHandler.class).forEach(discovered::add);
        discovered.sort(Comparator.comparing(DescriptorHandler::getId));
        if (log.isDebugEnabled()) {
            discovered.forEach(h -> log.debug("  - {} ({})", h.getId(), h.getDisplayName()));
        }
        return discovered;
    }

    public List<DescriptorHandler> handlers() {
        return handlers;
    }

    /**
     * Scans the context root with every enabled handler.
     *
     * @param context extraction context
     * @return one result per handled file, ordered by handler id then path
     */
    public List<ExtractionResult> scan(ExtractionContext context) {
        log.info("Scanning {} with {} handlers", context.rootPath(), handlers.size());
        List<ExtractionResult> results = new ArrayList<>();
        int failures = 0;

        for (DescriptorHandler handler : handlers) {
            if (!context.config().handlers().isEnabled(handler.getId())) {
                log.debug("Handler {} is disabled in configuration", handler.getId());
                continue;
            }
            for (Path file : matchingFiles(handler, context)) {
                ExtractionResult result = parse(handler, file, context);
                if (!result.success()) {
                    failures++;
                }
                results.add(result);
            }
        }

        log.info("Scan complete: {} descriptors, {} failed", results.size(), failures);
        return results;
    }

    private Set<Path> matchingFiles(DescriptorHandler handler, ExtractionContext context) {
        Set<Path> files = new TreeSet<>();
        for (String pattern : handler.getFilePatterns()) {
            files.addAll(context.findFiles(pattern));
        }
        log.debug("Handler {} matched {} files", handler.getId(), files.size());
        return files;
    }

    private ExtractionResult parse(DescriptorHandler handler, Path file, ExtractionContext context) {
        try {
            return ExtractionResult.of(handler.getId(), file, handler.parse(file, context));
        } catch (IOException e) {
            log.warn("Failed to parse {} with {}: {}", file, handler.getId(), e.getMessage());
            return ExtractionResult.failed(handler.getId(), file, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Handler {} failed on {}", handler.getId(), file, e);
            return ExtractionResult.failed(handler.getId(), file, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
