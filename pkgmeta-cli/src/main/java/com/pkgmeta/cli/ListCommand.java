package com.pkgmeta.cli;

import com.pkgmeta.core.handler.DescriptorHandler;
import com.pkgmeta.core.scanner.PackageScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to list available descriptor handlers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * pkgmeta list handlers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available descriptor handlers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: handlers",
        defaultValue = "handlers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "handlers", "handler" -> listHandlers();
            default -> {
                log.error("Unknown type: {}. Use: handlers", type);
                yield 1;
            }
        };
    }

    private int listHandlers() {
        System.out.println("Available Handlers:");
        System.out.println();

        List<DescriptorHandler> handlers = PackageScanner.discoverHandlers();
        for (DescriptorHandler handler : handlers) {
            System.out.printf("  • %s (ID: %s)%n", handler.getDisplayName(), handler.getId());
            System.out.printf("    Patterns: %s%n", new TreeSet<>(handler.getFilePatterns()));
            System.out.println();
        }

        if (handlers.isEmpty()) {
            System.out.println("  No handlers found.");
        }
        return 0;
    }
}
