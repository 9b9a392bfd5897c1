package com.pkgmeta.core.handler.impl;

import com.pkgmeta.core.handler.ExtractionContext;
import com.pkgmeta.core.handler.base.AbstractDescriptorHandler;
import com.pkgmeta.core.handler.impl.util.RequirementsFileParser;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import com.pkgmeta.core.requirement.ResolutionOptions;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Handler for pip requirements files.
 *
 * <p>Files whose path ends with {@code dev.txt}, {@code test.txt} or
 * {@code tests.txt} are development manifests: their dependencies get scope
 * {@code development} and are neither runtime nor mandatory.
 */
public class RequirementsFileHandler extends AbstractDescriptorHandler {

    private static final String HANDLER_ID = "pip_requirements";
    private static final String HANDLER_DISPLAY_NAME = "pip requirements file";

    private static final Set<String> FILE_PATTERNS = Set.of(
        "{**/,}*requirement*.txt",
        "{**/,}*requirement*.pip",
        "{**/,}*requirement*.in",
        "{**/,}*requires.txt",
        "{**/,}*requirements/*.txt",
        "{**/,}*requirements/*.pip",
        "{**/,}*requirements/*.in",
        "{**/,}*reqs.txt"
    );

    private static final List<String> DEVELOPMENT_SUFFIXES = List.of("dev.txt", "test.txt", "tests.txt");

    @Override
    public String getId() {
        return HANDLER_ID;
    }

    @Override
    public String getDisplayName() {
        return HANDLER_DISPLAY_NAME;
    }

    @Override
    public Set<String> getFilePatterns() {
        return FILE_PATTERNS;
    }

    @Override
    public List<PackageRecord> parse(Path file, ExtractionContext context) throws IOException {
        ResolutionOptions options = optionsFor(file);
        List<RequirementsFileParser.Entry> entries = RequirementsFileParser.parse(readFileLines(file));
        List<DependentPackage> dependencies = RequirementsFileParser.toDependencies(entries, options);
        log.debug("Found {} requirements in {} (scope {})", dependencies.size(), file, options.defaultScope());

        return List.of(PackageRecord.builder(getId()).dependencies(dependencies).build());
    }

    /**
     * Picks the scope convention for a requirements file from its path.
     *
     * @param file requirements file
     * @return development options for dev/test manifests, install options otherwise
     */
    static ResolutionOptions optionsFor(Path file) {
        String path = file.toString();
        for (String suffix : DEVELOPMENT_SUFFIXES) {
            if (path.endsWith(suffix)) {
                return ResolutionOptions.development();
            }
        }
        return ResolutionOptions.install();
    }
}
