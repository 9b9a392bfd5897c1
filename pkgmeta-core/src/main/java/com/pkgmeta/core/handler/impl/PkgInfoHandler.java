package com.pkgmeta.core.handler.impl;

import com.pkgmeta.core.handler.impl.util.RequirementsFileParser;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.requirement.ResolutionOptions;
import com.pkgmeta.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Handler for {@code PKG-INFO} files of source distributions and egg-info directories.
 *
 * <p>Older setuptools releases do not write {@code Requires-Dist} headers; the
 * dependencies of an {@code .egg-info} directory are then read from its
 * {@code requires.txt}, whose {@code [extra]} sections become scopes.
 */
public class PkgInfoHandler extends AbstractCoreMetadataHandler {

    private static final String HANDLER_ID = "pypi_sdist_pkginfo";
    private static final String HANDLER_DISPLAY_NAME = "PyPI sdist PKG-INFO";

    // Note: Using {**/,} prefix to match both root-level and nested files
    private static final String PATTERN_PKG_INFO = "{**/,}PKG-INFO";

    private static final String REQUIRES_TXT = "requires.txt";
    private static final Set<String> EGG_INFO_SUFFIXES = Set.of(".egg-info", "EGG-INFO");

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
        return Set.of(PATTERN_PKG_INFO);
    }

    @Override
    protected List<DependentPackage> fallbackDependencies(Path file) throws IOException {
        Path directory = file.toAbsolutePath().getParent();
        if (directory == null || EGG_INFO_SUFFIXES.stream().noneMatch(FileUtils.fileName(directory)::endsWith)) {
            return List.of();
        }
        Path requires = directory.resolve(REQUIRES_TXT);
        if (!Files.isRegularFile(requires)) {
            return List.of();
        }
        log.debug("Reading egg-info dependencies from {}", requires);
        return RequirementsFileParser.toDependencies(
            RequirementsFileParser.parse(readFileLines(requires)), ResolutionOptions.install());
    }
}
