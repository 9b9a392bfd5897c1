package com.pkgmeta.core.handler.impl;

import com.pkgmeta.core.handler.ExtractionContext;
import com.pkgmeta.core.handler.base.AbstractDescriptorHandler;
import com.pkgmeta.core.handler.impl.util.HeaderParser;
import com.pkgmeta.core.metadata.AttributeResolver;
import com.pkgmeta.core.metadata.HeaderMetadata;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import com.pkgmeta.core.normalize.MetadataNormalizer;
import com.pkgmeta.core.requirement.ResolutionOptions;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Shared parsing for core metadata files ({@code PKG-INFO}, {@code METADATA}).
 *
 * <p>Dependencies come from the {@code Requires-Dist} headers; subclasses may
 * supply another source when there are none.
 */
public abstract class AbstractCoreMetadataHandler extends AbstractDescriptorHandler {

    static final String REQUIRES_DIST = "Requires-Dist";

    @Override
    public List<PackageRecord> parse(Path file, ExtractionContext context) throws IOException {
        HeaderMetadata metadata = HeaderParser.parse(file, readFileContent(file));
        log.debug("Parsed {} headers from {}", metadata.headerCount(), file);

        PackageRecord.Builder builder = MetadataNormalizer.normalize(getId(), metadata, file);

        List<String> requires = AttributeResolver.getAttributes(metadata, REQUIRES_DIST).stream()
            .filter(Objects::nonNull)
            .map(Object::toString)
            .toList();
        List<DependentPackage> dependencies = requires.isEmpty()
            ? fallbackDependencies(file)
            : resolveRequirements(file, requires, ResolutionOptions.install());
        builder.dependencies(dependencies);

        return List.of(MetadataNormalizer.withRegistryUrls(builder).build());
    }

    /**
     * Returns dependencies declared outside the metadata file.
     *
     * @param file metadata file
     * @return dependencies, empty by default
     * @throws IOException if a neighbouring file cannot be read
     */
    protected List<DependentPackage> fallbackDependencies(Path file) throws IOException {
        return List.of();
    }
}
