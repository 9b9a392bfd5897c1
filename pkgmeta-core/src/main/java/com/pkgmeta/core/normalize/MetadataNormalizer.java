package com.pkgmeta.core.normalize;

import com.pkgmeta.core.metadata.AttributeResolver;
import com.pkgmeta.core.metadata.MetadataSource;
import com.pkgmeta.core.model.PackageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Assembles the descriptor-independent part of a {@link PackageRecord}.
 *
 * <p>Handlers call {@link #normalize(String, MetadataSource, Path)} for name,
 * version, description, license, keywords, parties and URLs, add their own
 * dependencies and recovered version, then finish with
 * {@link #withRegistryUrls(PackageRecord.Builder)} so registry URLs see the
 * final name and version.
 */
public final class MetadataNormalizer {

    private static final Logger log = LoggerFactory.getLogger(MetadataNormalizer.class);

    static final String LEGACY_DESCRIPTION_FILE = "DESCRIPTION.rst";

    private MetadataNormalizer() {
        // Utility class
    }

    /**
     * Builds the common fields of a record.
     *
     * @param datasourceId descriptor format identifier
     * @param source metadata source
     * @param location descriptor file, used to find a legacy description; may be null
     * @return builder with common fields set
     */
    public static PackageRecord.Builder normalize(String datasourceId, MetadataSource source, Path location) {
        ClassifiedUrls urls = UrlClassifier.classify(source);
        return PackageRecord.builder(datasourceId)
            .name(AttributeResolver.getString(source, "Name"))
            .version(AttributeResolver.getString(source, "Version"))
            .description(description(source, location))
            .declaredLicense(ClassifierSplitter.declaredLicense(source))
            .keywords(TextNormalizer.extractKeywords(source))
            .parties(PartyExtractor.extract(source))
            .homepageUrl(urls.homepageUrl())
            .vcsUrl(urls.vcsUrl())
            .bugTrackingUrl(urls.bugTrackingUrl())
            .codeViewUrl(urls.codeViewUrl())
            .extraUrls(urls.extraUrls());
    }

    /**
     * Sets the registry URLs computed from the builder's name and version.
     *
     * @param builder record builder
     * @return the same builder
     */
    public static PackageRecord.Builder withRegistryUrls(PackageRecord.Builder builder) {
        PypiUrls registry = PypiUrls.of(builder.name(), builder.version());
        return builder
            .repositoryHomepageUrl(registry.repositoryHomepageUrl())
            .repositoryDownloadUrl(registry.repositoryDownloadUrl())
            .apiDataUrl(registry.apiDataUrl());
    }

    /**
     * Resolves the description of a source.
     *
     * <p>The body is the payload when there is one, else the {@code Description}
     * field, else a legacy {@code DESCRIPTION.rst} next to the descriptor. The
     * cleaned body is combined with the {@code Summary} field.
     *
     * @param source metadata source
     * @param location descriptor file, may be null
     * @return description or null
     */
    public static String description(MetadataSource source, Path location) {
        String body = source.payload().map(TextNormalizer::blankToNull).orElse(null);
        if (body == null) {
            body = AttributeResolver.getString(source, "Description");
        }
        if (body == null && location != null) {
            body = legacyDescription(location.toAbsolutePath().getParent());
        }
        String summary = AttributeResolver.getString(source, "Summary");
        return TextNormalizer.buildDescription(summary, TextNormalizer.cleanDescription(body));
    }

    private static String legacyDescription(Path directory) {
        if (directory == null) {
            return null;
        }
        Path legacy = directory.resolve(LEGACY_DESCRIPTION_FILE);
        if (!Files.isRegularFile(legacy)) {
            return null;
        }
        try {
            return Files.readString(legacy);
        } catch (IOException e) {
            log.warn("Failed to read legacy description: {} - {}", legacy, e.getMessage());
            return null;
        }
    }
}
