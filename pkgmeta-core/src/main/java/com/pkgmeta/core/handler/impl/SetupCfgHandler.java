package com.pkgmeta.core.handler.impl;

import com.pkgmeta.core.handler.ExtractionContext;
import com.pkgmeta.core.handler.base.AbstractDescriptorHandler;
import com.pkgmeta.core.handler.impl.util.SetupCfgReader;
import com.pkgmeta.core.metadata.MappingMetadata;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import com.pkgmeta.core.normalize.MetadataNormalizer;
import com.pkgmeta.core.requirement.ResolutionOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handler for declarative {@code setup.cfg} files.
 *
 * <p>Reads {@code [metadata]}, the requirement lists of {@code [options]} and
 * {@code [options.extras_require]}. The setuptools directives
 * {@code attr:} (version only) and {@code file:} are honoured;
 * {@code attr:} is resolved by searching neighbouring modules, never by import.
 */
public class SetupCfgHandler extends AbstractDescriptorHandler {

    private static final String HANDLER_ID = "pypi_setup_cfg";
    private static final String HANDLER_DISPLAY_NAME = "Python setup.cfg";

    private static final String PATTERN_SETUP_CFG = "{**/,}setup.cfg";

    private static final String SECTION_METADATA = "metadata";
    private static final String SECTION_OPTIONS = "options";
    private static final String SECTION_EXTRAS = "options.extras_require";

    private static final String ATTR_DIRECTIVE = "attr:";
    private static final String FILE_DIRECTIVE = "file:";

    private static final Set<String> SCALAR_KEYS = Set.of(
        "name", "license", "author", "author_email", "maintainer", "maintainer_email", "url", "download_url");

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
        return Set.of(PATTERN_SETUP_CFG);
    }

    @Override
    public List<PackageRecord> parse(Path file, ExtractionContext context) throws IOException {
        Map<String, Map<String, String>> sections = SetupCfgReader.read(file, readFileContent(file));
        Map<String, String> metadata = sections.getOrDefault(SECTION_METADATA, Map.of());
        Map<String, String> options = sections.getOrDefault(SECTION_OPTIONS, Map.of());
        Path directory = file.toAbsolutePath().getParent();
        List<String> warnings = new ArrayList<>();

        Map<String, Object> fields = new LinkedHashMap<>();
        for (String key : SCALAR_KEYS) {
            putIfPresent(fields, key, scalar(metadata, key));
        }
        String version = scalar(metadata, "version");
        String versionReference = null;
        if (version != null && version.startsWith(ATTR_DIRECTIVE)) {
            versionReference = version.substring(ATTR_DIRECTIVE.length()).strip();
        } else if (version != null) {
            fields.put("version", directiveValue(directory, version, warnings));
        }
        putIfPresent(fields, "summary", directiveValue(directory, scalar(metadata, "description"), warnings));
        putIfPresent(fields, "description", directiveValue(directory, scalar(metadata, "long_description"), warnings));
        fields.put("keywords", SetupCfgReader.listValue(metadata.get("keywords"), ","));
        fields.put("classifiers", SetupCfgReader.listValue(
            directiveValue(directory, scalar(metadata, "classifiers"), warnings), null));
        fields.put("project_urls", SetupCfgReader.dictValue(metadata.get("project_urls")));

        PackageRecord.Builder builder = MetadataNormalizer.normalize(getId(), new MappingMetadata(fields), file);
        builder.dependencies(dependencies(file, options, sections.getOrDefault(SECTION_EXTRAS, Map.of())));
        recoverVersion(builder, file, versionReference, context);
        if (versionReference != null && builder.version() == null) {
            warnings.add("version attr: " + versionReference + " could not be resolved");
        }
        builder.warnings(warnings);
        return List.of(MetadataNormalizer.withRegistryUrls(builder).build());
    }

    private List<DependentPackage> dependencies(Path file, Map<String, String> options, Map<String, String> extras) {
        List<DependentPackage> dependencies = new ArrayList<>();
        dependencies.addAll(resolveRequirements(file,
            SetupCfgReader.listValue(options.get("install_requires"), ";"), ResolutionOptions.install()));
        dependencies.addAll(resolveRequirements(file,
            SetupCfgReader.listValue(options.get("tests_require"), ";"),
            ResolutionOptions.install().withScope("tests")));
        dependencies.addAll(resolveRequirements(file,
            SetupCfgReader.listValue(options.get("setup_requires"), ";"),
            ResolutionOptions.install().withScope("setup")));
        extras.forEach((extra, requires) -> dependencies.addAll(resolveRequirements(file,
            SetupCfgReader.listValue(requires, ";"), ResolutionOptions.install().withScope(extra))));
        return dependencies;
    }

    /**
     * Expands a {@code file:} directive into the concatenated file contents;
     * other values are returned unchanged.
     */
    private String directiveValue(Path directory, String value, List<String> warnings) {
        if (value == null || !value.startsWith(FILE_DIRECTIVE)) {
            return value;
        }
        List<String> contents = new ArrayList<>();
        for (String name : SetupCfgReader.listValue(value.substring(FILE_DIRECTIVE.length()), ",")) {
            Path referenced = directory.resolve(name).normalize();
            if (!referenced.startsWith(directory) || !Files.isRegularFile(referenced)) {
                warnings.add("file: " + name + " not found");
                continue;
            }
            try {
                contents.add(readFileContent(referenced).strip());
            } catch (IOException e) {
                log.warn("Failed to read {} referenced by {}: {}", referenced, FILE_DIRECTIVE, e.getMessage());
                warnings.add("file: " + name + " could not be read");
            }
        }
        return contents.isEmpty() ? null : String.join("\n", contents);
    }

    private static String scalar(Map<String, String> section, String key) {
        String value = section.get(key);
        return value != null ? value.strip() : null;
    }

    private static void putIfPresent(Map<String, Object> fields, String key, String value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
