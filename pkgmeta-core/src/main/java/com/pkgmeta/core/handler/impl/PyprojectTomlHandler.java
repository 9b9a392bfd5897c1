package com.pkgmeta.core.handler.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pkgmeta.core.handler.ExtractionContext;
import com.pkgmeta.core.handler.base.AbstractJacksonHandler;
import com.pkgmeta.core.metadata.BeanMetadata;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import com.pkgmeta.core.normalize.MetadataNormalizer;
import com.pkgmeta.core.requirement.ResolutionOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handler for PEP 621 {@code pyproject.toml} files.
 *
 * <p>Reads the {@code [project]} table, PEP 735 {@code [dependency-groups]}
 * and a dynamic version declared through
 * {@code [tool.setuptools.dynamic] version = {attr = "..."}} or
 * {@code {file = "..."}}. Files without a {@code [project]} table (pure tool
 * configuration) produce no record.
 */
public class PyprojectTomlHandler extends AbstractJacksonHandler {

    private static final String HANDLER_ID = "pypi_pyproject_toml";
    private static final String HANDLER_DISPLAY_NAME = "Python pyproject.toml";

    private static final String PATTERN_PYPROJECT = "{**/,}pyproject.toml";

    private static final String CONFIG_KEY_PROJECT = "project";
    private static final String CONFIG_KEY_DEPENDENCY_GROUPS = "dependency-groups";
    private static final String PARTY_SEPARATOR = ", ";

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
        return Set.of(PATTERN_PYPROJECT);
    }

    @Override
    public List<PackageRecord> parse(Path file, ExtractionContext context) throws IOException {
        JsonNode root = parseToml(file);
        JsonNode project = root.get(CONFIG_KEY_PROJECT);
        if (project == null || !project.isObject()) {
            log.debug("No [project] table in {}", file);
            return List.of();
        }
        Path directory = file.toAbsolutePath().getParent();
        List<String> warnings = new ArrayList<>();

        JsonNode dynamicVersion = path(root, "tool", "setuptools", "dynamic", "version");
        String version = extractText(project, "version");
        if (version == null) {
            String versionFile = extractText(dynamicVersion, "file");
            if (versionFile != null) {
                version = readRelative(directory, versionFile, warnings);
            }
        }

        PyprojectMetadata metadata = new PyprojectMetadata(
            extractText(project, "name"),
            version != null ? version.strip() : null,
            extractText(project, "description"),
            readme(project.get("readme"), directory, warnings),
            license(project.get("license"), directory, warnings),
            join(people(project.get("authors"), "name")),
            join(people(project.get("authors"), "email")),
            join(people(project.get("maintainers"), "name")),
            join(people(project.get("maintainers"), "email")),
            textList(project.get("keywords")),
            textList(project.get("classifiers")),
            urls(project.get("urls"))
        );

        PackageRecord.Builder builder = MetadataNormalizer.normalize(getId(), new BeanMetadata(metadata), file);
        builder.dependencies(dependencies(file, project, root.get(CONFIG_KEY_DEPENDENCY_GROUPS)));

        String versionReference = extractText(dynamicVersion, "attr");
        recoverVersion(builder, file, versionReference, context);
        if (versionReference != null && builder.version() == null) {
            warnings.add("version attr: " + versionReference + " could not be resolved");
        }
        builder.warnings(warnings);
        return List.of(MetadataNormalizer.withRegistryUrls(builder).build());
    }

    // ==================== Dependencies ====================

    private List<DependentPackage> dependencies(Path file, JsonNode project, JsonNode groups) {
        List<DependentPackage> dependencies = new ArrayList<>(
            resolveRequirements(file, textList(project.get("dependencies")), ResolutionOptions.install()));

        JsonNode optional = project.get("optional-dependencies");
        if (optional != null && optional.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> extras = optional.fields();
            while (extras.hasNext()) {
                Map.Entry<String, JsonNode> extra = extras.next();
                dependencies.addAll(resolveRequirements(file, textList(extra.getValue()),
                    ResolutionOptions.install().withScope(extra.getKey())));
            }
        }

        if (groups != null && groups.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = groups.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> group = entries.next();
                // include-group tables are not strings and are skipped by textList
                dependencies.addAll(resolveRequirements(file, textList(group.getValue()),
                    ResolutionOptions.development().withScope(group.getKey())));
            }
        }
        return dependencies;
    }

    // ==================== Project Table Values ====================

    private String readme(JsonNode readme, Path directory, List<String> warnings) {
        if (readme == null) {
            return null;
        }
        if (readme.isTextual()) {
            return readRelative(directory, readme.asText(), warnings);
        }
        String text = extractText(readme, "text");
        if (text != null) {
            return text;
        }
        String file = extractText(readme, "file");
        return file != null ? readRelative(directory, file, warnings) : null;
    }

    private String license(JsonNode license, Path directory, List<String> warnings) {
        if (license == null) {
            return null;
        }
        if (license.isTextual()) {
            return license.asText();
        }
        String text = extractText(license, "text");
        if (text != null) {
            return text;
        }
        String file = extractText(license, "file");
        return file != null ? readRelative(directory, file, warnings) : null;
    }

    private List<String> people(JsonNode people, String key) {
        List<String> values = new ArrayList<>();
        if (people == null || !people.isArray()) {
            return values;
        }
        for (JsonNode person : people) {
            String value = extractText(person, key);
            if (value != null && !value.isBlank()) {
                values.add(value.strip());
            }
        }
        return values;
    }

    private Map<String, String> urls(JsonNode urls) {
        if (urls == null || !urls.isObject()) {
            return Map.of();
        }
        Map<String, String> labeled = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = urls.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual()) {
                labeled.put(field.getKey(), field.getValue().asText());
            }
        }
        return Collections.unmodifiableMap(labeled);
    }

    private String readRelative(Path directory, String name, List<String> warnings) {
        Path referenced = directory.resolve(name).normalize();
        if (!referenced.startsWith(directory) || !Files.isRegularFile(referenced)) {
            warnings.add("file " + name + " not found");
            return null;
        }
        try {
            return readFileContent(referenced);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", referenced, e.getMessage());
            warnings.add("file " + name + " could not be read");
            return null;
        }
    }

    private static String join(List<String> values) {
        return values.isEmpty() ? null : String.join(PARTY_SEPARATOR, values);
    }
}
