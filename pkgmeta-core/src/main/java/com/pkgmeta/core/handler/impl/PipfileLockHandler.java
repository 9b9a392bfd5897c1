package com.pkgmeta.core.handler.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pkgmeta.core.handler.ExtractionContext;
import com.pkgmeta.core.handler.base.AbstractJacksonHandler;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import com.pkgmeta.core.requirement.RequirementExpression;
import com.pkgmeta.core.requirement.RequirementResolver;
import com.pkgmeta.core.requirement.RequirementSyntaxException;
import com.pkgmeta.core.requirement.ResolutionOptions;
import com.pkgmeta.core.requirement.SpecifierSet;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handler for Pipenv {@code Pipfile.lock} files (JSON).
 *
 * <p>{@code default} entries are install dependencies, {@code develop}
 * entries development dependencies. The lock hash
 * ({@code _meta.hash.sha256}) is stored on the record.
 */
public class PipfileLockHandler extends AbstractJacksonHandler {

    private static final String HANDLER_ID = "pipfile_lock";
    private static final String HANDLER_DISPLAY_NAME = "Pipfile.lock";

    private static final String PATTERN_PIPFILE_LOCK = "{**/,}Pipfile.lock";

    private static final String CONFIG_KEY_DEFAULT = "default";
    private static final String CONFIG_KEY_DEVELOP = "develop";

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
        return Set.of(PATTERN_PIPFILE_LOCK);
    }

    @Override
    public List<PackageRecord> parse(Path file, ExtractionContext context) throws IOException {
        JsonNode root = parseJson(file);
        List<DependentPackage> dependencies = new ArrayList<>();
        dependencies.addAll(section(root.get(CONFIG_KEY_DEFAULT), ResolutionOptions.install()));
        dependencies.addAll(section(root.get(CONFIG_KEY_DEVELOP), ResolutionOptions.development()));

        String sha256 = extractText(path(root, "_meta", "hash"), "sha256");
        log.debug("Found {} locked dependencies in {}", dependencies.size(), file);

        return List.of(PackageRecord.builder(getId())
            .dependencies(dependencies)
            .sha256(sha256)
            .build());
    }

    private List<DependentPackage> section(JsonNode packages, ResolutionOptions options) {
        List<DependentPackage> dependencies = new ArrayList<>();
        if (packages == null || !packages.isObject()) {
            return dependencies;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = packages.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            try {
                dependencies.add(dependency(entry.getKey(), entry.getValue(), options));
            } catch (RequirementSyntaxException e) {
                log.warn("Skipping malformed Pipfile.lock entry '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        return dependencies;
    }

    private DependentPackage dependency(String name, JsonNode spec, ResolutionOptions options) {
        String version = extractText(spec, "version");
        String git = extractText(spec, "git");
        if (version == null && git != null) {
            String ref = extractText(spec, "ref");
            String location = "git+" + git + (ref != null ? "@" + ref : "");
            return RequirementResolver.resolve(new RequirementExpression(
                name, List.of(), SpecifierSet.empty(), location, null, location), options);
        }
        StringBuilder requirement = new StringBuilder(name);
        List<String> extras = textList(spec.get("extras"));
        if (!extras.isEmpty()) {
            requirement.append('[').append(String.join(",", extras)).append(']');
        }
        if (version != null && !version.isBlank()) {
            requirement.append(version.strip());
        }
        String markers = extractText(spec, "markers");
        if (markers != null && !markers.isBlank()) {
            requirement.append("; ").append(markers.strip());
        }
        return RequirementResolver.resolve(requirement.toString(), options);
    }
}
