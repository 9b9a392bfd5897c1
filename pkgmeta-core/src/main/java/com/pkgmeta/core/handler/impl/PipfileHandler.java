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
 * Handler for Pipenv {@code Pipfile} manifests (TOML).
 *
 * <p>{@code [packages]} are install dependencies, {@code [dev-packages]}
 * development dependencies. An entry is either a version string
 * ({@code "*"} meaning any version) or a table with {@code version},
 * {@code extras}, {@code markers}, or a VCS/path source.
 */
public class PipfileHandler extends AbstractJacksonHandler {

    private static final String HANDLER_ID = "pipfile";
    private static final String HANDLER_DISPLAY_NAME = "Pipfile";

    private static final String PATTERN_PIPFILE = "{**/,}Pipfile";

    private static final String CONFIG_KEY_PACKAGES = "packages";
    private static final String CONFIG_KEY_DEV_PACKAGES = "dev-packages";
    private static final String ANY_VERSION = "*";
    private static final List<String> VCS_KEYS = List.of("git", "hg", "svn", "bzr");
    private static final List<String> LOCATION_KEYS = List.of("path", "file");

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
        return Set.of(PATTERN_PIPFILE);
    }

    @Override
    public List<PackageRecord> parse(Path file, ExtractionContext context) throws IOException {
        JsonNode root = parseToml(file);
        List<DependentPackage> dependencies = new ArrayList<>();
        dependencies.addAll(section(root.get(CONFIG_KEY_PACKAGES), ResolutionOptions.install()));
        dependencies.addAll(section(root.get(CONFIG_KEY_DEV_PACKAGES), ResolutionOptions.development()));
        log.debug("Found {} Pipfile dependencies in {}", dependencies.size(), file);

        return List.of(PackageRecord.builder(getId()).dependencies(dependencies).build());
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
                log.warn("Skipping malformed Pipfile entry '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        return dependencies;
    }

    private DependentPackage dependency(String name, JsonNode spec, ResolutionOptions options) {
        if (spec.isObject()) {
            String location = location(spec);
            if (location != null) {
                RequirementExpression direct = new RequirementExpression(
                    name, textList(spec.get("extras")), SpecifierSet.empty(), location, null, location);
                return RequirementResolver.resolve(direct, options);
            }
        }
        return RequirementResolver.resolve(requirement(name, spec), options);
    }

    /**
     * Renders an entry as a requirement string, e.g. {@code requests[socks]>=2.0; os_name == "nt"}.
     */
    private String requirement(String name, JsonNode spec) {
        StringBuilder requirement = new StringBuilder(name);
        String version = spec.isTextual() ? spec.asText() : extractText(spec, "version");
        if (spec.isObject()) {
            List<String> extras = textList(spec.get("extras"));
            if (!extras.isEmpty()) {
                requirement.append('[').append(String.join(",", extras)).append(']');
            }
        }
        if (version != null && !version.isBlank() && !ANY_VERSION.equals(version.strip())) {
            requirement.append(version.strip());
        }
        String markers = spec.isObject() ? extractText(spec, "markers") : null;
        if (markers != null && !markers.isBlank()) {
            requirement.append("; ").append(markers.strip());
        }
        return requirement.toString();
    }

    private String location(JsonNode spec) {
        for (String vcs : VCS_KEYS) {
            String url = extractText(spec, vcs);
            if (url != null) {
                String ref = extractText(spec, "ref");
                return vcs + "+" + url + (ref != null ? "@" + ref : "");
            }
        }
        for (String key : LOCATION_KEYS) {
            String location = extractText(spec, key);
            if (location != null) {
                return location;
            }
        }
        return null;
    }
}
