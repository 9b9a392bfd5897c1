package com.pkgmeta.core.handler.impl;

import com.pkgmeta.core.handler.ExtractionContext;
import com.pkgmeta.core.handler.base.AbstractDescriptorHandler;
import com.pkgmeta.core.handler.impl.util.SetupPyAstParser;
import com.pkgmeta.core.metadata.MappingMetadata;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import com.pkgmeta.core.normalize.MetadataNormalizer;
import com.pkgmeta.core.requirement.ResolutionOptions;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handler for {@code setup.py} scripts.
 *
 * <p>The script is never executed: only literal keyword arguments of the
 * top-level setup call are read. When {@code version} is not a literal, the
 * version is recovered from neighbouring modules.
 *
 * <p>Dependency scopes: {@code install_requires} is {@code install},
 * {@code tests_require} (and the misspelt {@code tests_requires}) is
 * {@code tests}, {@code setup_requires} is {@code setup}, and each
 * {@code extras_require} key is its own scope.
 */
public class SetupPyHandler extends AbstractDescriptorHandler {

    private static final String HANDLER_ID = "pypi_setup_py";
    private static final String HANDLER_DISPLAY_NAME = "Python setup.py";

    private static final String PATTERN_SETUP_PY = "{**/,}setup.py";

    private static final String SCOPE_TESTS = "tests";
    private static final String SCOPE_SETUP = "setup";

    private static final String KEY_VERSION = "version";
    private static final String KEY_DESCRIPTION = "description";
    private static final String KEY_LONG_DESCRIPTION = "long_description";
    private static final String KEY_SUMMARY = "summary";
    private static final String KEY_INSTALL_REQUIRES = "install_requires";
    private static final String KEY_TESTS_REQUIRE = "tests_require";
    private static final String KEY_TESTS_REQUIRES = "tests_requires";
    private static final String KEY_SETUP_REQUIRES = "setup_requires";
    private static final String KEY_EXTRAS_REQUIRE = "extras_require";
    private static final String KEY_KWARGS = "**";

    /** Keywords whose values end up in the record; other non-literal keywords are not reported. */
    private static final Set<String> CONSUMED_KEYS = Set.of(
        "name", KEY_VERSION, KEY_DESCRIPTION, KEY_LONG_DESCRIPTION, "license", "author", "author_email",
        "maintainer", "maintainer_email", "keywords", "classifiers", "url", "download_url", "project_urls",
        KEY_INSTALL_REQUIRES, KEY_TESTS_REQUIRE, KEY_TESTS_REQUIRES, KEY_SETUP_REQUIRES, KEY_EXTRAS_REQUIRE
    );

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
        return Set.of(PATTERN_SETUP_PY);
    }

    @Override
    public List<PackageRecord> parse(Path file, ExtractionContext context) throws IOException {
        SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(file, readFileContent(file));
        Map<String, Object> values = arguments.values();
        log.debug("Read {} literal setup() arguments from {}", values.size(), file);

        PackageRecord.Builder builder = MetadataNormalizer.normalize(getId(), new MappingMetadata(fields(values)), file);
        builder.dependencies(dependencies(file, values));
        recoverVersion(builder, file, context);

        builder.warnings(arguments.warnings());
        for (String key : arguments.nonLiteralKeys()) {
            if (KEY_KWARGS.equals(key)) {
                builder.warning("setup(**...) keyword expansion was not evaluated");
            } else if (CONSUMED_KEYS.contains(key) && !(KEY_VERSION.equals(key) && builder.version() != null)) {
                builder.warning("setup(" + key + "=...) is not a literal and was skipped");
            }
        }
        return List.of(MetadataNormalizer.withRegistryUrls(builder).build());
    }

    /**
     * Maps setup() keywords onto metadata field names: {@code description} is
     * the one-line summary and {@code long_description} the body.
     */
    private static Map<String, Object> fields(Map<String, Object> values) {
        Map<String, Object> fields = new LinkedHashMap<>(values);
        fields.remove(KEY_DESCRIPTION);
        fields.remove(KEY_LONG_DESCRIPTION);
        if (values.get(KEY_DESCRIPTION) != null) {
            fields.put(KEY_SUMMARY, values.get(KEY_DESCRIPTION));
        }
        if (values.get(KEY_LONG_DESCRIPTION) != null) {
            fields.put(KEY_DESCRIPTION, values.get(KEY_LONG_DESCRIPTION));
        }
        return fields;
    }

    private List<DependentPackage> dependencies(Path file, Map<String, Object> values) {
        List<DependentPackage> dependencies = new ArrayList<>();
        dependencies.addAll(resolveRequirements(file, requirements(values.get(KEY_INSTALL_REQUIRES)),
            ResolutionOptions.install()));
        ResolutionOptions tests = ResolutionOptions.install().withScope(SCOPE_TESTS);
        dependencies.addAll(resolveRequirements(file, requirements(values.get(KEY_TESTS_REQUIRE)), tests));
        dependencies.addAll(resolveRequirements(file, requirements(values.get(KEY_TESTS_REQUIRES)), tests));
        dependencies.addAll(resolveRequirements(file, requirements(values.get(KEY_SETUP_REQUIRES)),
            ResolutionOptions.install().withScope(SCOPE_SETUP)));

        if (values.get(KEY_EXTRAS_REQUIRE) instanceof Map<?, ?> extras) {
            extras.forEach((extra, requires) -> dependencies.addAll(resolveRequirements(
                file, requirements(requires), ResolutionOptions.install().withScope(extra.toString()))));
        }
        return dependencies;
    }

    /**
     * Accepts a list of requirement strings or one string with one requirement per line.
     */
    private static List<String> requirements(Object value) {
        List<String> requirements = new ArrayList<>();
        if (value instanceof String text) {
            text.lines().map(String::strip).filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .forEach(requirements::add);
        } else if (value instanceof List<?> list) {
            list.forEach(item -> requirements.add(item.toString()));
        }
        return requirements;
    }
}
