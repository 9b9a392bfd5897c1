package com.pkgmeta.core.requirement;

import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageUrl;
import com.pkgmeta.core.util.PackageTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns requirement expressions into {@link DependentPackage} records.
 *
 * <p>A dependency is resolved when its specifier set holds exactly one
 * equality specifier; the pinned version is then attached to the package URL.
 * The scope is the value the marker binds to {@code extra}, falling back to
 * the default scope of the supplied {@link ResolutionOptions}.
 */
public final class RequirementResolver {

    private static final Logger log = LoggerFactory.getLogger(RequirementResolver.class);

    private static final Pattern NAME_SEPARATORS = Pattern.compile("[-_.]+");

    private RequirementResolver() {
        // Utility class
    }

    /**
     * Normalizes a project name: runs of {@code -}, {@code _} and {@code .}
     * collapse to one dash and the result is lower-cased.
     *
     * @param name project name
     * @return canonical name
     */
    public static String canonicalizeName(String name) {
        return NAME_SEPARATORS.matcher(name.trim()).replaceAll("-").toLowerCase(Locale.ROOT);
    }

    /**
     * Parses and resolves one requirement string.
     *
     * @param requirement requirement text
     * @param options scope and flag defaults
     * @return dependency record
     * @throws RequirementSyntaxException if the requirement is malformed
     */
    public static DependentPackage resolve(String requirement, ResolutionOptions options) {
        return resolve(RequirementParser.parse(requirement), options);
    }

    /**
     * Resolves a parsed requirement.
     *
     * @param requirement parsed requirement
     * @param options scope and flag defaults
     * @return dependency record
     * @throws RequirementSyntaxException if the requirement names no package
     */
    public static DependentPackage resolve(RequirementExpression requirement, ResolutionOptions options) {
        if (requirement.name().isBlank()) {
            throw new RequirementSyntaxException("Requirement names no package", requirement.text(), 0);
        }
        PackageUrl purl = PackageUrl.of(PackageTypes.PYPI, canonicalizeName(requirement.name()));
        SpecifierSet specifiers = requirement.specifiers();

        Optional<String> pinned = specifiers.pinnedVersion();
        if (pinned.isPresent()) {
            purl = purl.withVersion(pinned.get());
        }

        String extracted = specifiers.isEmpty() ? requirement.text() : specifiers.toString();
        String scope = requirement.hasMarker()
            ? requirement.marker().extra().orElse(options.defaultScope())
            : options.defaultScope();

        return new DependentPackage(purl, scope, options.runtime(), options.optional(), pinned.isPresent(), extracted);
    }

    /**
     * Builds a record for a requirement that names no package, such as a local
     * path or a URL without an {@code #egg=} fragment.
     *
     * @param text requirement text as it should be reported
     * @param options scope and flag defaults
     * @return dependency record without a package URL
     */
    public static DependentPackage unnamed(String text, ResolutionOptions options) {
        return new DependentPackage(null, options.defaultScope(), options.runtime(), options.optional(), false, text);
    }

    /**
     * Resolves every requirement, skipping malformed entries.
     *
     * @param requirements requirement strings
     * @param options scope and flag defaults
     * @return dependency records in input order
     */
    public static List<DependentPackage> resolveAll(List<String> requirements, ResolutionOptions options) {
        List<DependentPackage> dependencies = new ArrayList<>();
        for (String requirement : requirements) {
            if (requirement == null || requirement.isBlank()) {
                continue;
            }
            try {
                dependencies.add(resolve(requirement, options));
            } catch (RequirementSyntaxException e) {
                log.warn("Skipping malformed requirement '{}': {}", requirement, e.getMessage());
            }
        }
        return dependencies;
    }
}
