package com.pkgmeta.core.model;

import com.pkgmeta.core.util.PackageTypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical package metadata extracted from a single descriptor.
 *
 * <p>Every canonical URL field was filled from exactly one source URL; labels
 * that map to no canonical role are kept in {@code extraUrls}. Records are
 * immutable; use {@link #builder(String)} to assemble one.
 *
 * @param datasourceId identifier of the descriptor format that produced this record
 * @param type package type (always "pypi" for this ecosystem)
 * @param primaryLanguage primary language of the package
 * @param name package name
 * @param version package version
 * @param description cleaned summary and long description
 * @param declaredLicense declared license text and license classifiers
 * @param keywords de-duplicated keywords, in insertion order
 * @param parties authors and maintainers
 * @param dependencies declared dependencies
 * @param homepageUrl homepage URL
 * @param vcsUrl version control URL
 * @param bugTrackingUrl issue tracker URL
 * @param codeViewUrl source browser URL
 * @param repositoryHomepageUrl package registry page
 * @param repositoryDownloadUrl package registry source download
 * @param apiDataUrl package registry JSON API URL
 * @param extraUrls URLs whose label maps to no canonical role, keyed by label
 * @param sha256 content hash declared by lock files
 * @param warnings notes about data dropped during best-effort parsing
 */
public record PackageRecord(
    String datasourceId,
    String type,
    String primaryLanguage,
    String name,
    String version,
    String description,
    DeclaredLicense declaredLicense,
    List<String> keywords,
    List<Party> parties,
    List<DependentPackage> dependencies,
    String homepageUrl,
    String vcsUrl,
    String bugTrackingUrl,
    String codeViewUrl,
    String repositoryHomepageUrl,
    String repositoryDownloadUrl,
    String apiDataUrl,
    Map<String, String> extraUrls,
    String sha256,
    List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public PackageRecord {
        Objects.requireNonNull(datasourceId, "datasourceId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (declaredLicense == null) {
            declaredLicense = DeclaredLicense.none();
        }
        keywords = keywords != null ? List.copyOf(new LinkedHashSet<>(keywords)) : List.of();
        parties = parties != null ? List.copyOf(parties) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        extraUrls = extraUrls != null ? Collections.unmodifiableMap(new LinkedHashMap<>(extraUrls)) : Map.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /**
     * Returns true when some descriptor content could not be represented.
     *
     * @return true if any warning was recorded
     */
    public boolean isPartial() {
        return !warnings.isEmpty();
    }

    /**
     * Starts a builder for a record of the given datasource.
     *
     * @param datasourceId descriptor format identifier
     * @return new builder with type "pypi" and language "Python"
     */
    public static Builder builder(String datasourceId) {
        return new Builder(datasourceId);
    }

    /**
     * Mutable assembly helper; the built record is immutable.
     */
    public static final class Builder {
        private final String datasourceId;
        private String type = PackageTypes.PYPI;
        private String primaryLanguage = PackageTypes.PYTHON;
        private String name;
        private String version;
        private String description;
        private DeclaredLicense declaredLicense = DeclaredLicense.none();
        private final List<String> keywords = new ArrayList<>();
        private final List<Party> parties = new ArrayList<>();
        private final List<DependentPackage> dependencies = new ArrayList<>();
        private String homepageUrl;
        private String vcsUrl;
        private String bugTrackingUrl;
        private String codeViewUrl;
        private String repositoryHomepageUrl;
        private String repositoryDownloadUrl;
        private String apiDataUrl;
        private final Map<String, String> extraUrls = new LinkedHashMap<>();
        private String sha256;
        private final List<String> warnings = new ArrayList<>();

        private Builder(String datasourceId) {
            this.datasourceId = Objects.requireNonNull(datasourceId, "datasourceId must not be null");
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder primaryLanguage(String primaryLanguage) {
            this.primaryLanguage = primaryLanguage;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public String version() {
            return version;
        }

        public String name() {
            return name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder declaredLicense(DeclaredLicense declaredLicense) {
            this.declaredLicense = declaredLicense;
            return this;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords.addAll(keywords);
            return this;
        }

        public Builder parties(List<Party> parties) {
            this.parties.addAll(parties);
            return this;
        }

        public Builder dependencies(List<DependentPackage> dependencies) {
            this.dependencies.addAll(dependencies);
            return this;
        }

        public Builder homepageUrl(String homepageUrl) {
            this.homepageUrl = homepageUrl;
            return this;
        }

        public Builder vcsUrl(String vcsUrl) {
            this.vcsUrl = vcsUrl;
            return this;
        }

        public Builder bugTrackingUrl(String bugTrackingUrl) {
            this.bugTrackingUrl = bugTrackingUrl;
            return this;
        }

        public Builder codeViewUrl(String codeViewUrl) {
            this.codeViewUrl = codeViewUrl;
            return this;
        }

        public Builder repositoryHomepageUrl(String repositoryHomepageUrl) {
            this.repositoryHomepageUrl = repositoryHomepageUrl;
            return this;
        }

        public Builder repositoryDownloadUrl(String repositoryDownloadUrl) {
            this.repositoryDownloadUrl = repositoryDownloadUrl;
            return this;
        }

        public Builder apiDataUrl(String apiDataUrl) {
            this.apiDataUrl = apiDataUrl;
            return this;
        }

        public Builder extraUrls(Map<String, String> extraUrls) {
            this.extraUrls.putAll(extraUrls);
            return this;
        }

        public Builder sha256(String sha256) {
            this.sha256 = sha256;
            return this;
        }

        public Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public PackageRecord build() {
            return new PackageRecord(
                datasourceId,
                type,
                primaryLanguage,
                name,
                version,
                description,
                declaredLicense,
                keywords,
                parties,
                dependencies,
                homepageUrl,
                vcsUrl,
                bugTrackingUrl,
                codeViewUrl,
                repositoryHomepageUrl,
                repositoryDownloadUrl,
                apiDataUrl,
                extraUrls,
                sha256,
                warnings
            );
        }
    }
}
