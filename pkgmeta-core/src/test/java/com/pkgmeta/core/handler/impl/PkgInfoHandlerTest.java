package com.pkgmeta.core.handler.impl;

import com.pkgmeta.core.handler.DescriptorParseException;
import com.pkgmeta.core.handler.HandlerTestBase;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import com.pkgmeta.core.model.Party;
import com.pkgmeta.core.model.PartyRole;
import com.pkgmeta.core.model.PartyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Functional tests for {@link PkgInfoHandler}.
 */
class PkgInfoHandlerTest extends HandlerTestBase {

    private static final String PKG_INFO = """
        Metadata-Version: 2.1
        Name: sample-pkg
        Version: 1.2.0
        Summary: A sample package
        Home-page: https://example.com
        Author: Jane Doe
        Author-email: jane@example.com
        License: MIT
        Keywords: sample,demo
        Project-URL: Bug Tracker, https://github.com/acme/sample/issues
        Project-URL: Source, https://github.com/acme/sample
        Classifier: License :: OSI Approved :: MIT License
        Classifier: Programming Language :: Python :: 3
        Requires-Dist: requests (>=2.0)
        Requires-Dist: pytest==7.0; extra == "test"

        A sample package
        Long description here.
        """;

    private PkgInfoHandler handler;

    @BeforeEach
    void setUpHandler() {
        handler = new PkgInfoHandler();
    }

    @Test
    void parse_withFullHeaderBlock_extractsCoreFields() throws IOException {
        // Given: a complete sdist PKG-INFO
        Path file = createFile("PKG-INFO", PKG_INFO);

        // When: the handler parses it
        PackageRecord record = single(handler.parse(file, context));

        // Then: the common fields are normalized
        assertThat(record.datasourceId()).isEqualTo("pypi_sdist_pkginfo");
        assertThat(record.type()).isEqualTo("pypi");
        assertThat(record.primaryLanguage()).isEqualTo("Python");
        assertThat(record.name()).isEqualTo("sample-pkg");
        assertThat(record.version()).isEqualTo("1.2.0");
        assertThat(record.description()).isEqualTo("A sample package\nLong description here.");
        assertThat(record.declaredLicense().license()).isEqualTo("MIT");
        assertThat(record.declaredLicense().classifiers())
            .containsExactly("License :: OSI Approved :: MIT License");
        assertThat(record.keywords())
            .containsExactly("sample", "demo", "Programming Language :: Python :: 3");
        assertThat(record.parties())
            .containsExactly(new Party(PartyType.PERSON, "Jane Doe", PartyRole.AUTHOR, "jane@example.com"));
        assertThat(record.isPartial()).isFalse();
    }

    @Test
    void parse_withProjectUrls_classifiesByLabel() throws IOException {
        Path file = createFile("PKG-INFO", PKG_INFO);

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.homepageUrl()).isEqualTo("https://example.com");
        assertThat(record.bugTrackingUrl()).isEqualTo("https://github.com/acme/sample/issues");
        assertThat(record.codeViewUrl()).isEqualTo("https://github.com/acme/sample");
        assertThat(record.vcsUrl()).isNull();
        assertThat(record.extraUrls()).isEmpty();
    }

    @Test
    void parse_withNameAndVersion_computesRegistryUrls() throws IOException {
        Path file = createFile("PKG-INFO", PKG_INFO);

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.repositoryHomepageUrl()).isEqualTo("https://pypi.org/project/sample-pkg");
        assertThat(record.repositoryDownloadUrl())
            .isEqualTo("https://pypi.org/packages/source/s/sample-pkg/sample-pkg-1.2.0.tar.gz");
        assertThat(record.apiDataUrl()).isEqualTo("https://pypi.org/pypi/sample-pkg/1.2.0/json");
    }

    @Test
    void parse_withRequiresDist_resolvesDependencies() throws IOException {
        Path file = createFile("PKG-INFO", PKG_INFO);

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.dependencies()).hasSize(2);

        DependentPackage requests = dependency(record, "pkg:pypi/requests");
        assertThat(requests.scope()).isEqualTo("install");
        assertThat(requests.runtime()).isTrue();
        assertThat(requests.optional()).isFalse();
        assertThat(requests.resolved()).isFalse();
        assertThat(requests.extractedRequirement()).isEqualTo(">=2.0");

        DependentPackage pytest = dependency(record, "pkg:pypi/pytest@7.0");
        assertThat(pytest.scope()).isEqualTo("test");
        assertThat(pytest.resolved()).isTrue();
        assertThat(pytest.extractedRequirement()).isEqualTo("==7.0");
    }

    @Test
    void parse_inEggInfoWithoutRequiresDist_readsRequiresTxt() throws IOException {
        // Given: an egg-info directory with a requires.txt next to PKG-INFO
        Path file = createFile("sample.egg-info/PKG-INFO", """
            Metadata-Version: 1.1
            Name: sample
            Version: 0.1
            """);
        createFile("sample.egg-info/requires.txt", """
            click>=7.0

            [dev]
            pytest
            """);

        // When
        PackageRecord record = single(handler.parse(file, context));

        // Then: requires.txt sections become scopes
        assertThat(record.dependencies()).hasSize(2);
        assertThat(dependency(record, "pkg:pypi/click").scope()).isEqualTo("install");
        assertThat(dependency(record, "pkg:pypi/pytest").scope()).isEqualTo("dev");
    }

    @Test
    void parse_outsideEggInfo_ignoresRequiresTxt() throws IOException {
        Path file = createFile("dist/PKG-INFO", """
            Metadata-Version: 1.1
            Name: sample
            Version: 0.1
            """);
        createFile("dist/requires.txt", "click\n");

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.dependencies()).isEmpty();
    }

    @Test
    void parse_withPaddedDescriptionHeader_stripsLegacyPadding() throws IOException {
        Path file = createFile("PKG-INFO", "Metadata-Version: 1.0\n"
            + "Name: legacy\n"
            + "Version: 0.0.1\n"
            + "Description: First line\n"
            + "        second line\n"
            + "        third line\n");

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.description()).isEqualTo("First line\nsecond line\nthird line");
    }

    @Test
    void parse_withUnknownLicensePlaceholder_dropsLicenseText() throws IOException {
        Path file = createFile("PKG-INFO", """
            Metadata-Version: 1.0
            Name: unknown-license
            Version: 1.0
            License: UNKNOWN
            """);

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.declaredLicense().license()).isNull();
        assertThat(record.declaredLicense().isEmpty()).isTrue();
    }

    @Test
    void parse_withoutHeaderBlock_throwsParseException() throws IOException {
        Path file = createFile("PKG-INFO", "this is not metadata\n");

        assertThatThrownBy(() -> handler.parse(file, context))
            .isInstanceOf(DescriptorParseException.class)
            .hasMessageContaining("PKG-INFO");
    }
}
