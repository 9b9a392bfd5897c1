package com.pkgmeta.core.handler.impl;

import com.pkgmeta.core.handler.HandlerTestBase;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import com.pkgmeta.core.model.PartyRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link PyprojectTomlHandler}.
 */
class PyprojectTomlHandlerTest extends HandlerTestBase {

    private PyprojectTomlHandler handler;

    @BeforeEach
    void setUpHandler() {
        handler = new PyprojectTomlHandler();
    }

    @Test
    void parse_withProjectTable_extractsMetadata() throws IOException {
        // Given: a PEP 621 project with a readme file
        Path file = createFile("pyproject.toml", """
            [build-system]
            requires = ["setuptools>=61"]
            build-backend = "setuptools.build_meta"

            [project]
            name = "toml-pkg"
            version = "3.1.0"
            description = "A TOML project"
            readme = "README.md"
            license = {text = "MIT"}
            authors = [{name = "Ada", email = "ada@example.com"}, {name = "Bob"}]
            maintainers = [{email = "team@example.com"}]
            keywords = ["toml", "packaging"]
            classifiers = [
                "License :: OSI Approved :: MIT License",
                "Development Status :: 4 - Beta",
            ]
            dependencies = ["httpx>=0.24", "attrs==23.1.0"]

            [project.optional-dependencies]
            cli = ["rich"]

            [project.urls]
            Homepage = "https://toml-pkg.dev"
            Repository = "https://github.com/acme/toml-pkg"
            Changelog = "https://github.com/acme/toml-pkg/releases"
            """);
        createFile("README.md", "# toml-pkg\nDetails\n");

        // When
        PackageRecord record = single(handler.parse(file, context));

        // Then
        assertThat(record.datasourceId()).isEqualTo("pypi_pyproject_toml");
        assertThat(record.name()).isEqualTo("toml-pkg");
        assertThat(record.version()).isEqualTo("3.1.0");
        assertThat(record.description()).isEqualTo("A TOML project\n# toml-pkg\nDetails");
        assertThat(record.declaredLicense().license()).isEqualTo("MIT");
        assertThat(record.keywords())
            .containsExactly("toml", "packaging", "Development Status :: 4 - Beta");
        assertThat(record.homepageUrl()).isEqualTo("https://toml-pkg.dev");
        assertThat(record.vcsUrl()).isEqualTo("https://github.com/acme/toml-pkg");
        assertThat(record.extraUrls()).containsOnlyKeys("Changelog");
        assertThat(record.repositoryDownloadUrl())
            .isEqualTo("https://pypi.org/packages/source/t/toml-pkg/toml-pkg-3.1.0.tar.gz");
    }

    @Test
    void parse_withAuthorTables_joinsNamesAndEmails() throws IOException {
        Path file = createFile("pyproject.toml", """
            [project]
            name = "people"
            version = "1.0"
            authors = [{name = "Ada", email = "ada@example.com"}, {name = "Bob"}]
            maintainers = [{email = "team@example.com"}]
            """);

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.parties()).hasSize(2);
        assertThat(record.parties().get(0).role()).isEqualTo(PartyRole.AUTHOR);
        assertThat(record.parties().get(0).name()).isEqualTo("Ada, Bob");
        assertThat(record.parties().get(0).email()).isEqualTo("ada@example.com");
        assertThat(record.parties().get(1).role()).isEqualTo(PartyRole.MAINTAINER);
        assertThat(record.parties().get(1).name()).isNull();
        assertThat(record.parties().get(1).email()).isEqualTo("team@example.com");
    }

    @Test
    void parse_withOptionalDependenciesAndGroups_assignsScopes() throws IOException {
        Path file = createFile("pyproject.toml", """
            [project]
            name = "grouped"
            version = "1.0"
            dependencies = ["httpx>=0.24", "attrs==23.1.0"]

            [project.optional-dependencies]
            cli = ["rich"]

            [dependency-groups]
            test = ["pytest>=7", {include-group = "lint"}]
            lint = ["ruff"]
            """);

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.dependencies()).hasSize(5);
        assertThat(dependency(record, "pkg:pypi/httpx").scope()).isEqualTo("install");
        assertThat(dependency(record, "pkg:pypi/attrs@23.1.0").resolved()).isTrue();

        DependentPackage rich = dependency(record, "pkg:pypi/rich");
        assertThat(rich.scope()).isEqualTo("cli");
        assertThat(rich.runtime()).isTrue();
        assertThat(rich.optional()).isFalse();

        DependentPackage pytest = dependency(record, "pkg:pypi/pytest");
        assertThat(pytest.scope()).isEqualTo("test");
        assertThat(pytest.runtime()).isFalse();
        assertThat(pytest.optional()).isTrue();
        assertThat(dependency(record, "pkg:pypi/ruff").scope()).isEqualTo("lint");
    }

    @Test
    void parse_withDynamicAttrVersion_recoversFromSrcLayout() throws IOException {
        Path file = createFile("pyproject.toml", """
            [project]
            name = "dyn"
            dynamic = ["version"]

            [tool.setuptools.dynamic]
            version = {attr = "dyn.__version__"}
            """);
        createFile("src/dyn/__init__.py", "__version__ = \"5.0.0\"\n");

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.version()).isEqualTo("5.0.0");
        assertThat(record.warnings()).isEmpty();
    }

    @Test
    void parse_withDynamicFileVersion_readsVersionFile() throws IOException {
        Path file = createFile("pyproject.toml", """
            [project]
            name = "filever"
            dynamic = ["version"]

            [tool.setuptools.dynamic]
            version = {file = "VERSION"}
            """);
        createFile("VERSION", "1.4.2\n");

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.version()).isEqualTo("1.4.2");
    }

    @Test
    void parse_withoutProjectTable_returnsNoRecord() throws IOException {
        Path file = createFile("pyproject.toml", """
            [tool.black]
            line-length = 100
            """);

        assertThat(handler.parse(file, context)).isEmpty();
    }
}
