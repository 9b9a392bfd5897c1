package com.pkgmeta.core.handler.impl;

import com.pkgmeta.core.handler.HandlerTestBase;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link RequirementsFileHandler}.
 */
class RequirementsFileHandlerTest extends HandlerTestBase {

    private RequirementsFileHandler handler;

    @BeforeEach
    void setUpHandler() {
        handler = new RequirementsFileHandler();
    }

    @Test
    void parse_withMixedEntries_resolvesEachKind() throws IOException {
        // Given: a requirements file with options, editables and direct references
        Path file = createFile("requirements.txt", """
            # runtime dependencies
            requests==2.31.0
            flask>=2.0,<3.0  # web framework
            -r other.txt
            --index-url https://pypi.org/simple
            -e git+https://github.com/acme/lib.git#egg=lib
            -e .
            django[argon2]>=4.2 ; python_version >= "3.8"
            numpy==1.26.* --hash=sha256:abc
            https://example.com/archive/pkg.zip
            """);

        // When
        PackageRecord record = single(handler.parse(file, context));

        // Then
        assertThat(record.datasourceId()).isEqualTo("pip_requirements");
        assertThat(record.name()).isNull();
        assertThat(record.dependencies()).hasSize(7);
        assertThat(record.dependencies()).allSatisfy(dep -> {
            assertThat(dep.scope()).isEqualTo("install");
            assertThat(dep.runtime()).isTrue();
            assertThat(dep.optional()).isFalse();
        });

        assertThat(dependency(record, "pkg:pypi/requests@2.31.0").resolved()).isTrue();
        assertThat(dependency(record, "pkg:pypi/flask").extractedRequirement()).isEqualTo("<3.0,>=2.0");
        assertThat(dependency(record, "pkg:pypi/lib").extractedRequirement())
            .isEqualTo("-e git+https://github.com/acme/lib.git#egg=lib");
        assertThat(dependency(record, "pkg:pypi/django").extractedRequirement()).isEqualTo(">=4.2");

        DependentPackage numpy = dependency(record, "pkg:pypi/numpy");
        assertThat(numpy.resolved()).isFalse();
        assertThat(numpy.extractedRequirement()).isEqualTo("==1.26.*");

        assertThat(record.dependencies())
            .filteredOn(dep -> dep.purl() == null)
            .extracting(DependentPackage::extractedRequirement)
            .containsExactly("-e .", "https://example.com/archive/pkg.zip");
    }

    @Test
    void parse_withDevRequirementsFile_usesDevelopmentScope() throws IOException {
        Path file = createFile("requirements-dev.txt", "pytest==7.0\n");

        PackageRecord record = single(handler.parse(file, context));

        DependentPackage pytest = dependency(record, "pkg:pypi/pytest@7.0");
        assertThat(pytest.scope()).isEqualTo("development");
        assertThat(pytest.runtime()).isFalse();
        assertThat(pytest.optional()).isTrue();
        assertThat(pytest.resolved()).isTrue();
    }

    @Test
    void optionsFor_withPathSuffix_picksScopeConvention() {
        assertThat(RequirementsFileHandler.optionsFor(Path.of("requirements", "test.txt")).defaultScope())
            .isEqualTo("development");
        assertThat(RequirementsFileHandler.optionsFor(Path.of("requirements-tests.txt")).defaultScope())
            .isEqualTo("development");
        assertThat(RequirementsFileHandler.optionsFor(Path.of("requirements", "base.txt")).defaultScope())
            .isEqualTo("install");
        assertThat(RequirementsFileHandler.optionsFor(Path.of("dev-requirements.in")).defaultScope())
            .isEqualTo("install");
    }

    @Test
    void parse_withContinuationAndMalformedLine_keepsValidEntries() throws IOException {
        Path file = createFile("requirements.txt", """
            requests \\
                >=2.0
            this is not valid
            click
            """);

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.dependencies())
            .extracting(dep -> dep.purl().toString())
            .containsExactly("pkg:pypi/requests", "pkg:pypi/click");
        assertThat(dependency(record, "pkg:pypi/requests").extractedRequirement()).isEqualTo(">=2.0");
    }

    @Test
    void getFilePatterns_matchesRequirementFileNames() throws IOException {
        createFile("requirements.txt", "a\n");
        createFile("requirements/prod.txt", "b\n");
        createFile("dev-requirements.in", "c\n");
        createFile("src/pkg.egg-info/requires.txt", "d\n");
        createFile("test-reqs.txt", "e\n");
        createFile("notes.txt", "not requirements\n");

        TreeSet<String> matched = new TreeSet<>();
        for (String pattern : handler.getFilePatterns()) {
            context.findFiles(pattern).forEach(p -> matched.add(tempDir.relativize(p).toString().replace('\\', '/')));
        }

        assertThat(matched).containsExactly(
            "dev-requirements.in",
            "requirements.txt",
            "requirements/prod.txt",
            "src/pkg.egg-info/requires.txt",
            "test-reqs.txt"
        );
    }
}
