package com.pkgmeta.core.handler.impl;

import com.pkgmeta.core.config.ExtractionConfig;
import com.pkgmeta.core.handler.DescriptorParseException;
import com.pkgmeta.core.handler.HandlerTestBase;
import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.model.PackageRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Functional tests for {@link SetupPyHandler}.
 */
class SetupPyHandlerTest extends HandlerTestBase {

    private SetupPyHandler handler;

    @BeforeEach
    void setUpHandler() {
        handler = new SetupPyHandler();
    }

    @Test
    void parse_withLiteralArguments_extractsMetadataAndScopes() throws IOException {
        // Given: a setup.py using only literal keyword arguments
        Path file = createFile("setup.py", """
            from setuptools import setup, find_packages

            setup(
                name='my-package',
                version='1.0.0',
                description='Short summary',
                long_description='Longer text',
                author='Jane Doe',
                author_email='jane@example.com',
                url='https://example.com',
                license='Apache-2.0',
                keywords=['alpha', 'beta'],
                classifiers=[
                    'License :: OSI Approved :: Apache Software License',
                    'Topic :: Utilities',
                ],
                project_urls={
                    'Source': 'https://github.com/acme/my-package',
                    'Tracker': 'https://github.com/acme/my-package/issues',
                },
                packages=find_packages(),
                install_requires=['numpy>=1.24.0', 'pandas==2.0.0'],
                tests_require=['pytest'],
                setup_requires=['wheel'],
                extras_require={'docs': ['sphinx>=5']},
            )
            """);

        // When
        PackageRecord record = single(handler.parse(file, context));

        // Then
        assertThat(record.name()).isEqualTo("my-package");
        assertThat(record.version()).isEqualTo("1.0.0");
        assertThat(record.description()).isEqualTo("Short summary\nLonger text");
        assertThat(record.homepageUrl()).isEqualTo("https://example.com");
        assertThat(record.codeViewUrl()).isEqualTo("https://github.com/acme/my-package");
        assertThat(record.bugTrackingUrl()).isEqualTo("https://github.com/acme/my-package/issues");
        assertThat(record.declaredLicense().license()).isEqualTo("Apache-2.0");
        assertThat(record.keywords()).containsExactly("alpha", "beta", "Topic :: Utilities");
        assertThat(record.parties()).singleElement()
            .satisfies(party -> assertThat(party.email()).isEqualTo("jane@example.com"));

        assertThat(record.dependencies())
            .extracting(DependentPackage::scope)
            .containsExactly("install", "install", "tests", "setup", "docs");
        assertThat(dependency(record, "pkg:pypi/pandas@2.0.0").resolved()).isTrue();
        assertThat(dependency(record, "pkg:pypi/numpy").extractedRequirement()).isEqualTo(">=1.24.0");
        assertThat(record.isPartial()).isFalse();
    }

    @Test
    void parse_withImportedVersion_recoversFromPackageModule() throws IOException {
        // Given: the version comes from the package's __init__.py
        Path file = createFile("setup.py", """
            from setuptools import setup
            from mypkg import __version__

            setup(name='mypkg', version=__version__)
            """);
        createFile("mypkg/__init__.py", "__version__ = \"2.3.4\"\n");

        // When
        PackageRecord record = single(handler.parse(file, context));

        // Then: the recovered version is used and nothing is reported as lost
        assertThat(record.version()).isEqualTo("2.3.4");
        assertThat(record.apiDataUrl()).isEqualTo("https://pypi.org/pypi/mypkg/2.3.4/json");
        assertThat(record.warnings()).isEmpty();
    }

    @Test
    void parse_withVersionDefinedInSetupPy_usesOwnDunderVersion() throws IOException {
        Path file = createFile("setup.py", """
            from setuptools import setup

            __version__ = '0.9.1'

            setup(
                name='selfpkg',
                version=__version__,
            )
            """);
        createFile("other/__init__.py", "__version__ = '9.9.9'\n");

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.version()).isEqualTo("0.9.1");
    }

    @Test
    void parse_withRecoveryDisabled_reportsNonLiteralVersion() throws IOException {
        Path file = createFile("setup.py", """
            from setuptools import setup
            from mypkg import __version__

            setup(name='mypkg', version=__version__)
            """);
        createFile("mypkg/__init__.py", "__version__ = \"2.3.4\"\n");
        ExtractionConfig config = new ExtractionConfig(null,
            new ExtractionConfig.VersionRecoveryConfig(false, null), null);

        PackageRecord record = single(handler.parse(file, createContext(config)));

        assertThat(record.version()).isNull();
        assertThat(record.isPartial()).isTrue();
        assertThat(record.warnings()).containsExactly("setup(version=...) is not a literal and was skipped");
    }

    @Test
    void parse_withNonLiteralListElement_keepsLiteralsAndWarns() throws IOException {
        Path file = createFile("setup.py", """
            from setuptools import setup

            setup(
                name='partial',
                version='1.0',
                install_requires=['requests', get_extra_dependency()],
            )
            """);

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.dependencies()).singleElement()
            .satisfies(dep -> assertThat(dep.purl().toString()).isEqualTo("pkg:pypi/requests"));
        assertThat(record.isPartial()).isTrue();
        assertThat(record.warnings()).singleElement().asString()
            .contains("install_requires")
            .contains("non-literal");
    }

    @Test
    void parse_withKeywordExpansion_warnsAboutUnevaluatedArguments() throws IOException {
        Path file = createFile("setup.py", """
            from setuptools import setup

            metadata = dict(name='expanded')
            setup(version='1.0', **metadata)
            """);

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.name()).isNull();
        assertThat(record.version()).isEqualTo("1.0");
        assertThat(record.warnings()).contains("setup(**...) keyword expansion was not evaluated");
    }

    @Test
    void parse_withMisspeltTestsRequires_usesTestsScope() throws IOException {
        Path file = createFile("setup.py", """
            from distutils.core import setup
            setup(name='legacy', version='0.1', tests_requires=['nose'])
            """);

        PackageRecord record = single(handler.parse(file, context));

        assertThat(dependency(record, "pkg:pypi/nose").scope()).isEqualTo("tests");
    }

    @Test
    void parse_withSetupInsideMainGuard_ignoresNestedCall() throws IOException {
        Path file = createFile("setup.py", """
            from setuptools import setup

            if __name__ == '__main__':
                setup(name='hidden', version='1.0')
            """);

        PackageRecord record = single(handler.parse(file, context));

        assertThat(record.name()).isNull();
        assertThat(record.dependencies()).isEmpty();
        assertThat(record.repositoryHomepageUrl()).isNull();
    }

    @Test
    void parse_withUnterminatedString_throwsParseException() throws IOException {
        Path file = createFile("setup.py", "setup(name='broken)\n");

        assertThatThrownBy(() -> handler.parse(file, context))
            .isInstanceOf(DescriptorParseException.class);
    }
}
