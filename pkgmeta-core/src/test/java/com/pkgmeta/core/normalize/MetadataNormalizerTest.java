package com.pkgmeta.core.normalize;

import com.pkgmeta.core.metadata.HeaderMetadata;
import com.pkgmeta.core.metadata.MappingMetadata;
import com.pkgmeta.core.model.PackageRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MetadataNormalizer}.
 */
class MetadataNormalizerTest {

    @TempDir
    Path tempDir;

    @Test
    void normalize_withHeaderSource_fillsCommonFields() {
        HeaderMetadata source = HeaderMetadata.builder()
            .header("Name", "demo")
            .header("Version", "1.2")
            .header("Summary", "Demo package")
            .header("Keywords", "alpha,beta")
            .header("Author", "Ann")
            .header("Home-page", "https://demo.example.org")
            .payload("Long text")
            .build();

        PackageRecord record = MetadataNormalizer.withRegistryUrls(
            MetadataNormalizer.normalize("pypi_sdist_pkginfo", source, null)).build();

        assertThat(record.datasourceId()).isEqualTo("pypi_sdist_pkginfo");
        assertThat(record.name()).isEqualTo("demo");
        assertThat(record.version()).isEqualTo("1.2");
        assertThat(record.description()).isEqualTo("Demo package\nLong text");
        assertThat(record.keywords()).containsExactly("alpha", "beta");
        assertThat(record.parties()).hasSize(1);
        assertThat(record.homepageUrl()).isEqualTo("https://demo.example.org");
        assertThat(record.repositoryHomepageUrl()).isEqualTo("https://pypi.org/project/demo");
        assertThat(record.apiDataUrl()).isEqualTo("https://pypi.org/pypi/demo/1.2/json");
    }

    @Test
    void description_withoutBody_readsLegacyDescriptionFile() throws IOException {
        Files.writeString(tempDir.resolve("DESCRIPTION.rst"), "Legacy body\n");
        Path descriptor = tempDir.resolve("setup.py");
        MappingMetadata source = new MappingMetadata(Map.of("summary", "Short"));

        assertThat(MetadataNormalizer.description(source, descriptor)).isEqualTo("Short\nLegacy body");
    }

    @Test
    void description_withDescriptionField_prefersItOverLegacyFile() throws IOException {
        Files.writeString(tempDir.resolve("DESCRIPTION.rst"), "Legacy body");
        MappingMetadata source = new MappingMetadata(Map.of("Description", "Field body"));

        assertThat(MetadataNormalizer.description(source, tempDir.resolve("setup.py"))).isEqualTo("Field body");
    }

    @Test
    void withRegistryUrls_usesFinalNameAndVersion() {
        PackageRecord.Builder builder = PackageRecord.builder("pypi_setup_py").name("late");
        builder.version("3.0");

        PackageRecord record = MetadataNormalizer.withRegistryUrls(builder).build();

        assertThat(record.repositoryDownloadUrl())
            .isEqualTo("https://pypi.org/packages/source/l/late/late-3.0.tar.gz");
    }
}
