package com.pkgmeta.core.requirement;

import com.pkgmeta.core.model.DependentPackage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RequirementResolver}.
 */
class RequirementResolverTest {

    @Test
    void resolve_withSingleEquality_pinsVersion() {
        DependentPackage dependency = RequirementResolver.resolve("Requests==2.31.0", ResolutionOptions.install());

        assertThat(dependency.purl()).hasToString("pkg:pypi/requests@2.31.0");
        assertThat(dependency.resolved()).isTrue();
        assertThat(dependency.extractedRequirement()).isEqualTo("==2.31.0");
        assertThat(dependency.scope()).isEqualTo("install");
        assertThat(dependency.runtime()).isTrue();
        assertThat(dependency.optional()).isFalse();
    }

    @Test
    void resolve_withRange_isUnresolvedAndKeepsCanonicalSpecifiers() {
        DependentPackage dependency = RequirementResolver.resolve("lxml >= 4.9, < 6", ResolutionOptions.install());

        assertThat(dependency.purl()).hasToString("pkg:pypi/lxml");
        assertThat(dependency.resolved()).isFalse();
        assertThat(dependency.extractedRequirement()).isEqualTo("<6,>=4.9");
    }

    @Test
    void resolve_withEqualityPlusExclusion_isUnresolved() {
        DependentPackage dependency = RequirementResolver.resolve("pkg==1.0,!=1.0.1", ResolutionOptions.install());

        assertThat(dependency.resolved()).isFalse();
        assertThat(dependency.purl().hasVersion()).isFalse();
    }

    @Test
    void resolve_withWildcardEquality_isUnresolved() {
        DependentPackage dependency = RequirementResolver.resolve("pkg==3.*", ResolutionOptions.install());

        assertThat(dependency.resolved()).isFalse();
        assertThat(dependency.extractedRequirement()).isEqualTo("==3.*");
    }

    @Test
    void resolve_withoutSpecifiers_reportsRequirementText() {
        DependentPackage dependency = RequirementResolver.resolve("colorama; os_name == 'nt'", ResolutionOptions.install());

        assertThat(dependency.extractedRequirement()).isEqualTo("colorama; os_name == 'nt'");
        assertThat(dependency.scope()).isEqualTo("install");
    }

    @Test
    void resolve_withExtraMarker_usesExtraAsScope() {
        DependentPackage dependency = RequirementResolver.resolve(
            "pytest>=7; python_version >= '3.8' and extra == \"test\"", ResolutionOptions.install());

        assertThat(dependency.scope()).isEqualTo("test");
        assertThat(dependency.runtime()).isTrue();
    }

    @Test
    void resolve_withDevelopmentOptions_appliesFlags() {
        DependentPackage dependency = RequirementResolver.resolve("black", ResolutionOptions.development());

        assertThat(dependency.scope()).isEqualTo("development");
        assertThat(dependency.runtime()).isFalse();
        assertThat(dependency.optional()).isTrue();
    }

    @Test
    void resolve_withMalformedRequirement_throws() {
        assertThatThrownBy(() -> RequirementResolver.resolve("pkg >>1", ResolutionOptions.install()))
            .isInstanceOf(RequirementSyntaxException.class);
    }

    @Test
    void unnamed_buildsRecordWithoutPurl() {
        DependentPackage dependency = RequirementResolver.unnamed("./vendor/pkg", ResolutionOptions.install());

        assertThat(dependency.purl()).isNull();
        assertThat(dependency.resolved()).isFalse();
        assertThat(dependency.extractedRequirement()).isEqualTo("./vendor/pkg");
    }

    @Test
    void resolveAll_skipsBlankAndMalformedEntries() {
        List<DependentPackage> dependencies = RequirementResolver.resolveAll(
            Arrays.asList("a", null, "  ", "b >>1", "c==1"), ResolutionOptions.install());

        assertThat(dependencies).extracting(dep -> dep.purl().name()).containsExactly("a", "c");
    }

    @ParameterizedTest
    @CsvSource({
        "Django, django",
        "zope.interface, zope-interface",
        "Foo__Bar-.baz, foo-bar-baz",
        "' padded ', padded"
    })
    void canonicalizeName_collapsesSeparatorsAndLowerCases(String input, String expected) {
        assertThat(RequirementResolver.canonicalizeName(input)).isEqualTo(expected);
    }
}
