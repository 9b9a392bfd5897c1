package com.pkgmeta.core.handler.impl.util;

import com.pkgmeta.core.handler.DescriptorParseException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SetupPyAstParser}.
 */
class SetupPyAstParserTest {

    private static final Path FILE = Path.of("setup.py");

    @Test
    void parse_withLiteralStrings_decodesQuotingAndConcatenation() throws DescriptorParseException {
        SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(FILE, """
            from setuptools import setup
            setup(
                name="quoted",
                description='implicit ' "concatenation",
                long_description=\"\"\"line one
            line two\"\"\",
                author=r'C:\\raw',
            )
            """);

        assertThat(arguments.values())
            .containsEntry("name", "quoted")
            .containsEntry("description", "implicit concatenation")
            .containsEntry("long_description", "line one\nline two")
            .containsEntry("author", "C:\\raw");
        assertThat(arguments.nonLiteralKeys()).isEmpty();
    }

    @Test
    void parse_withListsTuplesAndDicts_convertsToJavaCollections() throws DescriptorParseException {
        SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(FILE, """
            import setuptools

            setuptools.setup(
                keywords=('a', 'b'),
                install_requires=['x>=1', 'y'],
                extras_require={'dev': ['pytest'], 'docs': 'sphinx'},
            )
            """);

        assertThat(arguments.values().get("keywords")).isEqualTo(List.of("a", "b"));
        assertThat(arguments.values().get("install_requires")).isEqualTo(List.of("x>=1", "y"));
        assertThat(arguments.values().get("extras_require"))
            .isEqualTo(Map.of("dev", List.of("pytest"), "docs", "sphinx"));
    }

    @Test
    void parse_withAssignedSetupResult_readsCall() throws DescriptorParseException {
        SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(FILE, "dist = setup(name='assigned')\n");

        assertThat(arguments.values()).containsEntry("name", "assigned");
    }

    @Test
    void parse_withFormattedString_treatsValueAsNonLiteral() throws DescriptorParseException {
        SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(FILE, """
            NAME = 'x'
            setup(name=f'{NAME}-pkg', version=read_version(), url='https://x.org')
            """);

        assertThat(arguments.values()).containsOnlyKeys("url");
        assertThat(arguments.nonLiteralKeys()).containsExactly("name", "version");
    }

    @Test
    void parse_withNonLiteralDictEntries_dropsThemWithWarning() throws DescriptorParseException {
        SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(FILE, """
            setup(
                extras_require={'ok': ['a'], 'bad': get_extras(), **more},
                entry_points={'console_scripts': ['tool=pkg:main']},
            )
            """);

        assertThat(arguments.values().get("extras_require")).isEqualTo(Map.of("ok", List.of("a")));
        assertThat(arguments.warnings()).singleElement().asString()
            .contains("extras_require")
            .contains("2 non-literal dict entries");
    }

    @Test
    void parse_withCommentsAndLambda_ignoresThem() throws DescriptorParseException {
        SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(FILE, """
            # setup('commented', out)
            setup(
                name='commented',  # trailing comment
                cmdclass={'build': lambda: None},
            )
            """);

        assertThat(arguments.values()).containsEntry("name", "commented");
    }

    @Test
    void parse_withoutSetupCall_returnsEmptyArguments() throws DescriptorParseException {
        SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(FILE, "print('hello')\n");

        assertThat(arguments.values()).isEmpty();
        assertThat(arguments.nonLiteralKeys()).isEmpty();
        assertThat(arguments.warnings()).isEmpty();
    }

    @Test
    void parse_withEscapesAndPrefixes_decodesLiteralValue() throws DescriptorParseException {
        SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(FILE, """
            setup(name=u'caf\\xe9', description='tab\\tline\\n', url="a\\"b")
            """);

        assertThat(arguments.values())
            .containsEntry("name", "café")
            .containsEntry("description", "tab\tline\n")
            .containsEntry("url", "a\"b");
    }

    @Test
    void parse_withIndentedSetupCall_ignoresNestedStatement() throws DescriptorParseException {
        SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(FILE, """
            if __name__ == '__main__':
                setup(name='nested')
            """);

        assertThat(arguments.values()).isEmpty();
    }

    @Test
    void parse_withNestedCallInList_dropsElementWithWarning() throws DescriptorParseException {
        SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(FILE, """
            setup(
                name='x',
                packages=find_packages(exclude=['tests']),
                install_requires=['a', read_requirement('b'), *EXTRA],
                classifiers=[c for c in CLASSIFIERS if c],
            )
            """);

        assertThat(arguments.values().get("install_requires")).isEqualTo(List.of("a"));
        assertThat(arguments.nonLiteralKeys()).containsExactly("packages");
        assertThat(arguments.warnings()).hasSize(2);
        assertThat(arguments.warnings().get(0))
            .contains("install_requires")
            .contains("read_requirement(...)")
            .contains("*EXTRA");
    }

    @Test
    void parse_withUnterminatedString_throwsParseException() {
        assertThatThrownBy(() -> SetupPyAstParser.parse(FILE, "setup(name='broken)\n"))
            .isInstanceOf(DescriptorParseException.class)
            .hasMessageContaining("unterminated string literal at line 1");
    }

    @Test
    void parse_withUnbalancedBrackets_throwsParseException() {
        assertThatThrownBy(() -> SetupPyAstParser.parse(FILE, "setup(name='open',\n"))
            .isInstanceOf(DescriptorParseException.class)
            .hasMessageContaining("syntax error");
    }

    @Test
    void decodeString_withRawAndEmptyLiterals_keepsBackslashes() {
        assertThat(SetupPyAstParser.decodeString("r'''a\\nb'''")).isEqualTo("a\\nb");
        assertThat(SetupPyAstParser.decodeString("''")).isEmpty();
    }
}
