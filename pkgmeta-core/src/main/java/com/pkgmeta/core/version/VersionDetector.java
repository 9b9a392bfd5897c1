package com.pkgmeta.core.version;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a literal version assignment in Python module text.
 *
 * <p>Both detectors only match an assignment at the start of a line with a
 * single- or double-quoted value. An empty value counts as no match.
 */
public enum VersionDetector {

    /** {@code __version__ = "1.2.3"} */
    DUNDER(Pattern.compile("^__version__\\s*=\\s*['\"]([^'\"]*)['\"]", Pattern.MULTILINE)),

    /** {@code version = "1.2.3"} */
    PLAIN(Pattern.compile("^version\\s*=\\s*['\"]([^'\"]*)['\"]", Pattern.MULTILINE));

    private final Pattern pattern;

    VersionDetector(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Searches module text for the first assignment.
     *
     * @param content module source
     * @return trimmed version, or empty if none or blank
     */
    public Optional<String> detect(String content) {
        if (content == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(content);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String version = matcher.group(1).strip();
        return version.isEmpty() ? Optional.empty() : Optional.of(version);
    }
}
