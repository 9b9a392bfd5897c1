package com.pkgmeta.core.normalize;

import com.pkgmeta.core.metadata.AttributeResolver;
import com.pkgmeta.core.metadata.MetadataSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Description and keyword cleanup.
 *
 * <p>Legacy metadata pads every continuation line of a multi-line field with
 * eight spaces; {@link #cleanDescription(String)} removes that padding when it
 * is detected on one of the first two lines and leaves other text untouched.
 */
public final class TextNormalizer {

    private static final String LEGACY_PADDING = " ".repeat(8);
    private static final int PADDING_PROBE_LINES = 2;
    private static final String KEYWORD_SEPARATOR = ",";

    private TextNormalizer() {
        // Utility class
    }

    /**
     * Combines a one-line summary and a long description.
     *
     * <p>When the body already starts with the summary the body is returned alone.
     *
     * @param summary one-line summary, may be null
     * @param body long description, may be null
     * @return combined text, or null if both are empty
     */
    public static String buildDescription(String summary, String body) {
        String cleanSummary = blankToNull(summary);
        String cleanBody = blankToNull(body);
        if (cleanSummary != null && cleanBody != null) {
            if (cleanBody.startsWith(cleanSummary)) {
                return cleanBody;
            }
            return cleanSummary + "\n" + cleanBody;
        }
        return cleanSummary != null ? cleanSummary : cleanBody;
    }

    /**
     * Trims a description and strips legacy 8-space line padding.
     *
     * <p>Padding is stripped until neither of the first two lines starts with it,
     * so applying this method twice gives the same result as applying it once.
     *
     * @param text raw description, may be null
     * @return cleaned text, or null when blank
     */
    public static String cleanDescription(String text) {
        String description = blankToNull(text);
        if (description == null) {
            return null;
        }
        List<String> lines = description.lines().collect(Collectors.toCollection(ArrayList::new));
        while (needsCleaning(lines)) {
            lines.replaceAll(line -> line.startsWith(LEGACY_PADDING) ? line.substring(LEGACY_PADDING.length()) : line);
        }
        return String.join("\n", lines);
    }

    /**
     * Collects keywords from the {@code Keywords} field plus every classifier
     * that is not a license classifier.
     *
     * @param source metadata source
     * @return keywords in discovery order, may contain duplicates
     */
    public static List<String> extractKeywords(MetadataSource source) {
        List<String> keywords = new ArrayList<>();
        Object raw = AttributeResolver.getAttribute(source, "Keywords");
        if (raw instanceof String text) {
            addTrimmed(keywords, List.of(text.split(KEYWORD_SEPARATOR)));
        } else if (raw instanceof Collection<?> values) {
            addTrimmed(keywords, values);
        } else if (raw != null) {
            addTrimmed(keywords, List.of(String.valueOf(raw)));
        }
        keywords.addAll(ClassifierSplitter.split(source).otherClassifiers());
        return keywords;
    }

    private static void addTrimmed(List<String> target, Collection<?> values) {
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            String keyword = value.toString().trim();
            if (!keyword.isEmpty()) {
                target.add(keyword);
            }
        }
    }

    private static boolean needsCleaning(List<String> lines) {
        return lines.stream()
            .limit(PADDING_PROBE_LINES)
            .anyMatch(line -> line.startsWith(LEGACY_PADDING));
    }

    static String blankToNull(String text) {
        if (text == null) {
            return null;
        }
        String stripped = text.strip();
        return stripped.isEmpty() ? null : stripped;
    }
}
