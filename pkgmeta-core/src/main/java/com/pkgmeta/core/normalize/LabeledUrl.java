package com.pkgmeta.core.normalize;

import java.util.Objects;

/**
 * A URL with the label a descriptor attached to it, e.g. a
 * {@code Project-URL: Bug Tracker, https://...} header.
 *
 * @param label label as written, trimmed; empty for an unlabeled URL
 * @param url URL text, trimmed
 */
public record LabeledUrl(String label, String url) {

    public LabeledUrl {
        label = label == null ? "" : label.trim();
        url = Objects.requireNonNull(url, "url must not be null").trim();
    }

    /**
     * Parses {@code "label, url"}; text without a comma is an unlabeled URL.
     *
     * @param text project URL entry
     * @return parsed entry
     */
    public static LabeledUrl parse(String text) {
        int comma = text.indexOf(',');
        if (comma < 0) {
            return new LabeledUrl("", text);
        }
        return new LabeledUrl(text.substring(0, comma), text.substring(comma + 1));
    }

    public boolean isLabeled() {
        return !label.isEmpty();
    }
}
