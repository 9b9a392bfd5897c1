package com.pkgmeta.core.handler.impl;

import java.util.List;
import java.util.Map;

/**
 * Core metadata read from the {@code [project]} table of a {@code pyproject.toml}.
 *
 * <p>Exposed to the normalizer through
 * {@link com.pkgmeta.core.metadata.BeanMetadata}, which publishes each
 * component under its snake_case name ({@code authorEmail} as
 * {@code author_email}).
 *
 * @param name project name
 * @param version literal version, or null when dynamic
 * @param summary one-line {@code description}
 * @param description readme text
 * @param license license text or file contents
 * @param author author names, comma separated
 * @param authorEmail author emails, comma separated
 * @param maintainer maintainer names, comma separated
 * @param maintainerEmail maintainer emails, comma separated
 * @param keywords keywords
 * @param classifiers trove classifiers
 * @param projectUrls {@code [project.urls]} in declaration order
 */
public record PyprojectMetadata(
    String name,
    String version,
    String summary,
    String description,
    String license,
    String author,
    String authorEmail,
    String maintainer,
    String maintainerEmail,
    List<String> keywords,
    List<String> classifiers,
    Map<String, String> projectUrls
) {

    public PyprojectMetadata {
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
        classifiers = classifiers != null ? List.copyOf(classifiers) : List.of();
        projectUrls = projectUrls != null ? projectUrls : Map.of();
    }
}
