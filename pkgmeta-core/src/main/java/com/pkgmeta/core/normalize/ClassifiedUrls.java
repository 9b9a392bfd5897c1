package com.pkgmeta.core.normalize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of URL classification.
 *
 * @param homepageUrl homepage
 * @param vcsUrl version control
 * @param bugTrackingUrl issue tracker
 * @param codeViewUrl source browser
 * @param extraUrls residual URLs keyed by label
 */
public record ClassifiedUrls(
    String homepageUrl,
    String vcsUrl,
    String bugTrackingUrl,
    String codeViewUrl,
    Map<String, String> extraUrls
) {
    public ClassifiedUrls {
        extraUrls = extraUrls != null ? Collections.unmodifiableMap(new LinkedHashMap<>(extraUrls)) : Map.of();
    }
}
