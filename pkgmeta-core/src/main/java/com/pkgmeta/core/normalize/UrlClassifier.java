package com.pkgmeta.core.normalize;

import com.pkgmeta.core.metadata.AttributeResolver;
import com.pkgmeta.core.metadata.MetadataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps labeled URLs onto canonical roles.
 *
 * <p>Slots are filled first-match-wins in discovery order: the homepage field,
 * then each project URL, then the download URL (a version-control candidate).
 * A URL whose role slot is already taken, or whose label matches no role, is
 * kept in the residual bucket under its label.
 */
public final class UrlClassifier {

    private static final Logger log = LoggerFactory.getLogger(UrlClassifier.class);

    static final String DOWNLOAD_URL_LABEL = "Download-URL";
    static final String UNLABELED_URL_LABEL = "Project-URL";

    private UrlClassifier() {
        // Utility class
    }

    /**
     * Classifies the URL fields of a metadata source.
     *
     * <p>The homepage comes from {@code Home-page}, {@code url} or {@code home};
     * project URLs from the multi-valued {@code Project-URL} field or a
     * {@code project_urls} mapping; the download URL from {@code Download-URL}.
     *
     * @param source metadata source
     * @return classified URLs
     */
    public static ClassifiedUrls classify(MetadataSource source) {
        String homepage = AttributeResolver.getFirstString(source, "Home-page", "url", "home");
        String downloadUrl = AttributeResolver.getString(source, "Download-URL");
        return classify(homepage, projectUrls(source), downloadUrl);
    }

    /**
     * Classifies explicit URL inputs.
     *
     * @param homepage homepage field, may be null
     * @param projectUrls labeled project URLs in declaration order
     * @param downloadUrl download URL field, may be null
     * @return classified URLs
     */
    public static ClassifiedUrls classify(String homepage, List<LabeledUrl> projectUrls, String downloadUrl) {
        Map<UrlRole, String> slots = new EnumMap<>(UrlRole.class);
        Map<String, String> extra = new LinkedHashMap<>();

        if (homepage != null && !homepage.isBlank()) {
            slots.put(UrlRole.HOMEPAGE, homepage.trim());
        }

        for (LabeledUrl projectUrl : projectUrls) {
            if (projectUrl.url().isEmpty()) {
                continue;
            }
            String label = projectUrl.isLabeled() ? projectUrl.label() : UNLABELED_URL_LABEL;
            Optional<UrlRole> role = UrlRole.forLabel(projectUrl.label());
            if (role.isPresent()) {
                assign(slots, extra, role.get(), label, projectUrl.url());
            } else {
                extra.putIfAbsent(label, projectUrl.url());
            }
        }

        if (downloadUrl != null && !downloadUrl.isBlank()) {
            assign(slots, extra, UrlRole.VCS, DOWNLOAD_URL_LABEL, downloadUrl.trim());
        }

        return new ClassifiedUrls(
            slots.get(UrlRole.HOMEPAGE),
            slots.get(UrlRole.VCS),
            slots.get(UrlRole.BUG_TRACKING),
            slots.get(UrlRole.CODE_VIEW),
            extra
        );
    }

    private static void assign(Map<UrlRole, String> slots, Map<String, String> extra,
                               UrlRole role, String label, String url) {
        if (slots.putIfAbsent(role, url) == null) {
            log.debug("Classified {} as {}", url, role);
        } else {
            extra.putIfAbsent(label, url);
        }
    }

    private static List<LabeledUrl> projectUrls(MetadataSource source) {
        List<LabeledUrl> urls = new ArrayList<>();
        List<Object> entries = AttributeResolver.getAttributes(source, "Project-URL");
        if (entries.isEmpty()) {
            entries = AttributeResolver.getAttributes(source, "project_urls");
        }
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> labeled) {
                labeled.forEach((label, url) -> {
                    if (label != null && url != null) {
                        urls.add(new LabeledUrl(label.toString(), url.toString()));
                    }
                });
            } else if (entry != null) {
                urls.add(LabeledUrl.parse(entry.toString()));
            }
        }
        return urls;
    }
}
