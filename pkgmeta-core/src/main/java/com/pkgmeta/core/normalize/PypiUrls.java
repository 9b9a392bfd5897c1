package com.pkgmeta.core.normalize;

/**
 * Package registry URLs computed from a name and version.
 *
 * @param repositoryHomepageUrl registry project page, null without a name
 * @param repositoryDownloadUrl source archive download, null without name and version
 * @param apiDataUrl registry JSON API, versioned when a version is known
 */
public record PypiUrls(
    String repositoryHomepageUrl,
    String repositoryDownloadUrl,
    String apiDataUrl
) {
    private static final String REGISTRY = "https://pypi.org";

    /**
     * @param name package name, may be null
     * @param version package version, may be null
     * @return computed URLs
     */
    public static PypiUrls of(String name, String version) {
        if (name == null || name.isBlank()) {
            return new PypiUrls(null, null, null);
        }
        String homepage = REGISTRY + "/project/" + name;
        if (version == null || version.isBlank()) {
            return new PypiUrls(homepage, null, REGISTRY + "/pypi/" + name + "/json");
        }
        String download = REGISTRY + "/packages/source/" + name.charAt(0) + "/" + name + "/"
            + name + "-" + version + ".tar.gz";
        return new PypiUrls(homepage, download, REGISTRY + "/pypi/" + name + "/" + version + "/json");
    }
}
