package com.pkgmeta.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Ecosystem-qualified package reference rendered in package-URL form,
 * e.g. {@code pkg:pypi/requests@2.31.0}.
 *
 * @param type package type (e.g. "pypi")
 * @param namespace optional namespace, null for PyPI
 * @param name package name
 * @param version optional version
 */
public record PackageUrl(
    String type,
    String namespace,
    String name,
    String version
) {
    private static final String SCHEME = "pkg:";
    private static final String UNRESERVED = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789.-_~";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    /**
     * Compact constructor with validation.
     */
    public PackageUrl {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (version != null && version.isBlank()) {
            version = null;
        }
    }

    /**
     * Creates an unversioned reference.
     *
     * @param type package type
     * @param name package name
     * @return reference without a version
     */
    public static PackageUrl of(String type, String name) {
        return new PackageUrl(type, null, name, null);
    }

    /**
     * Returns a copy of this reference carrying the given version.
     *
     * @param newVersion version to attach
     * @return versioned reference
     */
    public PackageUrl withVersion(String newVersion) {
        return new PackageUrl(type, namespace, name, newVersion);
    }

    public boolean hasVersion() {
        return version != null;
    }

    @JsonValue
    @Override
    public String toString() {
        StringBuilder purl = new StringBuilder(SCHEME).append(type).append('/');
        if (namespace != null && !namespace.isEmpty()) {
            purl.append(encode(namespace)).append('/');
        }
        purl.append(encode(name));
        if (version != null) {
            purl.append('@').append(encode(version));
        }
        return purl.toString();
    }

    private static String encode(String segment) {
        StringBuilder encoded = new StringBuilder();
        for (byte b : segment.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xFF);
            if (b >= 0 && UNRESERVED.indexOf(c) >= 0) {
                encoded.append(c);
            } else {
                encoded.append('%').append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
            }
        }
        return encoded.toString();
    }
}
